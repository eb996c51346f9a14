package fpod.reader.decode;

import fpod.reader.header.PodHeader;

/**
 * Creates a fresh decoder for the format of a file.
 */
public class RecordDecoderFactory
{
    public static RecordDecoder create(final PodHeader header)
    {
        switch (header.getFormat().family()) {
        case CPOD:
            return new CPODRecordDecoder(header.getFormat());
        case FPOD:
            return new FPODRecordDecoder(header.getFormat(),
                                         header.getPicVersion());
        default:
            throw new IllegalArgumentException("Unknown device family " +
                                               header.getFormat().family());
        }
    }
}
