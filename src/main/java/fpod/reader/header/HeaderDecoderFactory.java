package fpod.reader.header;

import fpod.reader.format.DeviceFamily;

public class HeaderDecoderFactory
{
    public static HeaderDecoder forFamily(DeviceFamily family)
    {
        switch (family) {
        case CPOD:
            return CPODHeaderDecoder.instance;
        case FPOD:
            return FPODHeaderDecoder.instance;
        default:
            throw new IllegalArgumentException("Unknown device family " +
                                               family);
        }
    }
}
