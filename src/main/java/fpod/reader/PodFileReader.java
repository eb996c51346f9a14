package fpod.reader;

import fpod.reader.data.DecodedDataset;
import fpod.reader.decode.RecordDecoder;
import fpod.reader.decode.RecordDecoderFactory;
import fpod.reader.format.PodFormat;
import fpod.reader.header.HeaderDecoderFactory;
import fpod.reader.header.PodHeader;
import fpod.reader.io.ByteSource;
import fpod.reader.io.FileByteSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

import org.apache.log4j.Logger;

/**
 * Reads a CPOD or FPOD data file (CP1, CP3, FP1, FP3) into memory.
 *
 * Each call decodes independently, so one reader may be shared between
 * threads.
 */
public class PodFileReader
{
    private static final Logger LOG = Logger.getLogger(PodFileReader.class);

    /** Set to <tt>false</tt> to grow the click list on demand. */
    public static final String PROP_PRESIZE =
        "fpod.reader.PodFileReader.presize";

    private final boolean presize;

    public PodFileReader()
    {
        this(Boolean.parseBoolean(System.getProperty(PROP_PRESIZE, "true")));
    }

    /**
     * @param presize if <tt>true</tt>, size the click list from the file
     *                size before decoding
     */
    public PodFileReader(final boolean presize)
    {
        this.presize = presize;
    }

    /**
     * Decode a data file.  The format is taken from the file extension.
     *
     * @param path the file
     * @return the decoded data
     * @throws PodDecodeException if the file type is unknown or the
     *                            header cannot be read
     * @throws IOException if the file cannot be opened or read
     */
    public DecodedDataset read(final Path path)
        throws IOException, PodDecodeException
    {
        // fail on a bad extension before touching the file
        PodFormat.fromFileName(String.valueOf(path.getFileName()));

        FileByteSource source = new FileByteSource(path);
        try {
            return read(source);
        } finally {
            source.close();
        }
    }

    /**
     * Decode a data file from an open source.  The source is read to the
     * end of the data but not closed.
     *
     * @param source file content, positioned at the start
     * @return the decoded data
     * @throws PodDecodeException if the file type is unknown or the
     *                            header cannot be read
     * @throws IOException if the source cannot be read
     */
    public DecodedDataset read(final ByteSource source)
        throws IOException, PodDecodeException
    {
        final PodFormat format = PodFormat.fromExtension(source.getExtension());
        final long size = source.size();

        byte[] block = new byte[format.headerSize()];
        final int n = source.read(block);
        if (n < block.length) {
            throw new PodDecodeException(String.format(
                "Unable to read %d-byte %s header from %s (got %d bytes)",
                block.length, format, source.getName(), Math.max(n, 0)));
        }

        PodHeader header = HeaderDecoderFactory.forFamily(format.family())
            .decode(ByteBuffer.wrap(block), format, source.getName());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Header of " + source.getName() + ": " + header);
        }

        DecodedDataset.Builder builder =
            new DecodedDataset.Builder(header, estimateRecords(format, size));
        RecordDecoder decoder = RecordDecoderFactory.create(header);
        decoder.decode(source, builder);

        DecodedDataset dataset = builder.build();
        LOG.info("Decoded " + source.getName() + ": " +
                 dataset.getClickCount() + " clicks, " +
                 dataset.getWaveforms().size() + " waveforms, " +
                 dataset.getEnvironment().size() + " minutes [" +
                 dataset.getStats() + "]");
        return dataset;
    }

    /**
     * Upper bound on the number of clicks in the data region.
     */
    int estimateRecords(final PodFormat format, final long size)
    {
        if (!presize) {
            return 0;
        }

        final long records = (size - format.headerSize()) / format.recordSize();
        if (records < 0) {
            return 0;
        }
        return (int) Math.min(records, Integer.MAX_VALUE - 8);
    }
}
