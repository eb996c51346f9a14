package fpod.reader.decode;

import fpod.reader.data.DecodedDataset;
import fpod.reader.format.PodFormat;
import fpod.reader.io.ByteSource;
import fpod.reader.record.BlockKind;

import java.io.IOException;
import java.nio.ByteBuffer;

import org.apache.log4j.Logger;

/**
 * Reads fixed-size records and hands each one to the device-specific
 * subclass.  A partial record at the end of the source ends decoding.
 */
public abstract class AbstractRecordDecoder
    implements RecordDecoder
{
    private static final Logger LOG =
        Logger.getLogger(AbstractRecordDecoder.class);

    protected final PodFormat format;

    /** Index of the last decoded click, -1 before the first. */
    protected int currentClick = -1;
    /** Minutes since logging started, -1 before the first marker. */
    protected int currentMinute = -1;

    private boolean used;

    protected AbstractRecordDecoder(final PodFormat format)
    {
        this.format = format;
    }

    @Override
    public void decode(final ByteSource source,
                       final DecodedDataset.Builder out)
        throws IOException
    {
        if (used) {
            throw new IllegalStateException("Decoder has already been used");
        }
        used = true;

        final byte[] block = new byte[format.recordSize()];
        final ByteBuffer buf = ByteBuffer.wrap(block);

        while (true) {
            final int n = source.read(block);
            if (n < block.length) {
                if (n > 0) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Ignoring " + n + "-byte partial record" +
                                  " at end of " + source.getName());
                    }
                    out.getStats().reportTruncated();
                }
                break;
            }

            out.getStats().reportBlock();
            if (!process(buf, out)) {
                break;
            }
        }

        finish(out);
    }

    /**
     * Decode one record.
     *
     * @param buf the record, position 0 and limit at the record size
     * @param out receives decoded records
     * @return <tt>false</tt> if decoding should stop
     */
    protected abstract boolean process(ByteBuffer buf,
                                       DecodedDataset.Builder out);

    /**
     * Called once after the last record.
     */
    protected abstract void finish(DecodedDataset.Builder out);

    protected void logBlock(final BlockKind kind, final ByteBuffer buf)
    {
        if (LOG.isDebugEnabled()) {
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < buf.limit(); i++) {
                hex.append(String.format("%02x", buf.get(i) & 0xff));
            }
            LOG.debug(format + " " + kind + " click " + currentClick +
                      " min " + currentMinute + ": " + hex);
        }
    }
}
