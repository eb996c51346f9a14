package fpod.reader.io;

import fpod.reader.format.PodFormat;

import java.nio.ByteBuffer;

/**
 * Serves file content held in memory.
 */
public class ByteBufferSource implements ByteSource
{
    private final String name;
    private final ByteBuffer data;

    /**
     * @param name file name, used to pick the format
     * @param data content from position to limit; the buffer is not
     *             modified
     */
    public ByteBufferSource(final String name, final ByteBuffer data)
    {
        this.name = name;
        this.data = data.slice();
    }

    public ByteBufferSource(final String name, final byte[] data)
    {
        this(name, ByteBuffer.wrap(data));
    }

    @Override
    public long size()
    {
        return data.limit();
    }

    @Override
    public int read(final byte[] buf)
    {
        if (!data.hasRemaining() && buf.length > 0) {
            return -1;
        }

        final int n = Math.min(buf.length, data.remaining());
        data.get(buf, 0, n);
        return n;
    }

    /**
     * Number of bytes consumed so far.
     */
    public int position()
    {
        return data.position();
    }

    @Override
    public String getExtension()
    {
        return PodFormat.extensionOf(name);
    }

    @Override
    public String getName()
    {
        return name;
    }

    @Override
    public void close()
    {
    }
}
