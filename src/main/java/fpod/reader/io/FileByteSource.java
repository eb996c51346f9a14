package fpod.reader.io;

import fpod.reader.format.PodFormat;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads a data file through a file channel.
 */
public class FileByteSource implements ByteSource
{
    private final Path path;
    private final FileChannel channel;

    public FileByteSource(final Path path) throws IOException
    {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    @Override
    public long size() throws IOException
    {
        return channel.size();
    }

    @Override
    public int read(final byte[] buf) throws IOException
    {
        ByteBuffer target = ByteBuffer.wrap(buf);
        while (target.hasRemaining()) {
            if (channel.read(target) < 0) {
                break;
            }
        }

        final int n = target.position();
        if (n == 0 && buf.length > 0) {
            return -1;
        }
        return n;
    }

    @Override
    public String getExtension()
    {
        return PodFormat.extensionOf(getName());
    }

    @Override
    public String getName()
    {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    @Override
    public void close() throws IOException
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return path.toString();
    }
}
