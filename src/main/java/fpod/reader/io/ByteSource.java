package fpod.reader.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * A finite, forward-only source of file content.
 */
public interface ByteSource extends Closeable
{
    /**
     * Total size of the content in bytes.
     */
    long size() throws IOException;

    /**
     * Fill the array from the current position.  Fewer bytes than
     * requested are returned only when the source is exhausted.
     *
     * @param buf destination
     * @return the number of bytes read, -1 at end of source
     * @throws IOException on a read failure
     */
    int read(byte[] buf) throws IOException;

    /**
     * Extension of the underlying file name, without the dot.
     */
    String getExtension();

    /**
     * Name of the underlying file, for reporting.
     */
    String getName();
}
