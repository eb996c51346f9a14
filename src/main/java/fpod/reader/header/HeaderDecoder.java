package fpod.reader.header;

import fpod.reader.format.PodFormat;

import java.nio.ByteBuffer;

/**
 * Parses the fixed-size header block at the start of a data file.
 *
 * Implementations are stateless singletons, one per device family.
 */
public interface HeaderDecoder
{
    /**
     * Decode a header block.
     *
     * @param buf buffer holding the complete header block starting at
     *            index 0
     * @param format variant of the file, selects optional fields
     * @param fileName name of the file, recorded in the header
     * @return the decoded header
     */
    PodHeader decode(ByteBuffer buf, PodFormat format, String fileName);
}
