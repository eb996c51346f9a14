package fpod.reader.decode;

import fpod.reader.data.DecodedDataset;
import fpod.reader.io.ByteSource;

import java.io.IOException;

/**
 * Decodes the data region of a file, the sequence of fixed-size records
 * which follows the header block.
 *
 * A decoder holds the state of a single pass and must not be reused.
 */
public interface RecordDecoder
{
    /**
     * Consume records from the source until the data ends.
     *
     * @param source positioned at the first data record
     * @param out receives decoded records
     * @throws IOException if the source cannot be read
     */
    void decode(ByteSource source, DecodedDataset.Builder out)
            throws IOException;
}
