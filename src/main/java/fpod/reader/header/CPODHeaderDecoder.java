package fpod.reader.header;

import fpod.reader.format.PodFormat;
import fpod.reader.util.ByteFields;

import java.nio.ByteBuffer;

/**
 * Header layout of CP1 and CP3 files.
 *
 *   13 lat text [8]      21 lon text [8]     29 deployment depth [uint2]
 *   31 water depth [uint2]                   33 location text [31]
 *  128 CP3: clicks in CP1 [uint4]            164 pod id text [4]
 *  211 notes text [50]
 *  256 first logged minute [int4]            260 last logged minute [int4]
 */
public class CPODHeaderDecoder implements HeaderDecoder
{
    public static final CPODHeaderDecoder instance = new CPODHeaderDecoder();

    protected CPODHeaderDecoder() {}

    @Override
    public PodHeader decode(final ByteBuffer buf, final PodFormat format,
                            final String fileName)
    {
        PodHeader.Builder builder = new PodHeader.Builder(format)
            .fileName(fileName)
            .podId(ByteFields.text(buf, 164, 4))
            .loggedMinutes(ByteFields.int32(buf, 256),
                           ByteFields.int32(buf, 260))
            .depths(ByteFields.uint16(buf, 31), ByteFields.uint16(buf, 29))
            .position(ByteFields.text(buf, 13, 8),
                      ByteFields.text(buf, 21, 8),
                      ByteFields.text(buf, 33, 31))
            .notes(ByteFields.text(buf, 211, 50));

        if (format.hasPriorClickCount()) {
            builder.priorClickCount(ByteFields.constructInt(buf, 128, 4));
        }
        return builder.build();
    }
}
