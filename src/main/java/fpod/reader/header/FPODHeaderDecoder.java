package fpod.reader.header;

import fpod.reader.format.PodFormat;
import fpod.reader.util.ByteFields;

import java.nio.ByteBuffer;

/**
 * Header layout of FP1 and FP3 files.
 *
 *    3 pod id hundreds [uint1]   4 pod id units [uint1]
 *   37 PIC version [uint1]      39 FPGA version [uint2]
 *  129 deployment depth [uint2] 131 water depth [uint2]
 *  133 lat text [11]  145 lon text [11]  157 location text [30]
 *  188 notes text [43]  231 FP3: clicks in FP1 [int8]  232 GMT text [11]
 *  256 first logged minute [int4]   260 last logged minute [int4]
 *
 * The FP3 click count overlaps the notes and GMT fields.
 */
public class FPODHeaderDecoder implements HeaderDecoder
{
    public static final FPODHeaderDecoder instance = new FPODHeaderDecoder();

    protected FPODHeaderDecoder() {}

    /**
     * The numeric pod identifier.
     */
    public int getPodNumber(final ByteBuffer buf)
    {
        return 100 * ByteFields.uint8(buf, 3) + ByteFields.uint8(buf, 4);
    }

    public int getPicVersion(final ByteBuffer buf)
    {
        return ByteFields.uint8(buf, 37);
    }

    public int getFpgaVersion(final ByteBuffer buf)
    {
        return ByteFields.uint16(buf, 39);
    }

    @Override
    public PodHeader decode(final ByteBuffer buf, final PodFormat format,
                            final String fileName)
    {
        PodHeader.Builder builder = new PodHeader.Builder(format)
            .fileName(fileName)
            .podId(Integer.toString(getPodNumber(buf)))
            .loggedMinutes(ByteFields.int32(buf, 256),
                           ByteFields.int32(buf, 260))
            .depths(ByteFields.uint16(buf, 131), ByteFields.uint16(buf, 129))
            .position(ByteFields.text(buf, 133, 11),
                      ByteFields.text(buf, 145, 11),
                      ByteFields.text(buf, 157, 30))
            .notes(ByteFields.text(buf, 188, 43))
            .gmt(ByteFields.text(buf, 232, 11))
            .versions(getPicVersion(buf), getFpgaVersion(buf));

        if (format.hasPriorClickCount()) {
            builder.priorClickCount(ByteFields.constructInt(buf, 231, 8));
        }
        return builder.build();
    }
}
