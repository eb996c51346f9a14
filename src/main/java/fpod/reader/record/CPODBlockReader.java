package fpod.reader.record;

import fpod.reader.format.PodFormat;
import fpod.reader.format.SpeciesCodes;
import fpod.reader.util.ByteFields;

import java.nio.ByteBuffer;

/**
 * A CPOD data record (CP1: 10 bytes, CP3: 40 bytes).
 *
 * -----------------------------------------------------------------------
 * | ticks [uint3] | ncyc [uint1] | .. | khz [uint1] | ... | marker [uint1]|
 * -----------------------------------------------------------------------
 *
 * CP3 records extend this with train classification:
 *   36: species code (bits 3-7) and quality level (bits 0-1)
 *   39: train id
 *
 * The last byte is 254 for minute markers; every other record is a click.
 * The data region ends with 0xFF-filled records.
 */
public class CPODBlockReader
{
    public static final CPODBlockReader instance = new CPODBlockReader();

    /** Last byte value of a minute marker. */
    public static final int MINUTE_MARKER = 254;

    /** A record is a terminator if no more than this many bytes are not 0xFF. */
    private static final int TERMINATOR_TOLERANCE = 5;

    protected CPODBlockReader() {}

    public BlockKind getKind(final ByteBuffer buffer)
    {
        final int last = ByteFields.uint8(buffer, buffer.limit() - 1);
        if (last == MINUTE_MARKER) {
            return BlockKind.MINUTE;
        }
        return BlockKind.CLICK;
    }

    /**
     * Is this one of the 0xFF records which follow the last data?
     */
    public boolean isTerminator(final ByteBuffer buffer)
    {
        return ByteFields.count(buffer, 0xff) >=
            buffer.limit() - TERMINATOR_TOLERANCE;
    }

    /**
     * Time of the click within its minute.  The 24-bit counter runs at
     * 200 kHz (5 microsecond ticks).
     */
    public int getMicrosec(final ByteBuffer buffer)
    {
        return ticksToMicrosec(ByteFields.constructInt(buffer, 0, 3));
    }

    public int getCycles(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 3);
    }

    public int getKHz(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 5);
    }

    /**
     * CPOD records keep a single byte for both the frequency and the
     * amplitude.
     */
    public int getAmplitude(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 5);
    }

    /**
     * Click duration as cycles per kHz.
     * @return the duration, NaN when the frequency is 0
     */
    public double getDuration(final ByteBuffer buffer)
    {
        final int khz = getKHz(buffer);
        if (khz > 0) {
            return (double) getCycles(buffer) / (double) khz;
        }
        return Double.NaN;
    }

    // CP3 only

    public int getTrainId(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 39);
    }

    public int getSpeciesCode(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 36) >> 3;
    }

    public String getSpecies(final ByteBuffer buffer, final PodFormat format)
    {
        return SpeciesCodes.lookup(getSpeciesCode(buffer), format);
    }

    public int getQualityLevel(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 36) & 0x3;
    }

    static int ticksToMicrosec(final long ticks)
    {
        return (int) (ticks / 200.0 * 1000.0);
    }
}
