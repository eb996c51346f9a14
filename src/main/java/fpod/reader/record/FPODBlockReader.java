package fpod.reader.record;

import fpod.reader.format.PodFormat;
import fpod.reader.format.SpeciesCodes;
import fpod.reader.util.ByteFields;

import java.nio.ByteBuffer;

/**
 * A 16-byte FPOD data record.  The first byte selects the record kind.
 *
 * Click (byte 0 &lt; 184):
 * -----------------------------------------------------------------------
 * | ticks [uint3] | ncyc | pkat:4 ipirange:4 | ipi pre | ipi at | ...   |
 * -----------------------------------------------------------------------
 * | 10: amp | ... | 13: dur-hi:4 reversals:4 | 14: dur-lo | ...         |
 * -----------------------------------------------------------------------
 *
 * Train (249): 14 = rateGood:1 spGood:1 echo:1 - species:2 quality:2,
 *              15 = train id
 * Wave (250):  seven (ipi, amp) pairs at 1/2 .. 13/14, newest last
 * Minute (254): 7 = temperature, 11..13 = battery voltages
 */
public class FPODBlockReader
{
    public static final FPODBlockReader instance = new FPODBlockReader();

    /** Click records have a first byte below this value. */
    public static final int CLICK_LIMIT = 184;
    public static final int TRAIN_MARKER = 249;
    public static final int WAVE_MARKER = 250;
    public static final int MINUTE_MARKER = 254;

    /** Number of (IPI, amplitude) pairs in a wave record. */
    public static final int WAVE_PAIRS = 7;

    /** Pods with older firmware may use the legacy battery layout. */
    private static final int LEGACY_BATTERY_PIC_VERSION = 28;

    protected FPODBlockReader() {}

    public BlockKind getKind(final ByteBuffer buffer)
    {
        return classify(ByteFields.uint8(buffer, 0));
    }

    /**
     * Map a first byte to a record kind.
     */
    public static BlockKind classify(final int firstByte)
    {
        if (firstByte < CLICK_LIMIT) {
            return BlockKind.CLICK;
        }

        switch (firstByte) {
        case TRAIN_MARKER:
            return BlockKind.TRAIN;
        case WAVE_MARKER:
            return BlockKind.WAVE;
        case MINUTE_MARKER:
            return BlockKind.MINUTE;
        default:
            return BlockKind.UNKNOWN;
        }
    }

    // click records

    public int getMicrosec(final ByteBuffer buffer)
    {
        return CPODBlockReader.ticksToMicrosec(
            ByteFields.constructInt(buffer, 0, 3));
    }

    public int getCycles(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 3);
    }

    /**
     * Number of the cycle with the highest amplitude.
     */
    public int getPeakAt(final ByteBuffer buffer)
    {
        return (ByteFields.uint8(buffer, 4) & 0xf0) >> 4;
    }

    public int getIpiRange(final ByteBuffer buffer)
    {
        return decodeIpiRange(ByteFields.uint8(buffer, 4) & 0xf);
    }

    /**
     * Expand the 4-bit IPI range code.  Order of the tests matters: 15
     * also has bit 3 set.
     */
    public static int decodeIpiRange(final int nibble)
    {
        if (nibble == 15) {
            return 65;
        } else if ((nibble & 0x8) == 0x8) {
            return ((nibble & 0x7) + 1) << 3;
        } else {
            return nibble & 0x7;
        }
    }

    public int getIpiPreMax(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 5) + 1;
    }

    public int getIpiAtMax(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 6) + 1;
    }

    /**
     * Peak amplitude; raw values below 2 read as 2.
     */
    public int getAmplitude(final ByteBuffer buffer)
    {
        return Math.max(2, ByteFields.uint8(buffer, 10));
    }

    public int getAmplitudeReversals(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 13) & 0xf;
    }

    /**
     * Duration code built from the high nibble of byte 13 and byte 14.
     */
    public int getDuration(final ByteBuffer buffer)
    {
        return ((ByteFields.uint8(buffer, 13) & 0xf0) * 16 +
                ByteFields.uint8(buffer, 14)) / 5;
    }

    // train records

    public int getTrainId(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 15);
    }

    public int getSpeciesCode(final ByteBuffer buffer)
    {
        return (ByteFields.uint8(buffer, 14) >> 2) & 0x3;
    }

    public String getSpecies(final ByteBuffer buffer, final PodFormat format)
    {
        return SpeciesCodes.lookup(getSpeciesCode(buffer), format);
    }

    public int getQualityLevel(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 14) & 0x3;
    }

    public boolean isEcho(final ByteBuffer buffer)
    {
        return (ByteFields.uint8(buffer, 14) & 0x20) == 0x20;
    }

    // wave records

    /**
     * IPI of a waveform pair.
     * @param pair pair number, 0 is read from the end of the record
     */
    public int getWaveIpi(final ByteBuffer buffer, final int pair)
    {
        return ByteFields.uint8(buffer, wavePairOffset(pair) + 1);
    }

    public int getWaveAmplitude(final ByteBuffer buffer, final int pair)
    {
        return ByteFields.uint8(buffer, wavePairOffset(pair) + 2);
    }

    private static int wavePairOffset(final int pair)
    {
        if (pair < 0 || pair >= WAVE_PAIRS) {
            throw new IndexOutOfBoundsException("Bad wave pair " + pair);
        }
        return 12 - 2 * pair;
    }

    // minute records

    public int getTemperature(final ByteBuffer buffer)
    {
        return ByteFields.uint8(buffer, 7);
    }

    public int getBattery1(final ByteBuffer buffer, final int picVersion)
    {
        if (isLegacyBatteryLayout(buffer, picVersion)) {
            return ByteFields.uint8(buffer, 12);
        }
        return ByteFields.uint8(buffer, 11);
    }

    public int getBattery2(final ByteBuffer buffer, final int picVersion)
    {
        if (isLegacyBatteryLayout(buffer, picVersion)) {
            return ByteFields.uint8(buffer, 13);
        }
        return ByteFields.uint8(buffer, 12);
    }

    private static boolean isLegacyBatteryLayout(final ByteBuffer buffer,
                                                 final int picVersion)
    {
        return picVersion < LEGACY_BATTERY_PIC_VERSION &&
            ByteFields.uint8(buffer, 11) == 0 &&
            ByteFields.uint8(buffer, 13) != 0;
    }
}
