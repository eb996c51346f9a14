package fpod.reader.record;

/**
 * The kinds of fixed-size data records.
 *
 * Records carry no explicit type field; the kind is inferred from a
 * discriminant byte by the device-specific block readers.
 */
public enum BlockKind
{
    /** A detected click. */
    CLICK,
    /** Click train classification for the next click. */
    TRAIN,
    /** A waveform chunk for the next click. */
    WAVE,
    /** Start of a new minute, possibly with environmental readings. */
    MINUTE,
    /** Anything else; skipped. */
    UNKNOWN
}
