package fpod.reader.data;

/**
 * A single decoded click.
 *
 * Fields a device family does not record are 0 (or NaN for the
 * duration).
 */
public final class ClickRecord
{
    private final int minute;
    private final int microsec;
    private final int clickNo;
    private final int cycles;
    private final int peakAt;
    private final int ipiRange;
    private final int ipiPreMax;
    private final int ipiAtMax;
    private final int kHz;
    private final int amplitude;
    private final int amplitudeReversals;
    private final double duration;
    private final boolean hasWav;
    private final TrainRecord train;

    private ClickRecord(final Builder b)
    {
        minute = b.minute;
        microsec = b.microsec;
        clickNo = b.clickNo;
        cycles = b.cycles;
        peakAt = b.peakAt;
        ipiRange = b.ipiRange;
        ipiPreMax = b.ipiPreMax;
        ipiAtMax = b.ipiAtMax;
        kHz = b.kHz;
        amplitude = b.amplitude;
        amplitudeReversals = b.amplitudeReversals;
        duration = b.duration;
        hasWav = b.hasWav;
        train = b.train;
    }

    /**
     * Minutes since logging started; -1 for clicks before the first
     * minute marker.
     */
    public int getMinute() { return minute; }

    /** Microseconds since the start of the minute. */
    public int getMicrosec() { return microsec; }

    /** Sequential click number, starting at 1. */
    public int getClickNo() { return clickNo; }

    public int getCycles() { return cycles; }

    public int getPeakAt() { return peakAt; }

    public int getIpiRange() { return ipiRange; }

    /** IPI before the loudest cycle, in 250 ns units. */
    public int getIpiPreMax() { return ipiPreMax; }

    /** IPI at the loudest cycle, in 250 ns units. */
    public int getIpiAtMax() { return ipiAtMax; }

    public int getKHz() { return kHz; }

    public int getAmplitude() { return amplitude; }

    public int getAmplitudeReversals() { return amplitudeReversals; }

    /**
     * Duration.  CPOD clicks report cycles per kHz, FPOD clicks an integral
     * duration code; NaN if unknown.
     */
    public double getDuration() { return duration; }

    public boolean hasWav() { return hasWav; }

    public boolean hasTrain() { return train != null; }

    /**
     * @return the train classification, or <tt>null</tt>
     */
    public TrainRecord getTrain() { return train; }

    public int getTrainId() { return train == null ? 0 : train.getTrainId(); }

    public String getSpecies()
    {
        return train == null ? "" : train.getSpecies();
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ClickRecord)) return false;
        ClickRecord other = (ClickRecord) o;
        return clickNo == other.clickNo && minute == other.minute
            && microsec == other.microsec && cycles == other.cycles
            && peakAt == other.peakAt && ipiRange == other.ipiRange
            && ipiPreMax == other.ipiPreMax && ipiAtMax == other.ipiAtMax
            && kHz == other.kHz && amplitude == other.amplitude
            && amplitudeReversals == other.amplitudeReversals
            && Double.compare(duration, other.duration) == 0
            && hasWav == other.hasWav
            && (train == null ? other.train == null :
                train.equals(other.train));
    }

    @Override
    public int hashCode()
    {
        int h = clickNo;
        h = 31 * h + minute;
        h = 31 * h + microsec;
        h = 31 * h + cycles;
        h = 31 * h + peakAt;
        h = 31 * h + ipiRange;
        h = 31 * h + ipiPreMax;
        h = 31 * h + ipiAtMax;
        h = 31 * h + kHz;
        h = 31 * h + amplitude;
        h = 31 * h + amplitudeReversals;
        h = 31 * h + Double.hashCode(duration);
        h = 31 * h + (hasWav ? 1 : 0);
        return 31 * h + (train == null ? 0 : train.hashCode());
    }

    @Override
    public String toString()
    {
        return String.format("Click#%d[min %d us %d ncyc %d amp %d%s%s]",
                             clickNo, minute, microsec, cycles, amplitude,
                             train == null ? "" : " " + train,
                             hasWav ? " wav" : "");
    }

    public static final class Builder
    {
        private int minute = -1;
        private int microsec;
        private int clickNo;
        private int cycles;
        private int peakAt;
        private int ipiRange;
        private int ipiPreMax;
        private int ipiAtMax;
        private int kHz;
        private int amplitude;
        private int amplitudeReversals;
        private double duration = Double.NaN;
        private boolean hasWav;
        private TrainRecord train;

        public Builder(final int clickNo)
        {
            this.clickNo = clickNo;
        }

        public Builder time(final int minute, final int microsec)
        {
            this.minute = minute;
            this.microsec = microsec;
            return this;
        }

        public Builder cycles(final int val)
        {
            cycles = val;
            return this;
        }

        public Builder peakAt(final int val)
        {
            peakAt = val;
            return this;
        }

        public Builder ipi(final int range, final int preMax,
                           final int atMax)
        {
            ipiRange = range;
            ipiPreMax = preMax;
            ipiAtMax = atMax;
            return this;
        }

        public Builder kHz(final int val)
        {
            kHz = val;
            return this;
        }

        public Builder amplitude(final int val, final int reversals)
        {
            amplitude = val;
            amplitudeReversals = reversals;
            return this;
        }

        public Builder duration(final double val)
        {
            duration = val;
            return this;
        }

        public Builder hasWav(final boolean val)
        {
            hasWav = val;
            return this;
        }

        public Builder train(final TrainRecord val)
        {
            train = val;
            return this;
        }

        public ClickRecord build()
        {
            return new ClickRecord(this);
        }
    }
}
