package fpod.reader.data;

/**
 * One row of a flattened waveform table.
 */
public final class WaveformSample
{
    private final int clickNo;
    private final int ipi;
    private final int amplitude;

    public WaveformSample(final int clickNo, final int ipi,
                          final int amplitude)
    {
        this.clickNo = clickNo;
        this.ipi = ipi;
        this.amplitude = amplitude;
    }

    public int getClickNo() { return clickNo; }

    public int getIpi() { return ipi; }

    public int getAmplitude() { return amplitude; }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof WaveformSample)) return false;
        WaveformSample other = (WaveformSample) o;
        return clickNo == other.clickNo && ipi == other.ipi &&
            amplitude == other.amplitude;
    }

    @Override
    public int hashCode()
    {
        return (clickNo * 31 + ipi) * 31 + amplitude;
    }

    @Override
    public String toString()
    {
        return clickNo + ":" + ipi + "/" + amplitude;
    }
}
