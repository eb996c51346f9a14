package fpod.reader.data;

import java.util.Arrays;

/**
 * The (IPI, amplitude) pairs carried by one wave record.
 */
public final class WaveformChunk
{
    private final int[] ipi;
    private final int[] amplitude;

    public WaveformChunk(final int[] ipi, final int[] amplitude)
    {
        if (ipi.length != amplitude.length) {
            throw new IllegalArgumentException("Have " + ipi.length +
                                               " IPIs but " +
                                               amplitude.length +
                                               " amplitudes");
        }
        this.ipi = ipi.clone();
        this.amplitude = amplitude.clone();
    }

    public int size()
    {
        return ipi.length;
    }

    public int getIpi(final int i)
    {
        return ipi[i];
    }

    public int getAmplitude(final int i)
    {
        return amplitude[i];
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof WaveformChunk)) return false;
        WaveformChunk other = (WaveformChunk) o;
        return Arrays.equals(ipi, other.ipi) &&
            Arrays.equals(amplitude, other.amplitude);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(ipi) + Arrays.hashCode(amplitude);
    }
}
