package fpod.reader.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The waveform chunks recorded for a single click.
 *
 * Chunks are stored in the order they appear in the file, which is the
 * reverse of the order in which the device sampled them.
 */
public final class WaveformSeries
{
    private final int clickNo;
    private final List<WaveformChunk> chunks = new ArrayList<WaveformChunk>();

    public WaveformSeries(final int clickNo)
    {
        this.clickNo = clickNo;
    }

    /** The 1-based number of the click this waveform belongs to. */
    public int getClickNo()
    {
        return clickNo;
    }

    void add(final WaveformChunk chunk)
    {
        chunks.add(chunk);
    }

    /**
     * Chunks in file order.
     */
    public List<WaveformChunk> getChunks()
    {
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Number of (IPI, amplitude) pairs over all chunks.
     */
    public int getSampleCount()
    {
        int n = 0;
        for (WaveformChunk chunk : chunks) {
            n += chunk.size();
        }
        return n;
    }

    /**
     * Flatten into chronological order: last chunk first, with the
     * pairs of each chunk in their stored order.
     */
    public List<WaveformSample> getSamples()
    {
        List<WaveformSample> samples =
            new ArrayList<WaveformSample>(getSampleCount());
        for (int c = chunks.size() - 1; c >= 0; c--) {
            WaveformChunk chunk = chunks.get(c);
            for (int i = 0; i < chunk.size(); i++) {
                samples.add(new WaveformSample(clickNo, chunk.getIpi(i),
                                               chunk.getAmplitude(i)));
            }
        }
        return samples;
    }

    /**
     * Flatten, keeping only the samples for the last <tt>cycles</tt>
     * cycles of the click.  A series shorter than the click is returned
     * whole.
     *
     * @param cycles cycle count of the click
     * @return the trailing samples
     */
    public List<WaveformSample> getSamples(final int cycles)
    {
        List<WaveformSample> all = getSamples();
        final int first = Math.max(1, all.size() - cycles + 1);
        return new ArrayList<WaveformSample>(all.subList(first - 1,
                                                         all.size()));
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof WaveformSeries)) return false;
        WaveformSeries other = (WaveformSeries) o;
        return clickNo == other.clickNo && chunks.equals(other.chunks);
    }

    @Override
    public int hashCode()
    {
        return 31 * clickNo + chunks.hashCode();
    }

    @Override
    public String toString()
    {
        return "Waveform#" + clickNo + "[" + chunks.size() + " chunks]";
    }
}
