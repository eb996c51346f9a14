package fpod.reader.data;

import java.util.HashMap;
import java.util.Map;

/**
 * Collects wave records for clicks which have not been decoded yet.
 *
 * Wave records precede the click they describe, so chunks are held
 * against the index of their target click until that click is decoded
 * and {@link #release(int)} hands the finished series over.
 */
public class WaveformAccumulator
{
    private final Map<Integer, WaveformSeries> pending =
        new HashMap<Integer, WaveformSeries>();

    /**
     * Add a chunk for a click which is yet to come.
     *
     * @param clickIndex 0-based index of the target click
     * @param chunk the chunk
     * @return <tt>true</tt> if this chunk opened a new series
     */
    public boolean append(final int clickIndex, final WaveformChunk chunk)
    {
        WaveformSeries series = pending.get(clickIndex);
        boolean opened = false;
        if (series == null) {
            series = new WaveformSeries(clickIndex + 1);
            pending.put(clickIndex, series);
            opened = true;
        }
        series.add(chunk);
        return opened;
    }

    /**
     * Remove the series for a click which has just been decoded.
     *
     * @return the series, or <tt>null</tt> if the click has no waveform
     */
    public WaveformSeries release(final int clickIndex)
    {
        return pending.remove(clickIndex);
    }

    /**
     * Drop all series whose click never arrived.
     *
     * @return the number of series dropped
     */
    public int discardPending()
    {
        final int n = pending.size();
        pending.clear();
        return n;
    }
}
