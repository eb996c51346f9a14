package fpod.reader.data;

import fpod.reader.header.PodHeader;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything decoded from one data file.
 */
public final class DecodedDataset
{
    /** Logged minutes are counted from this instant (local time). */
    public static final LocalDateTime MINUTE_EPOCH =
        LocalDateTime.of(1900, 1, 1, 0, 0);

    private final PodHeader header;
    private final List<ClickRecord> clicks;
    private final List<WaveformSeries> waveforms;
    private final List<EnvironmentalSample> environment;
    private final DecodeStats stats;

    private DecodedDataset(final Builder b)
    {
        header = b.header;
        clicks = Collections.unmodifiableList(
            new ArrayList<ClickRecord>(b.clicks));
        waveforms = Collections.unmodifiableList(
            new ArrayList<WaveformSeries>(b.waveforms));
        environment = Collections.unmodifiableList(
            new ArrayList<EnvironmentalSample>(b.environment));
        stats = b.stats;
    }

    public PodHeader getHeader() { return header; }

    public List<ClickRecord> getClicks() { return clicks; }

    public int getClickCount() { return clicks.size(); }

    /**
     * Waveforms in click order.
     */
    public List<WaveformSeries> getWaveforms() { return waveforms; }

    /**
     * Minute marker readings.  Empty for CPOD files.
     */
    public List<EnvironmentalSample> getEnvironment() { return environment; }

    public DecodeStats getStats() { return stats; }

    /**
     * All waveforms flattened into a single table.
     */
    public List<WaveformSample> getWaveformSamples()
    {
        return getWaveformSamples(false);
    }

    /**
     * All waveforms flattened into a single table.
     *
     * @param trimToCycles if <tt>true</tt>, keep only the samples which
     *                     fall within the cycle count of each click
     * @return the samples, grouped by click
     */
    public List<WaveformSample> getWaveformSamples(final boolean trimToCycles)
    {
        Map<Integer, ClickRecord> byNumber = null;
        if (trimToCycles) {
            byNumber = new HashMap<Integer, ClickRecord>();
            for (ClickRecord click : clicks) {
                byNumber.put(click.getClickNo(), click);
            }
        }

        List<WaveformSample> samples = new ArrayList<WaveformSample>();
        for (WaveformSeries series : waveforms) {
            if (byNumber == null) {
                samples.addAll(series.getSamples());
                continue;
            }

            ClickRecord click = byNumber.get(series.getClickNo());
            if (click != null) {
                samples.addAll(series.getSamples(click.getCycles()));
            }
        }
        return samples;
    }

    /**
     * Local time of a click.
     */
    public LocalDateTime getClickTime(final ClickRecord click)
    {
        final long minutes =
            (long) header.getFirstLoggedMinute() + click.getMinute();
        return MINUTE_EPOCH.plusMinutes(minutes)
            .plusNanos(click.getMicrosec() * 1000L);
    }

    /**
     * Time of a click, with the logged local time interpreted in the given
     * zone.
     */
    public Instant getClickTime(final ClickRecord click, final ZoneId zone)
    {
        return getClickTime(click).atZone(zone).toInstant();
    }

    @Override
    public String toString()
    {
        return String.format("%s: %d clicks, %d waveforms, %d minutes",
                             header, clicks.size(), waveforms.size(),
                             environment.size());
    }

    /**
     * Accumulates decoded records.  Not thread safe.
     */
    public static final class Builder
    {
        private final PodHeader header;
        private final List<ClickRecord> clicks;
        private final List<WaveformSeries> waveforms =
            new ArrayList<WaveformSeries>();
        private final List<EnvironmentalSample> environment =
            new ArrayList<EnvironmentalSample>();
        private final DecodeStats stats = new DecodeStats();

        /**
         * @param header the file header
         * @param expectedRecords upper bound on the number of records,
         *                        used to size the click list
         */
        public Builder(final PodHeader header, final int expectedRecords)
        {
            this.header = header;
            this.clicks = new ArrayList<ClickRecord>(Math.max(0,
                                                              expectedRecords));
        }

        public DecodeStats getStats()
        {
            return stats;
        }

        public void addClick(final ClickRecord click)
        {
            clicks.add(click);
        }

        /**
         * Drop the most recently added click.
         *
         * @return the removed click, or <tt>null</tt> if there are none
         */
        public ClickRecord removeLastClick()
        {
            if (clicks.isEmpty()) {
                return null;
            }
            return clicks.remove(clicks.size() - 1);
        }

        public void addWaveform(final WaveformSeries series)
        {
            waveforms.add(series);
        }

        public void addEnvironment(final EnvironmentalSample sample)
        {
            environment.add(sample);
        }

        public DecodedDataset build()
        {
            return new DecodedDataset(this);
        }
    }
}
