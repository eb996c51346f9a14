package fpod.reader.header;

import fpod.reader.format.PodFormat;

/**
 * The deployment information stored in the header block of a data file.
 *
 * Text fields are verbatim copies of fixed-width byte ranges and keep any
 * trailing padding.
 */
public final class PodHeader
{
    private final PodFormat format;
    private final String fileName;
    private final String podId;
    private final int firstLoggedMinute;
    private final int lastLoggedMinute;
    private final int waterDepth;
    private final int deploymentDepth;
    private final String latText;
    private final String lonText;
    private final String locationText;
    private final String notesText;
    private final String gmtText;
    private final int picVersion;
    private final int fpgaVersion;
    private final boolean priorClickCountPresent;
    private final long priorClickCount;

    private PodHeader(final Builder b)
    {
        format = b.format;
        fileName = b.fileName;
        podId = b.podId;
        firstLoggedMinute = b.firstLoggedMinute;
        lastLoggedMinute = b.lastLoggedMinute;
        waterDepth = b.waterDepth;
        deploymentDepth = b.deploymentDepth;
        latText = b.latText;
        lonText = b.lonText;
        locationText = b.locationText;
        notesText = b.notesText;
        gmtText = b.gmtText;
        picVersion = b.picVersion;
        fpgaVersion = b.fpgaVersion;
        priorClickCountPresent = b.priorClickCountPresent;
        priorClickCount = b.priorClickCount;
    }

    public PodFormat getFormat() { return format; }

    public String getFileName() { return fileName; }

    /**
     * The pod identifier.  CPOD files store this as text, FPOD files as a
     * number which is rendered here in decimal.
     */
    public String getPodId() { return podId; }

    /**
     * Minute of the first logged data, counted from 1900-01-01 00:00.
     */
    public int getFirstLoggedMinute() { return firstLoggedMinute; }

    public int getLastLoggedMinute() { return lastLoggedMinute; }

    public int getWaterDepth() { return waterDepth; }

    public int getDeploymentDepth() { return deploymentDepth; }

    public String getLatText() { return latText; }

    public String getLonText() { return lonText; }

    public String getLocationText() { return locationText; }

    public String getNotesText() { return notesText; }

    /**
     * Time zone text.  Only FPOD headers carry this field; empty otherwise.
     */
    public String getGmtText() { return gmtText; }

    /** Processor firmware version, 0 for CPOD files. */
    public int getPicVersion() { return picVersion; }

    /** FPGA firmware version, 0 for CPOD files. */
    public int getFpgaVersion() { return fpgaVersion; }

    /**
     * Does this pod record amplitudes beyond the clipping level?
     * @return <tt>true</tt> if the FPGA version is non-zero
     */
    public boolean hasExtendedAmps() { return fpgaVersion > 0; }

    /**
     * Is the click count of the originating raw file available?  Only
     * CP3 and FP3 headers carry it.
     */
    public boolean hasPriorClickCount() { return priorClickCountPresent; }

    /**
     * Number of clicks in the raw (CP1/FP1) file this file was derived from.
     * @return the count, or 0 if {@link #hasPriorClickCount()} is false
     */
    public long getPriorClickCount() { return priorClickCount; }

    @Override
    public String toString()
    {
        return String.format("%s pod %s [%d:%d] depth %d/%d", format,
                             podId.trim(), firstLoggedMinute,
                             lastLoggedMinute, deploymentDepth, waterDepth);
    }

    /**
     * Collects header fields as a decoder reads them.
     */
    public static final class Builder
    {
        private final PodFormat format;
        private String fileName = "";
        private String podId = "";
        private int firstLoggedMinute;
        private int lastLoggedMinute;
        private int waterDepth;
        private int deploymentDepth;
        private String latText = "";
        private String lonText = "";
        private String locationText = "";
        private String notesText = "";
        private String gmtText = "";
        private int picVersion;
        private int fpgaVersion;
        private boolean priorClickCountPresent;
        private long priorClickCount;

        public Builder(final PodFormat format)
        {
            this.format = format;
        }

        public Builder fileName(final String val)
        {
            fileName = val == null ? "" : val;
            return this;
        }

        public Builder podId(final String val)
        {
            podId = val;
            return this;
        }

        public Builder loggedMinutes(final int first, final int last)
        {
            firstLoggedMinute = first;
            lastLoggedMinute = last;
            return this;
        }

        public Builder depths(final int water, final int deployment)
        {
            waterDepth = water;
            deploymentDepth = deployment;
            return this;
        }

        public Builder position(final String lat, final String lon,
                                final String location)
        {
            latText = lat;
            lonText = lon;
            locationText = location;
            return this;
        }

        public Builder notes(final String val)
        {
            notesText = val;
            return this;
        }

        public Builder gmt(final String val)
        {
            gmtText = val;
            return this;
        }

        public Builder versions(final int pic, final int fpga)
        {
            picVersion = pic;
            fpgaVersion = fpga;
            return this;
        }

        public Builder priorClickCount(final long val)
        {
            priorClickCountPresent = true;
            priorClickCount = val;
            return this;
        }

        public PodHeader build()
        {
            return new PodHeader(this);
        }
    }
}
