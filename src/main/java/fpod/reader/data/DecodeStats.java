package fpod.reader.data;

/**
 * Counts the records seen while decoding a single file.
 *
 * Not thread safe; each decode owns its own instance.
 */
public class DecodeStats
{
    private long numBlocks;
    private long numClicks;
    private long numTrains;
    private long numWaves;
    private long numMinutes;
    private long numTerminators;
    private long numUnknown;
    private long numDiscarded;
    private boolean truncated;

    public void reportBlock()
    {
        numBlocks++;
    }

    public void reportClick()
    {
        numClicks++;
    }

    public void reportTrain()
    {
        numTrains++;
    }

    public void reportWave()
    {
        numWaves++;
    }

    public void reportMinute()
    {
        numMinutes++;
    }

    public void reportTerminator()
    {
        numTerminators++;
    }

    public void reportUnknown()
    {
        numUnknown++;
    }

    /**
     * Report train or wave annotations whose click never arrived.
     */
    public void reportDiscarded(final int count)
    {
        numDiscarded += count;
    }

    /**
     * Report that the data ended with a partial record.
     */
    public void reportTruncated()
    {
        truncated = true;
    }

    /** Full-sized records read. */
    public long getNumBlocks() { return numBlocks; }

    /** Click records decoded, including any not reported in the dataset. */
    public long getNumClicks() { return numClicks; }

    public long getNumTrains() { return numTrains; }

    public long getNumWaves() { return numWaves; }

    public long getNumMinutes() { return numMinutes; }

    public long getNumTerminators() { return numTerminators; }

    public long getNumUnknown() { return numUnknown; }

    public long getNumDiscarded() { return numDiscarded; }

    public boolean isTruncated() { return truncated; }

    @Override
    public String toString()
    {
        return String.format("blocks=%d clicks=%d trains=%d waves=%d" +
                             " minutes=%d terminators=%d unknown=%d" +
                             " discarded=%d%s", numBlocks, numClicks,
                             numTrains, numWaves, numMinutes, numTerminators,
                             numUnknown, numDiscarded,
                             truncated ? " (truncated)" : "");
    }
}
