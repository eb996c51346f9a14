package fpod.reader.data;

/**
 * Click train classification attached to a click.
 */
public final class TrainRecord
{
    private final int trainId;
    private final String species;
    private final int qualityLevel;
    private final boolean echo;

    public TrainRecord(final int trainId, final String species,
                       final int qualityLevel, final boolean echo)
    {
        this.trainId = trainId;
        this.species = species == null ? "" : species;
        this.qualityLevel = qualityLevel;
        this.echo = echo;
    }

    /** Train number, 1 to 255, restarting each minute. */
    public int getTrainId() { return trainId; }

    /** Species group label, empty if unclassified. */
    public String getSpecies() { return species; }

    /** Classification quality, 1 (low) to 3 (high). */
    public int getQualityLevel() { return qualityLevel; }

    /** Might this click be an echo of an already classified click? */
    public boolean isEcho() { return echo; }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof TrainRecord)) return false;
        TrainRecord other = (TrainRecord) o;
        return trainId == other.trainId && qualityLevel == other.qualityLevel
            && echo == other.echo && species.equals(other.species);
    }

    @Override
    public int hashCode()
    {
        int h = trainId;
        h = 31 * h + species.hashCode();
        h = 31 * h + qualityLevel;
        return 31 * h + (echo ? 1 : 0);
    }

    @Override
    public String toString()
    {
        return "Train#" + trainId + "[" + species + " q" + qualityLevel +
            (echo ? " echo" : "") + "]";
    }
}
