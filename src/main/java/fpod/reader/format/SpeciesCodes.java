package fpod.reader.format;

/**
 * Maps the species codes written by the train classifier to species
 * group labels.
 *
 * Codes outside the documented range map to an empty label; later
 * firmware may write codes this table does not know.
 */
public final class SpeciesCodes
{
    public static final String NBHF = "NBHF";
    public static final String OTHER_CET = "OtherCet";
    public static final String UNCLASSED = "Unclassed";
    public static final String SONAR = "Sonar";

    /** CP3 codes use pairs of values per group. */
    private static final String[] CPOD_CODES = {
        NBHF, NBHF, OTHER_CET, OTHER_CET, UNCLASSED, UNCLASSED, SONAR, SONAR
    };

    private static final String[] FPOD_CODES = {
        NBHF, OTHER_CET, UNCLASSED, SONAR
    };

    private SpeciesCodes()
    {
    }

    /**
     * Look up the species label for a code found in a file of the
     * given format.
     *
     * @param code species code
     * @param format file format
     * @return species label, empty if the code is unknown or the format
     *         has no train data
     */
    public static String lookup(final int code, final PodFormat format)
    {
        switch (format) {
        case CP3:
            return cpodSpecies(code);
        case FP3:
            return fpodSpecies(code);
        default:
            return "";
        }
    }

    public static String cpodSpecies(final int code)
    {
        return fromTable(CPOD_CODES, code);
    }

    public static String fpodSpecies(final int code)
    {
        return fromTable(FPOD_CODES, code);
    }

    private static String fromTable(final String[] table, final int code)
    {
        if (code < 0 || code >= table.length) {
            return "";
        }
        return table[code];
    }
}
