package fpod.reader.format;

/**
 * The two device generations which write click data files.
 */
public enum DeviceFamily
{
    CPOD,
    FPOD
}
