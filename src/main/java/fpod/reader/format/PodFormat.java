package fpod.reader.format;

import fpod.reader.PodDecodeException;

import java.util.Locale;

/**
 * The on-disk data file variants, identified by the file extension.
 *
 * Each variant has a fixed-size header block followed by a sequence of
 * fixed-size data records.
 */
public enum PodFormat
{
    CP1(DeviceFamily.CPOD, 360, 10, false),
    CP3(DeviceFamily.CPOD, 720, 40, true),
    FP1(DeviceFamily.FPOD, 1024, 16, false),
    FP3(DeviceFamily.FPOD, 1024, 16, true);

    private final DeviceFamily family;
    private final int headerSize;
    private final int recordSize;
    private final boolean trainData;

    /**
     * Create a format definition
     *
     * @param family device generation
     * @param headerSize size of the header block in bytes
     * @param recordSize size of each data record in bytes
     * @param trainData <tt>true</tt> if the file carries click train
     *                  classifications
     */
    PodFormat(DeviceFamily family, int headerSize, int recordSize,
              boolean trainData)
    {
        this.family = family;
        this.headerSize = headerSize;
        this.recordSize = recordSize;
        this.trainData = trainData;
    }

    /**
     * Resolve a format from a file extension.
     *
     * @param extension extension without the dot, any case
     * @return the matching format
     * @throws PodDecodeException if the extension is not a known format
     */
    public static PodFormat fromExtension(final String extension)
            throws PodDecodeException
    {
        if (extension == null) {
            throw new PodDecodeException("Unknown file type: null");
        }

        final String tag = extension.toUpperCase(Locale.ROOT);
        for (PodFormat fmt : values()) {
            if (fmt.name().equals(tag)) {
                return fmt;
            }
        }

        throw new PodDecodeException("Unknown file type: " + tag);
    }

    /**
     * Resolve a format from the extension of a file name.
     *
     * @param fileName file name or path
     * @return the matching format
     * @throws PodDecodeException if the name has no known extension
     */
    public static PodFormat fromFileName(final String fileName)
            throws PodDecodeException
    {
        return fromExtension(extensionOf(fileName));
    }

    /**
     * Return the text after the last dot of a file name, or an empty
     * string if there is none.
     */
    public static String extensionOf(final String fileName)
    {
        if (fileName == null) {
            return "";
        }

        final int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1);
    }

    public DeviceFamily family()
    {
        return family;
    }

    public int headerSize()
    {
        return headerSize;
    }

    public int recordSize()
    {
        return recordSize;
    }

    /**
     * Does this variant carry click train (species) classifications?
     */
    public boolean hasTrainData()
    {
        return trainData;
    }

    /**
     * Does the header of this variant record the number of clicks in the
     * raw file it was produced from?
     */
    public boolean hasPriorClickCount()
    {
        return trainData;
    }
}
