package fpod.reader;

/**
 * Error raised when a data file cannot be decoded at all, e.g. an
 * unrecognized file type or a header block that cannot be read.
 *
 * A truncated data region is not an error; decoding simply stops.
 */
public class PodDecodeException extends Exception
{
    private static final long serialVersionUID = 1L;

    public PodDecodeException(final String message)
    {
        super(message);
    }
}
