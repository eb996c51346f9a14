package fpod.reader;

import fpod.reader.data.ClickRecord;
import fpod.reader.data.DecodedDataset;
import fpod.reader.header.PodHeader;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PropertyConfigurator;

/**
 * Decodes a single data file from the command line and prints a summary.
 */
public class PodShell
{
    private static final Logger logger = Logger.getLogger(PodShell.class);

    public static final String PROP_TIMEZONE = "fpod.reader.shell.timezone";
    public static final String PROP_TRIM = "fpod.reader.shell.trim-waveforms";

    private ZoneId zone = ZoneId.of("UTC");
    private boolean trimWaveforms;

    public PodShell()
    {
        this(null);
    }

    public PodShell(Properties props)
    {
        if (props == null) return;

        if (props.containsKey(PROP_TIMEZONE)) {
            zone = ZoneId.of(props.getProperty(PROP_TIMEZONE).trim());
        }
        if (props.containsKey(PROP_TRIM)) {
            trimWaveforms =
                Boolean.parseBoolean(props.getProperty(PROP_TRIM).trim());
        }
    }

    /**
     * Parse an option given to the shell.  Options are
     * <dl>
     * <dt>-tz=<i>ZONE</i></dt>
     * <dd>Time zone in which the pod clock was set</dd>
     * <dt>-trim</dt>
     * <dd>Only count waveform samples within each click's cycles</dd>
     * <dt>-debug[:<i>logger</i>]</dt>
     * <dd>Turn on debug logging, for one logger or all</dd>
     * <dt>-info</dt>
     * <dd>Log at INFO level</dd>
     * </dl>
     * @param option the option without its leading dash
     */
    public void parseOption(String option)
    {
        if (option.startsWith("tz="))
        {
            zone = ZoneId.of(option.substring(3));
        }
        else if (option.equals("trim"))
        {
            trimWaveforms = true;
        }
        else if (option.startsWith("debug"))
        {
            int c = option.indexOf(':');
            if (c >= 0)
            {
                String classname = option.substring(c+1);
                Logger.getLogger(classname).setLevel(Level.DEBUG);
            }
            else
            {
                Logger.getRootLogger().setLevel(Level.DEBUG);
            }
        }
        else if (option.equals("info"))
        {
            Logger.getRootLogger().setLevel(Level.INFO);
        }
        else
        {
            throw new IllegalArgumentException("Unknown option -" + option);
        }
    }

    public ZoneId getZone()
    {
        return zone;
    }

    public boolean isTrimWaveforms()
    {
        return trimWaveforms;
    }

    /**
     * Print a summary of a decoded file.
     */
    public void summarize(DecodedDataset data, PrintStream out)
    {
        PodHeader hdr = data.getHeader();
        out.println("File:       " + hdr.getFileName() + " (" +
                    hdr.getFormat() + ")");
        out.println("Pod:        " + hdr.getPodId().trim());
        out.println("Location:   " + hdr.getLocationText().trim() + " " +
                    hdr.getLatText().trim() + " " + hdr.getLonText().trim());
        out.println("Depth:      " + hdr.getDeploymentDepth() + " of " +
                    hdr.getWaterDepth());
        out.println("Clicks:     " + data.getClickCount());

        if (data.getClickCount() > 0)
        {
            ClickRecord first = data.getClicks().get(0);
            ClickRecord last = data.getClicks().get(data.getClickCount() - 1);
            out.println("First:      " + data.getClickTime(first, zone));
            out.println("Last:       " + data.getClickTime(last, zone));
        }

        Map<String, Integer> species = new TreeMap<String, Integer>();
        for (ClickRecord click : data.getClicks())
        {
            if (click.hasTrain() && click.getSpecies().length() > 0)
            {
                Integer n = species.get(click.getSpecies());
                species.put(click.getSpecies(), n == null ? 1 : n + 1);
            }
        }
        for (Map.Entry<String, Integer> entry : species.entrySet())
        {
            out.println("  " + entry.getKey() + ": " + entry.getValue());
        }

        out.println("Waveforms:  " + data.getWaveforms().size() + " (" +
                    data.getWaveformSamples(trimWaveforms).size() +
                    " samples)");
        out.println("Minutes:    " + data.getEnvironment().size());
    }

    private static Properties loadProperties(String name)
    {
        Properties props = new Properties();
        try
        {
            InputStream in = new FileInputStream(name);
            try
            {
                props.load(in);
            }
            finally
            {
                in.close();
            }
            PropertyConfigurator.configure(props);
        }
        catch (IOException iox)
        {
            BasicConfigurator.configure();
            Logger.getRootLogger().setLevel(Level.WARN);
        }
        return props;
    }

    /**
     * Consume the leading options.
     *
     * @return index of the first file argument
     */
    int parseOptions(String[] args)
    {
        int iarg = 0;
        while (iarg < args.length)
        {
            String arg = args[iarg];
            if (arg.length() == 0 || arg.charAt(0) != '-') break;
            parseOption(arg.substring(1));
            iarg++;
        }
        return iarg;
    }

    /**
     * Summarize each file in turn.  A file which cannot be read is logged
     * and skipped.
     *
     * @return the number of files which could not be decoded
     */
    int summarizeFiles(PodFileReader reader, String[] names, int first,
                       PrintStream out)
    {
        int failures = 0;
        for (int i = first; i < names.length; i++)
        {
            try
            {
                summarize(reader.read(Paths.get(names[i])), out);
            }
            catch (PodDecodeException pde)
            {
                logger.error("Cannot decode " + names[i], pde);
                failures++;
            }
            catch (IOException iox)
            {
                logger.error("Cannot read " + names[i], iox);
                failures++;
            }
        }
        return failures;
    }

    public static void main(String[] args) throws Exception
    {
        PodShell shell = new PodShell(loadProperties("podshell.properties"));

        int iarg = shell.parseOptions(args);
        if (args.length - iarg < 1)
        {
            System.out.println("usage : java [vmopt] " + PodShell.class.getName() +
                               " [-tz=ZONE] [-trim] [-debug[:logger]] [-info]" +
                               " <file>...");
            System.exit(1);
        }

        int failures = shell.summarizeFiles(new PodFileReader(), args, iarg,
                                            System.out);
        if (failures > 0) System.exit(2);
    }
}
