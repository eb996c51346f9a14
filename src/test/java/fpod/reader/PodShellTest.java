package fpod.reader;

import fpod.reader.data.DecodedDataset;
import fpod.reader.format.PodFormat;
import fpod.reader.test.MockAppender;
import fpod.reader.test.PodFileBuilder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import java.time.ZoneId;
import java.util.Properties;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class PodShellTest
{

    private static final MockAppender appender =
        new MockAppender(Level.ERROR);

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    PodShell shell;

    public PodShellTest()
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(appender);
    }

    @Before
    public void setUp() throws Exception
    {
        appender.clear();
        shell = new PodShell();
    }

    @Test
    public void testDefaults()
    {
        assertEquals(ZoneId.of("UTC"), shell.getZone());
        assertFalse(shell.isTrimWaveforms());
    }

    @Test
    public void testProperties()
    {
        Properties props = new Properties();
        props.setProperty(PodShell.PROP_TIMEZONE, " Europe/Copenhagen ");
        props.setProperty(PodShell.PROP_TRIM, "true");

        shell = new PodShell(props);
        assertEquals(ZoneId.of("Europe/Copenhagen"), shell.getZone());
        assertTrue(shell.isTrimWaveforms());
    }

    @Test
    public void testParseOptions()
    {
        shell.parseOption("tz=America/Halifax");
        shell.parseOption("trim");
        assertEquals(ZoneId.of("America/Halifax"), shell.getZone());
        assertTrue(shell.isTrimWaveforms());
    }

    @Test
    public void testParseOptionDebug()
    {
        Logger logger = Logger.getLogger("fpod.reader.decode.FPODRecordDecoder");
        shell.parseOption("debug:fpod.reader.decode.FPODRecordDecoder");
        assertTrue(logger.getLevel().equals(Level.DEBUG));
        logger.setLevel(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseOptionUnknown()
    {
        shell.parseOption("bogus");
    }

    @Test
    public void testSummarize() throws Exception
    {
        PodFileBuilder file = new PodFileBuilder(PodFormat.FP3)
            .headerByte(3, 1)
            .headerByte(4, 2)
            .headerText(157, "Kattegat")
            .headerInt(256, 4, 63113760)
            .fpodMinute(15, 120, 121, 0)
            .fpodTrain(5, 0)
            .fpodClick(200, 9)
            .fpodTrain(6, 0)
            .fpodClick(400, 9)
            .fpodTrain(7, 2 << 2)
            .fpodClick(600, 9);

        DecodedDataset data = new PodFileReader().read(file.toSource("k"));

        shell.parseOption("tz=Europe/Copenhagen");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        shell.summarize(data, new PrintStream(bytes, true, "UTF-8"));
        String text = bytes.toString("UTF-8");

        assertTrue(text, text.contains("File:       k.fp3 (FP3)"));
        assertTrue(text, text.contains("Pod:        102"));
        assertTrue(text, text.contains("Kattegat"));
        assertTrue(text, text.contains("Clicks:     3"));
        assertTrue(text, text.contains("2019-12-31T23:00:00.001Z"));
        assertTrue(text, text.contains("  NBHF: 2"));
        assertTrue(text, text.contains("  Unclassed: 1"));
        assertTrue(text, text.contains("Waveforms:  0 (0 samples)"));
        assertTrue(text, text.contains("Minutes:    1"));
    }

    @Test
    public void testParseLeadingOptions()
    {
        assertEquals(2, shell.parseOptions(new String[] {
                    "-trim", "-tz=Asia/Tokyo", "a.fp1", "-info" }));
        assertTrue(shell.isTrimWaveforms());
        assertEquals(ZoneId.of("Asia/Tokyo"), shell.getZone());

        assertEquals(0, shell.parseOptions(new String[] { "", "a.fp1" }));
        assertEquals(1, shell.parseOptions(new String[] { "-trim", "" }));
        assertEquals(0, shell.parseOptions(new String[0]));
    }

    @Test
    public void testSummarizeFilesContinuesAfterFailure() throws Exception
    {
        File good = tmpDir.newFile("good.fp1");
        Files.write(good.toPath(), new PodFileBuilder(PodFormat.FP1)
                    .fpodClick(200, 9)
                    .toByteArray());
        String missing = new File(tmpDir.getRoot(), "missing.cp1").getPath();

        String[] names = { missing, "", good.getPath() };

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int failures = shell.summarizeFiles(new PodFileReader(), names, 0,
                                            new PrintStream(bytes, true,
                                                            "UTF-8"));
        String text = bytes.toString("UTF-8");

        assertEquals(2, failures);
        assertTrue(text, text.contains("File:       good.fp1 (FP1)"));
        assertTrue(text, text.contains("Clicks:     1"));

        assertEquals(2, appender.getNumberOfMessages());
        assertTrue(((String) appender.getMessage(0)).startsWith("Cannot read "));
        assertTrue(((String) appender.getMessage(1))
                   .startsWith("Cannot decode "));
    }
}
