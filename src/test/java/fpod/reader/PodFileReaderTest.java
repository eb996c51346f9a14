package fpod.reader;

import fpod.reader.data.ClickRecord;
import fpod.reader.data.DecodedDataset;
import fpod.reader.format.PodFormat;
import fpod.reader.io.ByteBufferSource;
import fpod.reader.test.MockAppender;
import fpod.reader.test.PodFileBuilder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;

import org.apache.log4j.BasicConfigurator;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class PodFileReaderTest
{
    /** 2020-01-01 00:00 in minutes since 1900-01-01 */
    private static final int START_2020 = 63113760;

    private static final MockAppender appender = new MockAppender();

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private PodFileReader subject;

    @Before
    public void setUp()
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(appender);

        subject = new PodFileReader();
    }

    @After
    public void tearDown()
    {
        assertEquals("Unexpected log messages",
                     0, appender.getNumberOfMessages());
    }

    private static PodFileBuilder fp3File()
    {
        return new PodFileBuilder(PodFormat.FP3)
            .headerByte(3, 12)
            .headerByte(4, 34)
            .headerByte(37, 30)
            .headerInt(256, 4, START_2020)
            .fpodMinute(15, 120, 121, 0)
            .fpodClick(200, 9)
            .fpodTrain(5, 1 << 2)
            .fpodClick(400, 11)
            .fpodMinute(16, 120, 121, 0)
            .fpodClick(12000000, 13);
    }

    @Test
    public void testReadFP3()
        throws IOException, PodDecodeException
    {
        DecodedDataset data = subject.read(fp3File().toSource("dep"));

        assertEquals(PodFormat.FP3, data.getHeader().getFormat());
        assertEquals("dep.fp3", data.getHeader().getFileName());
        assertEquals("1234", data.getHeader().getPodId());

        assertEquals(3, data.getClickCount());
        assertEquals(2, data.getEnvironment().size());

        ClickRecord click = data.getClicks().get(1);
        assertEquals("OtherCet", click.getSpecies());
        assertEquals(LocalDateTime.of(2020, 1, 1, 0, 0, 0, 2000000),
                     data.getClickTime(click));

        ClickRecord last = data.getClicks().get(2);
        assertEquals(1, last.getMinute());
        assertEquals(LocalDateTime.of(2020, 1, 1, 0, 2, 0),
                     data.getClickTime(last));
    }

    @Test
    public void testReadCP1()
        throws IOException, PodDecodeException
    {
        PodFileBuilder file = new PodFileBuilder(PodFormat.CP1)
            .headerText(164, "0987")
            .headerInt(256, 4, START_2020)
            .cpodMinute()
            .cpodClick(200, 10, 100)
            .cpodClick(400, 10, 100)
            .terminator()
            .terminator();

        DecodedDataset data = subject.read(file.toSource());

        assertEquals("0987", data.getHeader().getPodId());
        assertEquals(2, data.getClickCount());
        assertTrue(data.getWaveforms().isEmpty());
        assertTrue(data.getEnvironment().isEmpty());
    }

    @Test
    public void testReadTwice()
        throws IOException, PodDecodeException
    {
        int[] ipi = { 21, 22, 23, 24, 25, 26, 27 };
        int[] amp = { 90, 91, 92, 93, 94, 95, 96 };
        byte[] bytes = new PodFileBuilder(PodFormat.FP3)
            .headerByte(37, 30)
            .headerInt(256, 4, START_2020)
            .fpodMinute(15, 120, 121, 0)
            .fpodWave(ipi, amp)
            .fpodWave(amp, ipi)
            .fpodTrain(9, 0x20 | (1 << 2) | 3)
            .fpodClick(200, 14, 0x5b, 19, 21, 77, 0x34, 12)
            .fpodClick(400, 6, 0x2f, 3, 4, 1, 0x11, 250)
            .fpodWave(ipi, ipi)
            .fpodClick(600, 7, 0x18, 30, 31, 40, 0x72, 0)
            .toByteArray();

        DecodedDataset first = new PodFileReader()
            .read(new ByteBufferSource("a.fp3", bytes));
        DecodedDataset second = new PodFileReader()
            .read(new ByteBufferSource("a.fp3", bytes));

        assertNotSame(first, second);
        assertEquals(3, first.getClickCount());
        assertEquals(2, first.getWaveforms().size());
        assertTrue(first.getClicks().get(0).hasTrain());

        assertEquals(first.getClicks(), second.getClicks());
        assertEquals(first.getWaveforms(), second.getWaveforms());
        assertEquals(first.getWaveformSamples(),
                     second.getWaveformSamples());
        assertEquals(first.getEnvironment(), second.getEnvironment());
    }

    @Test
    public void testHeaderOnly()
        throws IOException, PodDecodeException
    {
        DecodedDataset data =
            subject.read(new PodFileBuilder(PodFormat.FP1).toSource());
        assertEquals(0, data.getClickCount());
        assertEquals(0L, data.getStats().getNumBlocks());
    }

    @Test
    public void testUnknownExtension()
        throws IOException
    {
        try {
            subject.read(new ByteBufferSource("pod.xyz", new byte[2048]));
            fail("Should not decode unknown file type");
        } catch (PodDecodeException pde) {
            assertEquals("Unknown file type: XYZ", pde.getMessage());
        }
    }

    @Test
    public void testShortHeader()
        throws IOException
    {
        try {
            subject.read(new ByteBufferSource("pod.fp1", new byte[100]));
            fail("Should not decode truncated header");
        } catch (PodDecodeException pde) {
            assertTrue(pde.getMessage(),
                       pde.getMessage().startsWith("Unable to read 1024-byte" +
                                                   " FP1 header"));
        }
    }

    @Test(expected = PodDecodeException.class)
    public void testEmptyFile()
        throws IOException, PodDecodeException
    {
        subject.read(new ByteBufferSource("pod.cp3", new byte[0]));
    }

    @Test
    public void testReadFile()
        throws IOException, PodDecodeException
    {
        File file = tmpDir.newFile("deployment.FP3");
        Files.write(file.toPath(), fp3File().toByteArray());

        DecodedDataset data = subject.read(file.toPath());
        assertEquals("deployment.FP3", data.getHeader().getFileName());
        assertEquals(3, data.getClickCount());
    }

    @Test(expected = NoSuchFileException.class)
    public void testMissingFile()
        throws IOException, PodDecodeException
    {
        subject.read(tmpDir.getRoot().toPath().resolve("missing.cp1"));
    }

    @Test(expected = PodDecodeException.class)
    public void testBadExtensionBeforeOpen()
        throws IOException, PodDecodeException
    {
        Path path = tmpDir.getRoot().toPath().resolve("missing.txt");
        subject.read(path);
    }

    @Test
    public void testEstimateRecords()
    {
        assertEquals(10, subject.estimateRecords(PodFormat.FP1,
                                                 1024 + 16 * 10 + 5));
        assertEquals(0, subject.estimateRecords(PodFormat.CP3, 100));
        assertEquals(0, new PodFileReader(false)
                     .estimateRecords(PodFormat.FP1, 1024 + 16 * 10));
    }

    @Test
    public void testPresizeProperty()
    {
        System.setProperty(PodFileReader.PROP_PRESIZE, "false");
        try {
            assertEquals(0, new PodFileReader()
                         .estimateRecords(PodFormat.CP1, 360 + 10 * 50));
        } finally {
            System.clearProperty(PodFileReader.PROP_PRESIZE);
        }
        assertEquals(50, new PodFileReader()
                     .estimateRecords(PodFormat.CP1, 360 + 10 * 50));
    }
}
