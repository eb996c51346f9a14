package fpod.reader.header;

import fpod.reader.format.PodFormat;
import fpod.reader.test.PodFileBuilder;

import java.nio.ByteBuffer;

import org.junit.Test;

import static org.junit.Assert.*;

public class CPODHeaderDecoderTest
{

    private static PodFileBuilder sampleHeader(PodFormat format)
    {
        return new PodFileBuilder(format)
            .headerText(13, "5530.12N")
            .headerText(21, "01030.5E")
            .headerInt(29, 2, 12)
            .headerInt(31, 2, 0x0123)
            .headerText(33, "Hanstholm reef")
            .headerText(164, "1234")
            .headerText(211, "deployed by boat")
            .headerInt(256, 4, 61000000)
            .headerInt(260, 4, 61043200);
    }

    private static PodHeader decode(PodFileBuilder builder)
    {
        ByteBuffer buf = ByteBuffer.wrap(builder.toByteArray(), 0,
                                         builder.format().headerSize());
        return CPODHeaderDecoder.instance.decode(buf.slice(), builder.format(),
                                                 "x." + builder.format());
    }

    @Test
    public void testCP1Header()
    {
        PodHeader hdr = decode(sampleHeader(PodFormat.CP1));

        assertSame(PodFormat.CP1, hdr.getFormat());
        assertEquals("x.CP1", hdr.getFileName());
        assertEquals("1234", hdr.getPodId());
        assertEquals(61000000, hdr.getFirstLoggedMinute());
        assertEquals(61043200, hdr.getLastLoggedMinute());
        assertEquals(0x0123, hdr.getWaterDepth());
        assertEquals(12, hdr.getDeploymentDepth());
        assertEquals("5530.12N", hdr.getLatText());
        assertEquals("01030.5E", hdr.getLonText());
        assertEquals("", hdr.getGmtText());
        assertEquals(0, hdr.getPicVersion());
        assertEquals(0, hdr.getFpgaVersion());
        assertFalse(hdr.hasExtendedAmps());
        assertFalse(hdr.hasPriorClickCount());
        assertEquals(0L, hdr.getPriorClickCount());
    }

    @Test
    public void testTextFieldsKeepPadding()
    {
        PodHeader hdr = decode(sampleHeader(PodFormat.CP1));

        assertEquals(31, hdr.getLocationText().length());
        assertTrue(hdr.getLocationText().startsWith("Hanstholm reef\u0000"));
        assertEquals(50, hdr.getNotesText().length());
        assertEquals("deployed by boat", hdr.getNotesText().substring(0, 16));
        assertEquals('\u0000', hdr.getNotesText().charAt(40));
    }

    @Test
    public void testCP3PriorClickCount()
    {
        PodHeader hdr = decode(sampleHeader(PodFormat.CP3)
                               .headerInt(128, 4, 0xfffffffeL));

        assertTrue(hdr.hasPriorClickCount());
        assertEquals(0xfffffffeL, hdr.getPriorClickCount());
        assertEquals("1234", hdr.getPodId());
    }

    @Test
    public void testCP1IgnoresPriorClickCount()
    {
        PodHeader hdr = decode(sampleHeader(PodFormat.CP1)
                               .headerInt(128, 4, 99));
        assertFalse(hdr.hasPriorClickCount());
    }
}
