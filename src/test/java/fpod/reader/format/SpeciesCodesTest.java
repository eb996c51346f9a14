package fpod.reader.format;

import org.junit.Test;

import static org.junit.Assert.*;

public class SpeciesCodesTest
{

    @Test
    public void testCpodCodes()
    {
        assertEquals("NBHF", SpeciesCodes.lookup(0, PodFormat.CP3));
        assertEquals("NBHF", SpeciesCodes.lookup(1, PodFormat.CP3));
        assertEquals("OtherCet", SpeciesCodes.lookup(2, PodFormat.CP3));
        assertEquals("OtherCet", SpeciesCodes.lookup(3, PodFormat.CP3));
        assertEquals("Unclassed", SpeciesCodes.lookup(4, PodFormat.CP3));
        assertEquals("Unclassed", SpeciesCodes.lookup(5, PodFormat.CP3));
        assertEquals("Sonar", SpeciesCodes.lookup(6, PodFormat.CP3));
        assertEquals("Sonar", SpeciesCodes.lookup(7, PodFormat.CP3));
        assertEquals("", SpeciesCodes.lookup(8, PodFormat.CP3));
        assertEquals("", SpeciesCodes.lookup(31, PodFormat.CP3));
    }

    @Test
    public void testFpodCodes()
    {
        assertEquals("NBHF", SpeciesCodes.lookup(0, PodFormat.FP3));
        assertEquals("OtherCet", SpeciesCodes.lookup(1, PodFormat.FP3));
        assertEquals("Unclassed", SpeciesCodes.lookup(2, PodFormat.FP3));
        assertEquals("Sonar", SpeciesCodes.lookup(3, PodFormat.FP3));
        assertEquals("", SpeciesCodes.lookup(4, PodFormat.FP3));
    }

    @Test
    public void testNegativeCode()
    {
        assertEquals("", SpeciesCodes.cpodSpecies(-1));
        assertEquals("", SpeciesCodes.fpodSpecies(-1));
    }

    @Test
    public void testFormatsWithoutTrains()
    {
        assertEquals("", SpeciesCodes.lookup(0, PodFormat.CP1));
        assertEquals("", SpeciesCodes.lookup(0, PodFormat.FP1));
    }
}
