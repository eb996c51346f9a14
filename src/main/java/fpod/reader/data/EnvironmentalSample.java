package fpod.reader.data;

/**
 * Readings stored with a minute marker.
 */
public final class EnvironmentalSample
{
    private final int minute;
    private final int temperature;
    private final int battery1;
    private final int battery2;

    public EnvironmentalSample(final int minute, final int temperature,
                               final int battery1, final int battery2)
    {
        this.minute = minute;
        this.temperature = temperature;
        this.battery1 = battery1;
        this.battery2 = battery2;
    }

    /** Sequential minute number, starting at 1. */
    public int getMinute() { return minute; }

    /** Temperature in degrees Celsius. */
    public int getTemperature() { return temperature; }

    /** Battery stack 1 voltage in units of 10 mV. */
    public int getBattery1() { return battery1; }

    /** Battery stack 2 voltage in units of 10 mV. */
    public int getBattery2() { return battery2; }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o) return true;
        if (!(o instanceof EnvironmentalSample)) return false;
        EnvironmentalSample other = (EnvironmentalSample) o;
        return minute == other.minute && temperature == other.temperature &&
            battery1 == other.battery1 && battery2 == other.battery2;
    }

    @Override
    public int hashCode()
    {
        return ((minute * 31 + temperature) * 31 + battery1) * 31 + battery2;
    }

    @Override
    public String toString()
    {
        return String.format("min %d: %d degC, bat %d/%d", minute,
                             temperature, battery1, battery2);
    }
}
