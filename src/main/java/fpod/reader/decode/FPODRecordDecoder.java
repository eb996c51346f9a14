package fpod.reader.decode;

import fpod.reader.data.ClickRecord;
import fpod.reader.data.DecodedDataset;
import fpod.reader.data.EnvironmentalSample;
import fpod.reader.data.TrainRecord;
import fpod.reader.data.WaveformAccumulator;
import fpod.reader.data.WaveformChunk;
import fpod.reader.data.WaveformSeries;
import fpod.reader.format.DeviceFamily;
import fpod.reader.format.PodFormat;
import fpod.reader.record.BlockKind;
import fpod.reader.record.FPODBlockReader;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Decodes the data records of FP1 and FP3 files.
 *
 * Train and wave records describe the click which follows them.  They are
 * held against the index of that click and attached when it is decoded.
 */
public class FPODRecordDecoder
    extends AbstractRecordDecoder
{
    private static final Logger LOG =
        Logger.getLogger(FPODRecordDecoder.class);

    private final FPODBlockReader reader = FPODBlockReader.instance;

    /** Selects the battery layout of minute records. */
    private final int picVersion;

    private final Map<Integer, TrainRecord> pendingTrains =
        new HashMap<Integer, TrainRecord>();
    private final WaveformAccumulator waves = new WaveformAccumulator();

    public FPODRecordDecoder(final PodFormat format, final int picVersion)
    {
        super(format);
        if (format.family() != DeviceFamily.FPOD) {
            throw new IllegalArgumentException("Not an FPOD format: " +
                                               format);
        }
        this.picVersion = picVersion;
    }

    @Override
    protected boolean process(final ByteBuffer buf,
                              final DecodedDataset.Builder out)
    {
        final BlockKind kind = reader.getKind(buf);
        logBlock(kind, buf);

        switch (kind) {
        case CLICK:
            currentClick++;
            decodeClick(buf, out);
            out.getStats().reportClick();
            break;
        case TRAIN:
            pendingTrains.put(currentClick + 1, decodeTrain(buf));
            out.getStats().reportTrain();
            break;
        case WAVE:
            final boolean opened =
                waves.append(currentClick + 1, decodeWave(buf));
            if (opened && LOG.isDebugEnabled()) {
                LOG.debug("Started waveform for click #" + (currentClick + 2));
            }
            out.getStats().reportWave();
            break;
        case MINUTE:
            currentMinute++;
            out.addEnvironment(
                new EnvironmentalSample(currentMinute + 1,
                                        reader.getTemperature(buf),
                                        reader.getBattery1(buf, picVersion),
                                        reader.getBattery2(buf, picVersion)));
            out.getStats().reportMinute();
            break;
        case UNKNOWN:
        default:
            out.getStats().reportUnknown();
            break;
        }
        return true;
    }

    private void decodeClick(final ByteBuffer buf,
                             final DecodedDataset.Builder out)
    {
        final WaveformSeries series = waves.release(currentClick);

        ClickRecord click = new ClickRecord.Builder(currentClick + 1)
            .time(currentMinute, reader.getMicrosec(buf))
            .cycles(reader.getCycles(buf))
            .peakAt(reader.getPeakAt(buf))
            .ipi(reader.getIpiRange(buf), reader.getIpiPreMax(buf),
                 reader.getIpiAtMax(buf))
            .amplitude(reader.getAmplitude(buf),
                       reader.getAmplitudeReversals(buf))
            .duration(reader.getDuration(buf))
            .hasWav(series != null)
            .train(pendingTrains.remove(currentClick))
            .build();

        out.addClick(click);
        if (series != null) {
            out.addWaveform(series);
        }
    }

    private TrainRecord decodeTrain(final ByteBuffer buf)
    {
        return new TrainRecord(reader.getTrainId(buf),
                               reader.getSpecies(buf, format),
                               reader.getQualityLevel(buf),
                               reader.isEcho(buf));
    }

    private WaveformChunk decodeWave(final ByteBuffer buf)
    {
        int[] ipi = new int[FPODBlockReader.WAVE_PAIRS];
        int[] amp = new int[FPODBlockReader.WAVE_PAIRS];
        for (int i = 0; i < FPODBlockReader.WAVE_PAIRS; i++) {
            ipi[i] = reader.getWaveIpi(buf, i);
            amp[i] = reader.getWaveAmplitude(buf, i);
        }
        return new WaveformChunk(ipi, amp);
    }

    @Override
    protected void finish(final DecodedDataset.Builder out)
    {
        final int dangling = pendingTrains.size() + waves.discardPending();
        pendingTrains.clear();

        if (dangling > 0) {
            out.getStats().reportDiscarded(dangling);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Discarded " + dangling + " train/wave records" +
                          " for click #" + (currentClick + 2) +
                          " which is missing from the data");
            }
        }
    }
}
