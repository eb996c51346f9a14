package fpod.reader.decode;

import fpod.reader.data.ClickRecord;
import fpod.reader.data.DecodedDataset;
import fpod.reader.data.TrainRecord;
import fpod.reader.format.DeviceFamily;
import fpod.reader.format.PodFormat;
import fpod.reader.record.BlockKind;
import fpod.reader.record.CPODBlockReader;

import java.nio.ByteBuffer;

import org.apache.log4j.Logger;

/**
 * Decodes the data records of CP1 and CP3 files.
 *
 * The data region is closed by two consecutive 0xFF-filled records.  The
 * first of these is decoded like any other record, so the final click
 * is left out of the result.
 */
public class CPODRecordDecoder
    extends AbstractRecordDecoder
{
    private static final Logger LOG =
        Logger.getLogger(CPODRecordDecoder.class);

    /** Consecutive terminator records which end the data. */
    private static final int TERMINATOR_RUN = 2;

    private final CPODBlockReader reader = CPODBlockReader.instance;

    private int terminators;

    public CPODRecordDecoder(final PodFormat format)
    {
        super(format);
        if (format.family() != DeviceFamily.CPOD) {
            throw new IllegalArgumentException("Not a CPOD format: " +
                                               format);
        }
    }

    @Override
    protected boolean process(final ByteBuffer buf,
                              final DecodedDataset.Builder out)
    {
        if (reader.isTerminator(buf)) {
            out.getStats().reportTerminator();
            if (++terminators == TERMINATOR_RUN) {
                return false;
            }
        } else {
            terminators = 0;
        }

        final BlockKind kind = reader.getKind(buf);
        logBlock(kind, buf);

        switch (kind) {
        case MINUTE:
            // CPOD minute markers carry no environmental readings
            currentMinute++;
            out.getStats().reportMinute();
            break;
        case CLICK:
            currentClick++;
            out.addClick(decodeClick(buf));
            out.getStats().reportClick();
            break;
        case TRAIN:
        case WAVE:
        case UNKNOWN:
        default:
            out.getStats().reportUnknown();
            break;
        }
        return true;
    }

    private ClickRecord decodeClick(final ByteBuffer buf)
    {
        ClickRecord.Builder click = new ClickRecord.Builder(currentClick + 1)
            .time(currentMinute, reader.getMicrosec(buf))
            .cycles(reader.getCycles(buf))
            .kHz(reader.getKHz(buf))
            .amplitude(reader.getAmplitude(buf), 0)
            .duration(reader.getDuration(buf));

        if (format.hasTrainData()) {
            click.train(new TrainRecord(reader.getTrainId(buf),
                                        reader.getSpecies(buf, format),
                                        reader.getQualityLevel(buf), false));
        }
        return click.build();
    }

    @Override
    protected void finish(final DecodedDataset.Builder out)
    {
        ClickRecord dropped = out.removeLastClick();
        if (dropped != null && LOG.isDebugEnabled()) {
            LOG.debug("Dropped final record " + dropped);
        }
    }
}
