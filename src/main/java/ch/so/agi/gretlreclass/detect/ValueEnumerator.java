package ch.so.agi.gretlreclass.detect;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.locationtech.jts.geom.Geometry;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.raster.RasterHistogram;
import ch.so.agi.gretlreclass.raster.ValueHistogram;
import ch.so.agi.gretlreclass.remote.RemoteCalls;
import ch.so.agi.gretlreclass.remote.SessionProvider;
import ch.so.agi.gretlreclass.utils.BackendUnavailableException;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.SourceValues;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.vector.AttributeTable;
import ch.so.agi.gretlreclass.vector.AttributeTables;

/**
 * Lists the distinct values of a band or column, ordered by
 * {@link SourceValues#ORDER}.
 * <p>
 * Local rasters are scanned block by block into a histogram; local vector
 * tables are loaded whole; remote sources are asked in a single round trip.
 * Missing vector attributes are not listed.
 * </p>
 */
public class ValueEnumerator {

    private final ReclassLogger log;
    private final SessionProvider session;
    private final ReclassifySettings settings;

    public ValueEnumerator(SessionProvider session, ReclassifySettings settings) {
        this.session = session;
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public List<Object> enumerate(SourceDescriptor source) {
        String id = source.getLocation();
        List<Object> values;
        try {
            switch (source.getKind()) {
            case LOCAL_RASTER:
                values = enumerateRaster(source);
                break;
            case LOCAL_VECTOR:
                values = enumerateVector(source);
                break;
            case REMOTE_IMAGE:
            case REMOTE_FEATURE_COLLECTION:
                values = enumerateRemote(source);
                break;
            default:
                throw new IllegalStateException("Unhandled source kind " + source.getKind());
            }
        } catch (IOException e) {
            throw new ReclassifyException(id, Stage.ENUMERATE, e.getMessage(), e);
        } catch (ReclassifyException e) {
            throw e.withContext(id, Stage.ENUMERATE);
        }
        log.info("Found " + values.size() + " distinct values in " + source);
        return values;
    }

    private List<Object> enumerateRaster(SourceDescriptor source) throws IOException {
        ValueHistogram histogram = RasterHistogram.compute(source.localPath(), source.bandIndex(),
                source.getAreaOfInterest(), settings);
        return SourceValues.sorted(histogram.counts().keySet());
    }

    private List<Object> enumerateVector(SourceDescriptor source) throws IOException {
        AttributeTable table = AttributeTables.open(source.localPath());
        if (source.getAreaOfInterest() != null) {
            table = table.within(source.getAreaOfInterest());
        }
        String column = source.getBandOrColumn();
        if (!table.hasColumn(column)) {
            throw new ReclassifyException(source.getLocation(), Stage.ENUMERATE,
                    "Column " + column + " does not exist, available: " + table.getColumnNames());
        }
        return SourceValues.sorted(new LinkedHashSet<>(SourceValues.normalizeAll(table.column(column))));
    }

    private List<Object> enumerateRemote(SourceDescriptor source) {
        SessionProvider s = requireSession(session, source.getLocation(), Stage.ENUMERATE);
        Set<Object> raw = RemoteCalls.call(source.getLocation(), Stage.ENUMERATE, "enumerateRemote",
                settings.getEnumerateTimeout(), () -> s.enumerateRemote(source.getLocation(),
                        source.getBandOrColumn(), region(source), settings.getEnumerateTimeout()));
        return SourceValues.sorted(new LinkedHashSet<>(SourceValues.normalizeAll(raw)));
    }

    private static Geometry region(SourceDescriptor source) {
        return source.getAreaOfInterest() != null ? source.getAreaOfInterest().getGeometry() : null;
    }

    static SessionProvider requireSession(SessionProvider session, String id, Stage stage) {
        if (session == null) {
            throw new BackendUnavailableException(id, stage, "No remote session available");
        }
        return session;
    }
}
