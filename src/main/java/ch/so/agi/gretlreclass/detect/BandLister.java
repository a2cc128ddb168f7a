package ch.so.agi.gretlreclass.detect;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.raster.GeoTiffSource;
import ch.so.agi.gretlreclass.remote.RemoteCalls;
import ch.so.agi.gretlreclass.remote.SessionProvider;
import ch.so.agi.gretlreclass.utils.NaturalOrderComparator;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.vector.AttributeTables;

/**
 * Bands or columns a user can pick for reclassification.
 */
public class BandLister {

    /** Bookkeeping properties of remote collections. */
    static final Set<String> HIDDEN_PROPERTIES = Set.of("system:index", "Shape_Area");

    private final SessionProvider session;
    private final ReclassifySettings settings;

    public BandLister(SessionProvider session, ReclassifySettings settings) {
        this.session = session;
        this.settings = settings;
    }

    /**
     * @return 1-based band numbers for local rasters, names otherwise, in natural order
     */
    public List<String> listBands(SourceKind kind, String location) {
        try {
            switch (kind) {
            case LOCAL_RASTER:
                return rasterBands(Path.of(location));
            case LOCAL_VECTOR:
                return sorted(AttributeTables.open(Path.of(location)).getColumnNames());
            case REMOTE_IMAGE:
            case REMOTE_FEATURE_COLLECTION:
                return remoteBands(kind, location);
            default:
                throw new IllegalStateException("Unhandled source kind " + kind);
            }
        } catch (IOException e) {
            throw new ReclassifyException(location, Stage.DETECT, e.getMessage(), e);
        }
    }

    private static List<String> rasterBands(Path file) throws IOException {
        try (GeoTiffSource source = GeoTiffSource.open(file)) {
            List<String> bands = new ArrayList<>(source.getNumBands());
            for (int i = 1; i <= source.getNumBands(); i++) {
                bands.add(Integer.toString(i));
            }
            return bands;
        }
    }

    private List<String> remoteBands(SourceKind kind, String location) {
        SessionProvider s = ValueEnumerator.requireSession(session, location, Stage.DETECT);
        List<String> names = RemoteCalls.call(location, Stage.DETECT, "listBands", settings.getEnumerateTimeout(),
                () -> s.listBands(location, settings.getEnumerateTimeout()));
        List<String> out = new ArrayList<>(names);
        if (kind == SourceKind.REMOTE_FEATURE_COLLECTION) {
            out.removeAll(HIDDEN_PROPERTIES);
        }
        return sorted(out);
    }

    private static List<String> sorted(List<String> names) {
        List<String> out = new ArrayList<>(names);
        out.sort(NaturalOrderComparator.INSTANCE);
        return out;
    }
}
