package ch.so.agi.gretlreclass.detect;

import java.util.Locale;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.remote.RemoteCalls;
import ch.so.agi.gretlreclass.remote.SessionProvider;
import ch.so.agi.gretlreclass.utils.BackendUnavailableException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.utils.UnrecognizedSourceException;

/**
 * Classifies a source identifier into a {@link SourceKind}.
 * <p>
 * Local files are recognised by suffix (case-insensitive): {@code .tif},
 * {@code .tiff} and {@code .vrt} are rasters, {@code .shp} and
 * {@code .geojson} vectors. Anything else is treated as a remote asset id and
 * classified by the asset type the backend reports.
 * </p>
 */
public class TypeDetector {

    public static final String ASSET_TYPE_IMAGE = "IMAGE";
    public static final String ASSET_TYPE_TABLE = "TABLE";

    private final ReclassLogger log;
    private final SessionProvider session;
    private final ReclassifySettings settings;

    /**
     * @param session remote backend, {@code null} if only local sources are used
     */
    public TypeDetector(SessionProvider session, ReclassifySettings settings) {
        this.session = session;
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    /**
     * @throws UnrecognizedSourceException  if neither suffix nor asset type match a supported kind
     * @throws BackendUnavailableException  if the backend cannot be asked
     */
    public SourceKind detect(String location) {
        if (location == null || location.isBlank()) {
            throw new UnrecognizedSourceException(location, Stage.DETECT, "Empty source identifier");
        }
        SourceKind local = localKind(location);
        if (local != null) {
            log.debug(location + " is a " + local);
            return local;
        }
        if (looksLikeFile(location)) {
            throw new UnrecognizedSourceException(location, Stage.DETECT,
                    "Unsupported file type, expected .tif, .tiff, .vrt, .shp or .geojson");
        }
        if (session == null) {
            throw new UnrecognizedSourceException(location, Stage.DETECT,
                    "Not a supported local file and no remote session is available");
        }
        String type = RemoteCalls.call(location, Stage.DETECT, "assetType", settings.getEnumerateTimeout(),
                () -> session.assetType(location, settings.getEnumerateTimeout()));
        String normalized = type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
        SourceKind kind;
        switch (normalized) {
        case ASSET_TYPE_IMAGE:
            kind = SourceKind.REMOTE_IMAGE;
            break;
        case ASSET_TYPE_TABLE:
            kind = SourceKind.REMOTE_FEATURE_COLLECTION;
            break;
        default:
            throw new UnrecognizedSourceException(location, Stage.DETECT, "Unsupported asset type " + type);
        }
        log.debug(location + " is a " + kind);
        return kind;
    }

    public SourceDescriptor describe(String location, String bandOrColumn) {
        return new SourceDescriptor(detect(location), location, bandOrColumn);
    }

    static SourceKind localKind(String location) {
        String name = location.toLowerCase(Locale.ROOT);
        if (name.endsWith(".tif") || name.endsWith(".tiff") || name.endsWith(".vrt")) {
            return SourceKind.LOCAL_RASTER;
        }
        if (name.endsWith(".shp") || name.endsWith(".geojson")) {
            return SourceKind.LOCAL_VECTOR;
        }
        return null;
    }

    /**
     * Remote asset ids never carry a file extension in their last segment.
     */
    private static boolean looksLikeFile(String location) {
        String name = location.substring(Math.max(location.lastIndexOf('/'), location.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return false;
        }
        String ext = name.substring(dot + 1);
        return ext.length() <= 7 && ext.chars().allMatch(Character::isLetterOrDigit);
    }
}
