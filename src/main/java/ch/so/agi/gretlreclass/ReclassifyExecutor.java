package ch.so.agi.gretlreclass;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import ch.so.agi.gretlreclass.detect.BandLister;
import ch.so.agi.gretlreclass.detect.TypeDetector;
import ch.so.agi.gretlreclass.detect.ValueEnumerator;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ExecResult;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.raster.RasterProgress;
import ch.so.agi.gretlreclass.remote.JobMonitor;
import ch.so.agi.gretlreclass.remote.SessionProvider;
import ch.so.agi.gretlreclass.steps.RasterReclassifyStep;
import ch.so.agi.gretlreclass.steps.RemoteCollectionReclassifyStep;
import ch.so.agi.gretlreclass.steps.RemoteImageReclassifyStep;
import ch.so.agi.gretlreclass.steps.VectorReclassifyStep;
import ch.so.agi.gretlreclass.utils.BackendUnavailableException;
import ch.so.agi.gretlreclass.utils.DestinationNames;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Entry point of the reclassification engine.
 * <p>
 * {@link #run} validates the class table and matrix, inverts the matrix once
 * and dispatches on {@link SourceKind} to the step of the matching backend.
 * Validation errors are raised before anything is written. Two concurrent runs
 * targeting the same destination are rejected. With {@code aoi.enforce} set,
 * sources without an area of interest are rejected as well.
 * </p>
 */
public class ReclassifyExecutor {

    private final ReclassLogger log;
    private final ReclassifySettings settings;
    private final SessionProvider session;
    private final TypeDetector detector;
    private final ValueEnumerator enumerator;
    private final BandLister bandLister;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ReclassifyExecutor(ReclassifySettings settings) {
        this(settings, null);
    }

    /**
     * @param session remote backend, {@code null} if only local sources are used
     */
    public ReclassifyExecutor(ReclassifySettings settings, SessionProvider session) {
        LogEnvironment.initStandalone(settings.getLogLevel());
        this.settings = settings;
        this.session = session;
        this.detector = new TypeDetector(session, settings);
        this.enumerator = new ValueEnumerator(session, settings);
        this.bandLister = new BandLister(session, settings);
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public ReclassifySettings getSettings() {
        return settings;
    }

    public SourceDescriptor describe(String location, String bandOrColumn) {
        return detector.describe(location, bandOrColumn);
    }

    public List<String> listBands(String location) {
        return bandLister.listBands(detector.detect(location), location);
    }

    /**
     * @return the distinct values of the band or column, numbers ascending first, then text
     */
    public List<Object> enumerate(SourceDescriptor source) {
        requireAreaOfInterest(source);
        return enumerator.enumerate(source);
    }

    /**
     * Default output location: {@code <folder>/<stem>_reclass[.ext]}. Local rasters
     * are always written as GeoTIFF; remote ids are made unique against {@code existing}.
     *
     * @param folder   output directory or remote folder
     * @param existing remote asset ids already present, ignored for local sources
     */
    public String defaultDestination(SourceDescriptor source, String folder, Collection<String> existing) {
        if (source.getKind().isRemote()) {
            return DestinationNames.remoteDefault(source.getLocation(), folder, existing);
        }
        Path path = source.localPath();
        String ext = DestinationNames.extension(path);
        if (source.getKind() == SourceKind.LOCAL_RASTER && !".tiff".equals(ext)) {
            ext = ".tif";
        }
        return DestinationNames.localDefault(path, Path.of(folder), ext).toString();
    }

    public JobMonitor jobMonitor() {
        if (session == null) {
            throw new BackendUnavailableException("No remote session available");
        }
        return new JobMonitor(session, settings.getPollInterval(), settings.getSubmitTimeout());
    }

    public ExecResult run(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable, String destination) {
        return run(source, matrix, classTable, destination, RasterProgress.NONE);
    }

    /**
     * @param progress block progress and cancellation of local raster runs, ignored otherwise
     * @throws ReclassifyException carrying the source id and the failing stage
     */
    public ExecResult run(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable, String destination,
            RasterProgress progress) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(classTable, "classTable");
        Objects.requireNonNull(destination, "destination");
        String id = source.getLocation();
        requireAreaOfInterest(source);

        String key = source.getKind().isRemote() ? destination
                : Path.of(destination).toAbsolutePath().normalize().toString();
        if (!inFlight.add(key)) {
            throw new ReclassifyException(id, Stage.VALIDATE, "Destination " + destination
                    + " is already being written by another run");
        }
        try {
            Set<Object> enumerated = validate(source, matrix, classTable);
            log.info("Reclassifying " + source + " into " + destination + " with " + matrix.destinationCodes().size()
                    + " classes");

            ExecResult result;
            switch (source.getKind()) {
            case LOCAL_RASTER:
                result = new RasterReclassifyStep(settings)
                        .execute(source, matrix, classTable, Path.of(destination), progress);
                break;
            case LOCAL_VECTOR:
                result = new VectorReclassifyStep(settings).execute(source, matrix, Path.of(destination));
                break;
            case REMOTE_IMAGE:
                result = new RemoteImageReclassifyStep(requireSession(id), settings)
                        .execute(source, matrix, classTable, destination, enumerated);
                break;
            case REMOTE_FEATURE_COLLECTION:
                result = new RemoteCollectionReclassifyStep(requireSession(id), settings)
                        .execute(source, matrix, destination, enumerated);
                break;
            default:
                throw new IllegalStateException("Unhandled source kind " + source.getKind());
            }
            return result;
        } catch (ReclassifyException e) {
            throw e.withContext(id, Stage.TRANSFORM);
        } finally {
            inFlight.remove(key);
        }
    }

    /**
     * @return the enumerated source values in strict mode, {@code null} otherwise
     */
    private Set<Object> validate(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable) {
        try {
            classTable.requireUsable();
            Set<Object> enumerated = null;
            if (settings.isStrict()) {
                enumerated = new LinkedHashSet<>(enumerator.enumerate(source));
                matrix.validate(enumerated);
            } else {
                matrix.validateAssignments();
            }
            matrix.invert();
            return enumerated;
        } catch (ReclassifyException e) {
            log.error("Rejected matrix for " + source, e);
            throw e.withContext(source.getLocation(), Stage.VALIDATE);
        }
    }

    private void requireAreaOfInterest(SourceDescriptor source) {
        if (settings.isEnforceAreaOfInterest() && source.getAreaOfInterest() == null) {
            throw new ReclassifyException(source.getLocation(), Stage.VALIDATE,
                    "An area of interest is required (aoi.enforce=true)");
        }
    }

    private SessionProvider requireSession(String id) {
        if (session == null) {
            throw new BackendUnavailableException(id, Stage.TRANSFORM, "No remote session available");
        }
        return session;
    }
}
