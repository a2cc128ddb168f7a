package ch.so.agi.gretlreclass.steps;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ExecResult;
import ch.so.agi.gretlreclass.model.MatrixSummary;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.model.ValueCounts;
import ch.so.agi.gretlreclass.raster.RasterProgress;
import ch.so.agi.gretlreclass.raster.TransformReport;
import ch.so.agi.gretlreclass.raster.WindowedRasterTransform;
import ch.so.agi.gretlreclass.utils.DestinationNames;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Reclassifies one band of a local raster and writes the result as a single
 * band, 8-bit GeoTIFF with a color table derived from the class table.
 * <p>
 * The raster is processed window by window (see {@link WindowedRasterTransform}),
 * so memory use does not depend on the raster size. With an area of interest
 * only the pixel window covering it is written. The destination must have a
 * {@code .tif} or {@code .tiff} suffix.
 * </p>
 */
public class RasterReclassifyStep {
    private ReclassLogger log;
    private String taskName;
    private final ReclassifySettings settings;

    /**
     * Creates a step instance using the class name for logging context.
     */
    public RasterReclassifyStep(ReclassifySettings settings) {
        this(null, settings);
    }

    /**
     * @param taskName optional label used in lifecycle log messages; if {@code null} the class name is used
     */
    public RasterReclassifyStep(String taskName, ReclassifySettings settings) {
        if (taskName == null) {
            this.taskName = RasterReclassifyStep.class.getSimpleName();
        } else {
            this.taskName = taskName;
        }
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public ExecResult execute(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable, Path destination) {
        return execute(source, matrix, classTable, destination, RasterProgress.NONE);
    }

    /**
     * @param progress receives block progress and may cancel between blocks
     * @throws ReclassifyException on validation, I/O or cancellation; the destination is left untouched
     */
    public ExecResult execute(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable, Path destination,
            RasterProgress progress) {
        log.lifecycle(String.format(
                "Start RasterReclassifyStep(Name: %s source: %s band: %s destination: %s)",
                taskName, source.getLocation(), source.getBandOrColumn(), destination));

        String ext = DestinationNames.extension(destination);
        if (!".tif".equals(ext) && !".tiff".equals(ext)) {
            throw new ReclassifyException(source.getLocation(), Stage.VALIDATE,
                    "Raster output must be a GeoTIFF (.tif, .tiff): " + destination);
        }
        WindowedRasterTransform transform = new WindowedRasterTransform(settings);
        TransformReport report;
        try {
            report = transform.run(source.localPath(), source.bandIndex(), source.getAreaOfInterest(), matrix,
                    classTable, destination, progress);
        } catch (ReclassifyException e) {
            log.error("RasterReclassifyStep " + taskName + " failed in state " + transform.getFailedState(), e);
            throw e;
        }

        Map<Object, Long> counts = new LinkedHashMap<>(report.getHistogram().counts());
        MatrixSummary summary = ValueCounts.summarize(matrix, counts, 0);
        log.info("Wrote " + report.getBlocksProcessed() + " blocks, largest buffer " + report.getMaxBufferPixels()
                + " pixels, " + summary);
        log.lifecycle(String.format("Finished RasterReclassifyStep(Name: %s output: %s bytes: %d)",
                taskName, destination, report.getOutputBytes()));
        return ExecResult.local(SourceKind.LOCAL_RASTER, source.getLocation(), destination, summary,
                report.getOutputBytes());
    }
}
