package ch.so.agi.gretlreclass.steps;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.ExecResult;
import ch.so.agi.gretlreclass.model.MatrixSummary;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.model.ValueCounts;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.vector.AttributeTable;
import ch.so.agi.gretlreclass.vector.AttributeTables;
import ch.so.agi.gretlreclass.vector.ShapefileTable;
import ch.so.agi.gretlreclass.vector.VectorFormat;

/**
 * Adds a reclassified column to a local vector dataset.
 * <p>
 * The source is copied to the destination in the same format with all
 * geometries and columns unchanged plus one integer column (named by
 * {@code output.column}) holding the class code of every record. Records
 * whose value is missing or unmapped get the default value. With an area of
 * interest only the records whose bounding box intersects it are written.
 * Vector formats cannot carry a palette, so the class table is not used here.
 * </p>
 */
public class VectorReclassifyStep {
    private ReclassLogger log;
    private String taskName;
    private final ReclassifySettings settings;

    public VectorReclassifyStep(ReclassifySettings settings) {
        this(null, settings);
    }

    public VectorReclassifyStep(String taskName, ReclassifySettings settings) {
        if (taskName == null) {
            this.taskName = VectorReclassifyStep.class.getSimpleName();
        } else {
            this.taskName = taskName;
        }
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public ExecResult execute(SourceDescriptor source, ReclassMatrix matrix, Path destination) {
        String id = source.getLocation();
        String column = source.getBandOrColumn();
        String outputColumn = settings.getOutputColumn();
        log.lifecycle(String.format(
                "Start VectorReclassifyStep(Name: %s source: %s column: %s destination: %s outputColumn: %s)",
                taskName, id, column, destination, outputColumn));

        VectorFormat format = VectorFormat.of(source.localPath());
        if (format == null || format != VectorFormat.of(destination)) {
            throw new ReclassifyException(id, Stage.VALIDATE,
                    "Destination " + destination + " must have the format of the source (" + format + ")");
        }

        try {
            AttributeTable table = AttributeTables.open(source.localPath());
            if (source.getAreaOfInterest() != null) {
                int all = table.size();
                table = table.within(source.getAreaOfInterest());
                log.info(table.size() + " of " + all + " records intersect " + source.getAreaOfInterest());
                if (table.size() == 0) {
                    log.warn("No record of " + id + " intersects " + source.getAreaOfInterest()
                            + ", the output will be empty");
                }
            }
            if (!table.hasColumn(column)) {
                throw new ReclassifyException(id, Stage.VALIDATE,
                        "Column " + column + " does not exist, available: " + table.getColumnNames());
            }
            if (table.hasColumn(outputColumn)) {
                throw new ReclassifyException(id, Stage.VALIDATE,
                        "Output column " + outputColumn + " already exists in the source");
            }
            if (format == VectorFormat.SHAPEFILE && outputColumn.length() > ShapefileTable.MAX_COLUMN_NAME) {
                throw new ReclassifyException(id, Stage.VALIDATE, "Output column " + outputColumn
                        + " is longer than " + ShapefileTable.MAX_COLUMN_NAME + " characters");
            }

            List<Object> values = table.column(column);
            int[] codes = new int[values.size()];
            Map<Object, Long> counts = new HashMap<>();
            long missing = 0;
            for (int i = 0; i < codes.length; i++) {
                Object value = values.get(i);
                codes[i] = matrix.lookup(value);
                if (table.isDeleted(i)) {
                    continue;
                }
                if (value == null) {
                    missing++;
                } else {
                    counts.merge(value, 1L, Long::sum);
                }
            }
            log.debug("Remapped " + codes.length + " records, " + missing + " without value");

            table.writeWithColumn(destination, outputColumn, codes);
            long bytes = Files.size(destination);
            MatrixSummary summary = ValueCounts.summarize(matrix, counts, missing);
            log.info("Reclassified " + table.size() + " records: " + summary);
            log.lifecycle(String.format("Finished VectorReclassifyStep(Name: %s output: %s)", taskName, destination));
            return ExecResult.local(SourceKind.LOCAL_VECTOR, id, destination, summary, bytes);
        } catch (IOException e) {
            log.error("VectorReclassifyStep " + taskName + " failed", e);
            throw new ReclassifyException(id, Stage.TRANSFORM, e.getMessage(), e);
        }
    }
}
