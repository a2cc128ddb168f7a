package ch.so.agi.gretlreclass.model;

import java.nio.file.Path;
import java.util.Objects;

import ch.so.agi.gretlreclass.remote.JobReference;

/**
 * Outcome of a reclassification run. Local runs carry the committed output
 * file, remote runs an export job that may still be running.
 */
public final class ExecResult {

    private final SourceKind kind;
    private final String sourceId;
    private final Path outputPath;
    private final JobReference jobReference;
    private final MatrixSummary summary;
    private final long outputBytes;

    private ExecResult(SourceKind kind, String sourceId, Path outputPath, JobReference jobReference,
            MatrixSummary summary, long outputBytes) {
        this.kind = Objects.requireNonNull(kind);
        this.sourceId = sourceId;
        this.outputPath = outputPath;
        this.jobReference = jobReference;
        this.summary = Objects.requireNonNull(summary);
        this.outputBytes = outputBytes;
    }

    public static ExecResult local(SourceKind kind, String sourceId, Path outputPath, MatrixSummary summary,
            long outputBytes) {
        return new ExecResult(kind, sourceId, Objects.requireNonNull(outputPath), null, summary, outputBytes);
    }

    public static ExecResult remote(SourceKind kind, String sourceId, JobReference job, MatrixSummary summary) {
        return new ExecResult(kind, sourceId, null, Objects.requireNonNull(job), summary, -1);
    }

    public SourceKind getKind() {
        return kind;
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * @return the written file, {@code null} for remote runs
     */
    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * @return the export job, {@code null} for local runs
     */
    public JobReference getJobReference() {
        return jobReference;
    }

    public MatrixSummary getSummary() {
        return summary;
    }

    /**
     * @return size of the written output in bytes, {@code -1} for remote runs
     */
    public long getOutputBytes() {
        return outputBytes;
    }

    @Override
    public String toString() {
        return kind + " " + sourceId + " -> " + (outputPath != null ? outputPath : jobReference) + " [" + summary + "]";
    }
}
