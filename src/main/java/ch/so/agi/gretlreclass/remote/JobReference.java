package ch.so.agi.gretlreclass.remote;

import java.util.Objects;

/**
 * Handle of an asynchronous export job on the remote backend. The job is not
 * guaranteed to be finished when the reference is handed out; poll it with
 * {@link SessionProvider#jobStatus(JobReference, java.time.Duration)} or
 * {@link JobMonitor}.
 */
public final class JobReference {

    private final String id;
    private final String destination;

    public JobReference(String id, String destination) {
        this.id = Objects.requireNonNull(id, "id");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    public String getId() {
        return id;
    }

    /**
     * @return the asset id the job writes to
     */
    public String getDestination() {
        return destination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobReference)) return false;
        JobReference that = (JobReference) o;
        return id.equals(that.id) && destination.equals(that.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, destination);
    }

    @Override
    public String toString() {
        return "Job(" + id + " -> " + destination + ")";
    }
}
