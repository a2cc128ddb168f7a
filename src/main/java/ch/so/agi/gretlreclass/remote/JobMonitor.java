package ch.so.agi.gretlreclass.remote;

import java.time.Duration;

import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.utils.BackendTimeoutException;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Polls export jobs for callers that want to wait for completion. The engine
 * itself never waits on a job.
 */
public class JobMonitor {
    private final ReclassLogger log;
    private final SessionProvider session;
    private final Duration pollInterval;
    private final Duration callTimeout;

    public JobMonitor(SessionProvider session, Duration pollInterval, Duration callTimeout) {
        this.session = session;
        this.pollInterval = pollInterval;
        this.callTimeout = callTimeout;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public JobStatus status(JobReference job) {
        return RemoteCalls.call(job.getDestination(), Stage.COMMIT, "jobStatus", callTimeout,
                () -> session.jobStatus(job, callTimeout));
    }

    /**
     * Polls until the job reaches {@link JobStatus#COMPLETED} or
     * {@link JobStatus#FAILED}. Failed jobs are not retried.
     *
     * @param maxWait upper bound for the whole wait
     * @return the terminal status
     * @throws BackendTimeoutException if the job is still running after {@code maxWait}
     * @throws ReclassifyException     if the polling thread is interrupted
     */
    public JobStatus await(JobReference job, Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            JobStatus status = status(job);
            log.debug("Job " + job.getId() + " is " + status);
            if (status.isTerminal()) {
                log.info("Job " + job.getId() + " finished with " + status);
                return status;
            }
            if (System.nanoTime() >= deadline) {
                throw new BackendTimeoutException(job.getDestination(), Stage.COMMIT,
                        "Job " + job.getId() + " still " + status + " after " + maxWait.toSeconds() + " s");
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReclassifyException(job.getDestination(), Stage.COMMIT,
                        "Interrupted while waiting for job " + job.getId(), e);
            }
        }
    }

    public void cancel(JobReference job) {
        RemoteCalls.call(job.getDestination(), Stage.COMMIT, "cancel", callTimeout, () -> {
            session.cancel(job, callTimeout);
            return null;
        });
        log.info("Requested cancellation of job " + job.getId());
    }
}
