package ch.so.agi.gretlreclass.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import ch.so.agi.gretlreclass.utils.BackendTimeoutException;
import ch.so.agi.gretlreclass.utils.Stage;

class JobMonitorTest {

    private final RecordingSessionProvider session = new RecordingSessionProvider();
    private final JobMonitor monitor = new JobMonitor(session, Duration.ofMillis(1), Duration.ofSeconds(1));
    private final JobReference job = new JobReference("job-1", "users/me/out");

    @Test
    void awaitPollsUntilTerminal() {
        session.statuses.add(JobStatus.PENDING);
        session.statuses.add(JobStatus.RUNNING);
        session.statuses.add(JobStatus.COMPLETED);

        assertSame(JobStatus.COMPLETED, monitor.await(job, Duration.ofSeconds(10)));
        assertEquals(3, session.calls.size());
    }

    @Test
    void failedJobIsReturnedNotRetried() {
        session.statuses.add(JobStatus.FAILED);

        assertSame(JobStatus.FAILED, monitor.await(job, Duration.ofSeconds(10)));
        assertEquals(1, session.calls.size());
    }

    @Test
    void awaitGivesUpAfterMaxWait() {
        session.statuses.add(JobStatus.RUNNING);

        BackendTimeoutException e = assertThrows(BackendTimeoutException.class,
                () -> monitor.await(job, Duration.ofMillis(20)));
        assertEquals(Stage.COMMIT, e.getStage());
    }

    @Test
    void cancelIsForwarded() {
        monitor.cancel(job);

        assertEquals(job, session.lastCancelled);
    }
}
