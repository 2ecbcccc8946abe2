package geoflow.coordinator.scheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SchedulerTest {

    private static final Duration OFF = Duration.ZERO;

    @Mock
    JobReaper jobReaper;
    @Mock
    WorkFailer workFailer;
    @Mock
    WorkReaper workReaper;

    @Test
    void runsEnabledTasksRepeatedly() throws Exception {
        CountDownLatch kicks = new CountDownLatch(3);
        Scheduler.Intervals intervals = new Scheduler.Intervals(OFF, OFF, OFF, Duration.ofMillis(20));

        try (Scheduler scheduler = new Scheduler(jobReaper, workFailer, workReaper, kicks::countDown, intervals)) {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            assertTrue(kicks.await(5, TimeUnit.SECONDS));
        }
        verify(jobReaper, never()).run();
        verify(workFailer, never()).run();
        verify(workReaper, never()).run();
    }

    @Test
    void failingTaskKeepsItsSchedule() throws Exception {
        CountDownLatch afterFailure = new CountDownLatch(2);
        doThrow(new IllegalStateException("boom")).when(workFailer).run();
        Scheduler.Intervals intervals = new Scheduler.Intervals(
                OFF, Duration.ofMillis(10), OFF, Duration.ofMillis(30));

        try (Scheduler scheduler = new Scheduler(jobReaper, workFailer, workReaper, afterFailure::countDown,
                intervals)) {
            scheduler.start();
            assertTrue(afterFailure.await(5, TimeUnit.SECONDS));
        }
        verify(workFailer, atLeast(2)).run();
    }

    @Test
    void stopIsIdempotent() {
        Scheduler scheduler = new Scheduler(jobReaper, workFailer, workReaper, () -> { },
                new Scheduler.Intervals(OFF, OFF, OFF, OFF));
        scheduler.start();
        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
