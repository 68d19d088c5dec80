package nl.pim16aap2.valheimkeeper.runtime.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorTaskSchedulerTest
{
    @Test
    void scheduleWithFixedDelay_shouldKeepRunningAfterTaskFailure()
        throws InterruptedException
    {
        // setup
        final CountDownLatch latch = new CountDownLatch(3);
        final AtomicInteger runs = new AtomicInteger();

        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("test-scheduler"))
        {
            // execute
            scheduler.scheduleWithFixedDelay(() ->
            {
                runs.incrementAndGet();
                latch.countDown();
                throw new IllegalStateException("expected failure");
            }, Duration.ZERO, Duration.ofMillis(10));

            // verify
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(runs.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void cancel_shouldPreventDelayedTaskFromRunning()
        throws InterruptedException
    {
        // setup
        final AtomicInteger runs = new AtomicInteger();

        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("test-scheduler"))
        {
            final ScheduledTask task = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));

            // execute
            task.cancel();
            Thread.sleep(400L);

            // verify
            assertThat(task.isCancelled()).isTrue();
            assertThat(runs.get()).isZero();
        }
    }
}
