package nl.pim16aap2.valheimkeeper.runtime.scheduling;

import lombok.extern.java.Log;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 */
@Log
public final class ExecutorTaskScheduler implements TaskScheduler
{
    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;

    /**
     * @param threadName
     *     The name of the thread that runs the tasks.
     */
    public ExecutorTaskScheduler(String threadName)
    {
        this(threadName, Clock.systemUTC());
    }

    ExecutorTaskScheduler(String threadName, Clock clock)
    {
        Objects.requireNonNull(threadName, "threadName may not be null.");
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
        final AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            final Thread thread = new Thread(runnable, threadName + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task)
    {
        executor.execute(guard(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        return new FutureTask(executor.schedule(guard(task), delay.toNanos(), TimeUnit.NANOSECONDS));
    }

    @Override
    public ScheduledTask scheduleWithFixedDelay(Runnable task, Duration initialDelay, Duration delay)
    {
        return new FutureTask(executor.scheduleWithFixedDelay(
            guard(task),
            initialDelay.toNanos(),
            delay.toNanos(),
            TimeUnit.NANOSECONDS
        ));
    }

    @Override
    public Instant now()
    {
        return clock.instant();
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }

    /**
     * Wraps a task so that a failure is logged instead of silently cancelling the periodic task it belongs to.
     */
    private static Runnable guard(Runnable task)
    {
        Objects.requireNonNull(task, "task may not be null.");
        return () ->
        {
            try
            {
                task.run();
            }
            catch (RuntimeException exception)
            {
                log.log(Level.WARNING, "Scheduled task failed.", exception);
            }
        };
    }

    private static final class FutureTask implements ScheduledTask
    {
        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future)
        {
            this.future = future;
        }

        @Override
        public void cancel()
        {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled()
        {
            return future.isCancelled();
        }
    }
}
