package nl.pim16aap2.valheimkeeper.runtime.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Schedules the delayed and periodic work of a single component.
 * <p>
 * All tasks submitted to one scheduler run sequentially. Periodic tasks are re-armed only after the previous run has
 * completed, so two runs of the same task never overlap.
 */
public interface TaskScheduler extends AutoCloseable
{
    /**
     * Runs a task as soon as possible.
     *
     * @param task
     *     The task to run.
     */
    void execute(Runnable task);

    /**
     * Runs a task once after a delay.
     *
     * @param task
     *     The task to run.
     * @param delay
     *     The delay before the task runs.
     * @return The handle that can be used to cancel the task.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Runs a task repeatedly. The next run is scheduled {@code delay} after the previous run finished.
     *
     * @param task
     *     The task to run.
     * @param initialDelay
     *     The delay before the first run.
     * @param delay
     *     The delay between the end of one run and the start of the next.
     * @return The handle that can be used to cancel the task.
     */
    ScheduledTask scheduleWithFixedDelay(Runnable task, Duration initialDelay, Duration delay);

    /**
     * @return The current time as seen by this scheduler.
     */
    Instant now();

    /**
     * Stops accepting new work and cancels everything that is still pending.
     */
    @Override
    void close();
}
