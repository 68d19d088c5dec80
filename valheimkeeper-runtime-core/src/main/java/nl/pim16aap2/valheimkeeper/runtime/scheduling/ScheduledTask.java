package nl.pim16aap2.valheimkeeper.runtime.scheduling;

/**
 * Handle to a task submitted to a {@link TaskScheduler}.
 */
public interface ScheduledTask
{
    /**
     * Cancels the task.
     * <p>
     * Cancelling is idempotent. Once this method returns the task will not be started again, although a run that is
     * already in progress is allowed to complete.
     */
    void cancel();

    /**
     * @return True if {@link #cancel()} has been called.
     */
    boolean isCancelled();
}
