package nl.pim16aap2.valheimkeeper.server.watchdog;

import nl.pim16aap2.valheimkeeper.server.log.ServerEvent;
import nl.pim16aap2.valheimkeeper.server.process.ProcessState;

/**
 * Receives the notifications of a {@link Watchdog}.
 * <p>
 * Notifications are delivered on the watchdog's scheduler thread, or on the thread that called the watchdog method
 * that caused them.
 */
public interface WatchdogListener
{
    default void onStateChange(ProcessState state)
    {
    }

    /**
     * Called for every line the server writes to its log.
     */
    default void onLog(String line)
    {
    }

    default void onPlayerJoin(String name)
    {
    }

    default void onPlayerLeave(String name)
    {
    }

    /**
     * Called for logged errors, unexpected exits, failed spawns and when the watchdog gives up restarting.
     */
    default void onError(Exception exception)
    {
    }

    default void onEvent(ServerEvent event)
    {
    }

    /**
     * Called when a restart has been scheduled.
     *
     * @param attempt
     *     The number of the restart, starting at 1.
     * @param maxAttempts
     *     The number of restarts after which the watchdog gives up.
     */
    default void onWatchdogRestart(int attempt, int maxAttempts)
    {
    }

    default void onWatchdogMaxRestarts()
    {
    }
}
