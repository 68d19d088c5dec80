package nl.pim16aap2.valheimkeeper.server.process;

import java.time.Duration;
import java.util.function.IntConsumer;

/**
 * A running server process.
 */
public interface ServerProcess
{
    long pid();

    boolean isAlive();

    /**
     * Registers a callback for when the process exits.
     * <p>
     * The callback runs on an arbitrary thread. If the process has already exited it runs right away.
     *
     * @param callback
     *     Receives the exit code.
     */
    void onExit(IntConsumer callback);

    /**
     * Asks the process to shut down gracefully.
     */
    void destroy();

    void destroyForcibly();

    /**
     * Waits for the process to exit.
     *
     * @param timeout
     *     The maximum time to wait.
     * @return True if the process exited within the timeout.
     *
     * @throws InterruptedException
     *     When the waiting thread is interrupted.
     */
    boolean waitFor(Duration timeout)
        throws InterruptedException;
}
