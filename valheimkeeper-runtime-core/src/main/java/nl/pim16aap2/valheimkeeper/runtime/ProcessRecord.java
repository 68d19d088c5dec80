package nl.pim16aap2.valheimkeeper.runtime;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Persisted description of a running server process.
 * <p>
 * The record allows a later invocation to find, inspect and stop a server that was started by an invocation that has
 * since exited.
 *
 * @param pid
 *     The process id of the server.
 * @param world
 *     The world the server was started with.
 * @param port
 *     The game port of the server.
 * @param startedAt
 *     ISO-8601 instant at which the server was started.
 * @param detached
 *     Whether the supervising process has released the server.
 * @param logFile
 *     Optional path to the server log file.
 */
public record ProcessRecord(
    long pid,
    String world,
    int port,
    String startedAt,
    boolean detached,
    @Nullable String logFile
)
{
    public ProcessRecord withDetached(boolean detached)
    {
        return new ProcessRecord(pid, world, port, startedAt, detached, logFile);
    }

    public Instant startedAtInstant()
    {
        return Instant.parse(startedAt);
    }
}
