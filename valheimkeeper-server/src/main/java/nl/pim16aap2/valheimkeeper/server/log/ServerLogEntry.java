package nl.pim16aap2.valheimkeeper.server.log;

import java.time.Instant;
import java.util.Objects;

/**
 * A single parsed line of the server log.
 *
 * @param timestamp
 *     The time of the line. Taken from the line's own timestamp if it has one.
 * @param level
 *     The derived severity.
 * @param message
 *     The line without its timestamp prefix.
 * @param raw
 *     The line as it was read.
 */
public record ServerLogEntry(Instant timestamp, ServerLogLevel level, String message, String raw)
{
    public ServerLogEntry
    {
        Objects.requireNonNull(timestamp, "timestamp may not be null.");
        Objects.requireNonNull(level, "level may not be null.");
        Objects.requireNonNull(message, "message may not be null.");
        Objects.requireNonNull(raw, "raw may not be null.");
    }
}
