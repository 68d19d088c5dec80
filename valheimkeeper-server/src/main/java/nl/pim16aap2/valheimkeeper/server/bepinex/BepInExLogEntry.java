package nl.pim16aap2.valheimkeeper.server.bepinex;

import java.time.Instant;
import java.util.Objects;

/**
 * A single parsed line of the BepInEx log.
 *
 * @param timestamp
 *     The time the line was read.
 * @param level
 *     The level of the line.
 * @param source
 *     The logger that wrote the line, for example {@code BepInEx} or {@code Unity Log}.
 * @param message
 *     The line without its level and source prefix.
 * @param raw
 *     The line as it was read.
 */
public record BepInExLogEntry(Instant timestamp, BepInExLogLevel level, String source, String message, String raw)
{
    public BepInExLogEntry
    {
        Objects.requireNonNull(timestamp, "timestamp may not be null.");
        Objects.requireNonNull(level, "level may not be null.");
        Objects.requireNonNull(source, "source may not be null.");
        Objects.requireNonNull(message, "message may not be null.");
        Objects.requireNonNull(raw, "raw may not be null.");
    }
}
