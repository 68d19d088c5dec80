package nl.pim16aap2.valheimkeeper.server.watchdog;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Reported when the watchdog gives up on restarting a crashing server.
 */
@Getter
@Accessors(fluent = true)
public class MaxRestartsExceededException extends Exception
{
    private final int maxRestarts;

    public MaxRestartsExceededException(int maxRestarts)
    {
        super("Server crashed after %d restart(s); giving up.".formatted(maxRestarts));
        this.maxRestarts = maxRestarts;
    }
}
