package nl.pim16aap2.valheimkeeper.server.log;

/**
 * Receives the output of a {@link LogTailer}.
 */
public interface LogTailListener
{
    /**
     * Called for every complete, non-blank line appended to the file.
     *
     * @param line
     *     The trimmed line.
     * @param entry
     *     The parsed line.
     */
    default void onLine(String line, ServerLogEntry entry)
    {
    }

    /**
     * Called after {@link #onLine(String, ServerLogEntry)} when the line describes an event.
     *
     * @param event
     *     The event.
     */
    default void onEvent(ServerEvent event)
    {
    }
}
