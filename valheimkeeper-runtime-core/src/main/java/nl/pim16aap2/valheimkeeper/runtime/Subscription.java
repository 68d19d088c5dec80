package nl.pim16aap2.valheimkeeper.runtime;

/**
 * Token returned when subscribing a listener. Closing it removes the listener again.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    /**
     * Removes the listener. Calling this more than once has no effect.
     */
    void unsubscribe();

    @Override
    default void close()
    {
        unsubscribe();
    }
}
