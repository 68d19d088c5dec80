package nl.pim16aap2.valheimkeeper.runtime;

import lombok.extern.java.Log;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * Set of listeners of a single component.
 * <p>
 * Listeners are invoked synchronously on the thread that publishes the notification. A listener that throws does not
 * affect the other listeners or the publishing component.
 *
 * @param <L>
 *     The listener type.
 */
@Log
public final class ListenerRegistry<L>
{
    private final List<L> listeners = new CopyOnWriteArrayList<>();
    private final String owner;

    /**
     * @param owner
     *     Name of the owning component, used when logging listener failures.
     */
    public ListenerRegistry(String owner)
    {
        this.owner = Objects.requireNonNull(owner, "owner may not be null.");
    }

    public Subscription subscribe(L listener)
    {
        Objects.requireNonNull(listener, "listener may not be null.");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void notify(Consumer<? super L> notification)
    {
        for (final L listener : listeners)
        {
            try
            {
                notification.accept(listener);
            }
            catch (RuntimeException exception)
            {
                log.log(Level.WARNING, exception, () -> "Listener of " + owner + " failed.");
            }
        }
    }

    public int size()
    {
        return listeners.size();
    }

    public void clear()
    {
        listeners.clear();
    }
}
