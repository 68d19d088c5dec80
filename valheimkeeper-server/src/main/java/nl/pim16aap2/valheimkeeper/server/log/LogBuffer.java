package nl.pim16aap2.valheimkeeper.server.log;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import nl.pim16aap2.valheimkeeper.runtime.ListenerRegistry;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bounded buffer of the most recent server log entries.
 * <p>
 * Once the buffer is full, adding an entry evicts the oldest one. Subscribers are notified of every added entry.
 */
public final class LogBuffer
{
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    @GuardedBy("this")
    private final Deque<ServerLogEntry> entries = new ArrayDeque<>();
    private final ListenerRegistry<Consumer<ServerLogEntry>> subscribers = new ListenerRegistry<>("LogBuffer");

    public LogBuffer()
    {
        this(DEFAULT_MAX_SIZE);
    }

    public LogBuffer(int maxSize)
    {
        if (maxSize < 1)
            throw new IllegalArgumentException("Max size must be at least 1, got " + maxSize + ".");
        this.maxSize = maxSize;
    }

    /**
     * Parses a raw line and adds it.
     *
     * @param line
     *     The raw line.
     * @return The parsed entry.
     */
    public ServerLogEntry add(String line)
    {
        final ServerLogEntry entry = ServerLogParser.parseLogLine(line);
        add(entry);
        return entry;
    }

    public void add(ServerLogEntry entry)
    {
        synchronized (this)
        {
            entries.addLast(entry);
            while (entries.size() > maxSize)
                entries.removeFirst();
        }
        subscribers.notify(subscriber -> subscriber.accept(entry));
    }

    public synchronized List<ServerLogEntry> getAll()
    {
        return List.copyOf(entries);
    }

    public synchronized List<ServerLogEntry> getFiltered(ServerLogLevel level)
    {
        return entries.stream().filter(entry -> entry.level() == level).toList();
    }

    /**
     * @param count
     *     The maximum number of entries to return.
     * @return The newest entries, oldest first.
     */
    public synchronized List<ServerLogEntry> getRecent(int count)
    {
        if (count <= 0)
            return List.of();
        final List<ServerLogEntry> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public Subscription subscribe(Consumer<ServerLogEntry> subscriber)
    {
        return subscribers.subscribe(subscriber);
    }

    public synchronized void clear()
    {
        entries.clear();
    }

    public synchronized int size()
    {
        return entries.size();
    }

    public int maxSize()
    {
        return maxSize;
    }
}
