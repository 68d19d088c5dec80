package nl.pim16aap2.valheimkeeper.runtime.scheduling;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * {@link TaskScheduler} driven by a virtual clock.
 * <p>
 * Nothing runs until the owner calls {@link #runPending()} or {@link #advance(Duration)}, which run every due task on
 * the calling thread. This makes it possible to drive components that rely on timers (polling, reconnects, restart
 * backoff) step by step, for example from tests or offline simulations.
 */
public final class DeterministicTaskScheduler implements TaskScheduler
{
    private final Object lock = new Object();
    @GuardedBy("lock")
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
        Comparator.comparing(Entry::dueAt).thenComparingLong(Entry::sequence)
    );
    @GuardedBy("lock")
    private Instant now;
    @GuardedBy("lock")
    private long sequence;
    @GuardedBy("lock")
    private boolean closed;

    public DeterministicTaskScheduler()
    {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public DeterministicTaskScheduler(Instant start)
    {
        this.now = Objects.requireNonNull(start, "start may not be null.");
    }

    @Override
    public void execute(Runnable task)
    {
        schedule(task, Duration.ZERO);
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        return enqueue(task, delay, null);
    }

    @Override
    public ScheduledTask scheduleWithFixedDelay(Runnable task, Duration initialDelay, Duration delay)
    {
        if (delay.isNegative() || delay.isZero())
            throw new IllegalArgumentException("Periodic delay must be positive, got " + delay + ".");
        return enqueue(task, initialDelay, delay);
    }

    @Override
    public Instant now()
    {
        synchronized (lock)
        {
            return now;
        }
    }

    /**
     * Runs every task that is due at the current virtual time, including tasks that become due while doing so.
     *
     * @return The number of task runs.
     */
    public int runPending()
    {
        int runs = 0;
        Entry entry;
        while ((entry = pollDue(now())) != null)
        {
            runEntry(entry);
            ++runs;
        }
        return runs;
    }

    /**
     * Moves the virtual clock forward, running every task that becomes due on the way in chronological order.
     *
     * @param duration
     *     How far to move the clock.
     * @return The number of task runs.
     */
    public int advance(Duration duration)
    {
        final Instant target;
        synchronized (lock)
        {
            target = now.plus(duration);
        }

        int runs = 0;
        Entry entry;
        while ((entry = pollDue(target)) != null)
        {
            synchronized (lock)
            {
                if (entry.dueAt().isAfter(now))
                    now = entry.dueAt();
            }
            runEntry(entry);
            ++runs;
        }

        synchronized (lock)
        {
            now = target;
        }
        return runs;
    }

    /**
     * @return The number of tasks that are scheduled and not cancelled.
     */
    public int pendingTaskCount()
    {
        synchronized (lock)
        {
            return (int) queue.stream().filter(entry -> !entry.handle().isCancelled()).count();
        }
    }

    @Override
    public void close()
    {
        synchronized (lock)
        {
            closed = true;
            queue.forEach(entry -> entry.handle().cancel());
            queue.clear();
        }
    }

    private ScheduledTask enqueue(Runnable task, Duration delay, @Nullable Duration period)
    {
        Objects.requireNonNull(task, "task may not be null.");
        Objects.requireNonNull(delay, "delay may not be null.");
        final Handle handle = new Handle();
        synchronized (lock)
        {
            if (closed)
                throw new IllegalStateException("Scheduler has been closed.");
            queue.add(new Entry(now.plus(delay), sequence++, task, period, handle));
        }
        return handle;
    }

    private @Nullable Entry pollDue(Instant limit)
    {
        synchronized (lock)
        {
            while (!queue.isEmpty())
            {
                final Entry head = queue.peek();
                if (head.handle().isCancelled())
                {
                    queue.poll();
                    continue;
                }
                if (head.dueAt().isAfter(limit))
                    return null;
                return queue.poll();
            }
            return null;
        }
    }

    private void runEntry(Entry entry)
    {
        entry.task().run();

        final @Nullable Duration period = entry.period();
        if (period == null || entry.handle().isCancelled())
            return;

        synchronized (lock)
        {
            if (!closed)
                queue.add(new Entry(now.plus(period), sequence++, entry.task(), period, entry.handle()));
        }
    }

    private record Entry(Instant dueAt, long sequence, Runnable task, @Nullable Duration period, Handle handle)
    {
    }

    private static final class Handle implements ScheduledTask
    {
        private volatile boolean cancelled;

        @Override
        public void cancel()
        {
            cancelled = true;
        }

        @Override
        public boolean isCancelled()
        {
            return cancelled;
        }
    }
}
