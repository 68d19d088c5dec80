package nl.pim16aap2.valheimkeeper.server.bepinex;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.runtime.ListenerRegistry;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import nl.pim16aap2.valheimkeeper.server.log.LogTailListener;
import nl.pim16aap2.valheimkeeper.server.log.LogTailer;
import nl.pim16aap2.valheimkeeper.server.log.ServerLogEntry;
import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Follows the BepInEx log of a server installation.
 * <p>
 * The monitor outlives the log file: it can be started before BepInEx has created the file, and subscribers and the
 * recent entries are kept when the monitor is stopped, so a client that reconnects can redisplay them.
 */
@Log
public final class BepInExLogMonitor
{
    public static final int MAX_RECENT_ENTRIES = 200;

    private static final Path LOG_FILE = Path.of("BepInEx", "LogOutput.log");

    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final ListenerRegistry<Consumer<BepInExLogEntry>> subscribers =
        new ListenerRegistry<>("BepInExLogMonitor");

    private final Object lock = new Object();
    @GuardedBy("lock")
    private @Nullable LogTailer tailer;
    @GuardedBy("lock")
    private @Nullable Subscription tailerSubscription;
    @GuardedBy("lock")
    private @Nullable Path serverDirectory;
    @GuardedBy("lock")
    private final Deque<BepInExLogEntry> recentEntries = new ArrayDeque<>();

    public BepInExLogMonitor(TaskScheduler scheduler)
    {
        this(scheduler, LogTailer.DEFAULT_POLL_INTERVAL);
    }

    public BepInExLogMonitor(TaskScheduler scheduler, Duration pollInterval)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler may not be null.");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval may not be null.");
    }

    public static Path logPath(Path serverDirectory)
    {
        return serverDirectory.resolve(LOG_FILE);
    }

    /**
     * Starts following the log of a server installation.
     * <p>
     * Does nothing if the monitor is already following the same installation. If it is following a different one, it
     * switches over.
     *
     * @param serverDirectory
     *     The root directory of the server installation.
     * @param fromEnd
     *     True to skip the lines that are already in the log.
     */
    public void start(Path serverDirectory, boolean fromEnd)
    {
        Objects.requireNonNull(serverDirectory, "serverDirectory may not be null.");
        synchronized (lock)
        {
            if (tailer != null)
            {
                if (serverDirectory.equals(this.serverDirectory))
                {
                    log.fine("BepInEx log monitor is already running.");
                    return;
                }
                stopLocked();
            }

            final Path path = logPath(serverDirectory);
            if (Files.notExists(path))
                log.fine(() -> "BepInEx log '" + path + "' does not exist yet; waiting for it.");
            log.info(() -> "Following BepInEx log '" + path + "'.");

            final LogTailer newTailer = new LogTailer(path, scheduler, pollInterval);
            tailerSubscription = newTailer.subscribe(new LogTailListener()
            {
                @Override
                public void onLine(String line, ServerLogEntry entry)
                {
                    handleLine(line);
                }
            });
            this.serverDirectory = serverDirectory;
            this.tailer = newTailer;
            newTailer.start(fromEnd);
        }
    }

    public void stop()
    {
        synchronized (lock)
        {
            if (tailer == null)
                return;
            log.info("Stopping BepInEx log monitor.");
            stopLocked();
        }
    }

    public boolean isRunning()
    {
        synchronized (lock)
        {
            return tailer != null && tailer.isRunning();
        }
    }

    /**
     * @return The log file that is being followed, or null if the monitor has never been started.
     */
    public @Nullable Path logPath()
    {
        synchronized (lock)
        {
            return serverDirectory == null ? null : logPath(serverDirectory);
        }
    }

    public Subscription subscribe(Consumer<BepInExLogEntry> subscriber)
    {
        return subscribers.subscribe(subscriber);
    }

    /**
     * Reads the last lines of the log file.
     *
     * @param lineCount
     *     The maximum number of lines to return.
     * @return The parsed lines, oldest first. Empty when the monitor is not running.
     */
    public List<BepInExLogEntry> readLastLines(int lineCount)
    {
        final @Nullable LogTailer current;
        synchronized (lock)
        {
            current = tailer;
        }
        if (current == null)
            return List.of();
        return current.readLastRawLines(lineCount).stream()
            .map(line -> BepInExLogParser.parse(line, scheduler.now()))
            .toList();
    }

    /**
     * @return Up to {@link #MAX_RECENT_ENTRIES} of the most recently read entries, oldest first.
     */
    public List<BepInExLogEntry> getRecentEntries()
    {
        synchronized (lock)
        {
            return List.copyOf(recentEntries);
        }
    }

    public void clearRecentEntries()
    {
        synchronized (lock)
        {
            recentEntries.clear();
        }
    }

    private void handleLine(String line)
    {
        final BepInExLogEntry entry = BepInExLogParser.parse(line, scheduler.now());
        synchronized (lock)
        {
            recentEntries.addLast(entry);
            while (recentEntries.size() > MAX_RECENT_ENTRIES)
                recentEntries.removeFirst();
        }
        subscribers.notify(subscriber -> subscriber.accept(entry));
    }

    @GuardedBy("lock")
    private void stopLocked()
    {
        if (tailerSubscription != null)
            tailerSubscription.unsubscribe();
        if (tailer != null)
            tailer.stop();
        tailerSubscription = null;
        tailer = null;
    }
}
