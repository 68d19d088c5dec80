package nl.pim16aap2.valheimkeeper.server.log;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.runtime.ListenerRegistry;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.ScheduledTask;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Follows a growing log file, like {@code tail -f}.
 * <p>
 * The file is polled on the tailer's scheduler. Every poll reads whatever was appended since the previous poll and
 * emits the complete lines to the subscribers; an incomplete last line is kept until its newline arrives. When the
 * file shrinks, or is replaced by a different file, reading restarts at the beginning.
 * <p>
 * The file does not have to exist when the tailer is started; it is picked up once it is created.
 */
@Log
public final class LogTailer
{
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    static final int READ_LAST_LINES_CHUNK_SIZE = 16 * 1024;
    private static final int READ_CHUNK_SIZE = 64 * 1024;

    private final Path path;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final ListenerRegistry<LogTailListener> listeners;

    private final Object lock = new Object();
    @GuardedBy("lock")
    private @Nullable FileChannel channel;
    @GuardedBy("lock")
    private @Nullable Object fileKey;
    @GuardedBy("lock")
    private long position;
    @GuardedBy("lock")
    private byte[] partialLine = new byte[0];
    @GuardedBy("lock")
    private boolean running;
    @GuardedBy("lock")
    private @Nullable ScheduledTask pollTask;

    public LogTailer(Path path, TaskScheduler scheduler)
    {
        this(path, scheduler, DEFAULT_POLL_INTERVAL);
    }

    public LogTailer(Path path, TaskScheduler scheduler, Duration pollInterval)
    {
        this.path = Objects.requireNonNull(path, "path may not be null.");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler may not be null.");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval may not be null.");
        this.listeners = new ListenerRegistry<>("LogTailer[" + path.getFileName() + "]");
    }

    /**
     * Subscribes to the lines and events of the file. Subscriptions survive {@link #stop()} and {@link #start}.
     */
    public Subscription subscribe(LogTailListener listener)
    {
        return listeners.subscribe(listener);
    }

    /**
     * Starts following the file. Does nothing if the tailer is already running.
     *
     * @param fromEnd
     *     True to skip the content that is already in the file, false to emit it as well.
     */
    public void start(boolean fromEnd)
    {
        start(fromEnd ? mark() : Mark.START);
    }

    /**
     * Starts following the file from a position recorded earlier with {@link #mark()}. Does nothing if the tailer is
     * already running.
     * <p>
     * Content that was in the file when the mark was taken is skipped. If the file has shrunk below the mark, or a
     * different file has taken its place, reading restarts at the beginning of the new content.
     *
     * @param mark
     *     Where to start reading.
     */
    public void start(Mark mark)
    {
        Objects.requireNonNull(mark, "mark may not be null.");
        synchronized (lock)
        {
            if (running)
                return;

            closeChannel();
            position = mark.position();
            fileKey = mark.fileKey();
            partialLine = new byte[0];
            running = true;
            pollTask = scheduler.scheduleWithFixedDelay(this::poll, Duration.ZERO, pollInterval);
        }
        log.fine(() -> "Started tailing '%s' at offset %d.".formatted(path, mark.position()));
    }

    /**
     * Records the current end of the file, so a later {@link #start(Mark)} skips only what is in it right now.
     *
     * @return The mark. Points at the start when the file does not exist.
     */
    public Mark mark()
    {
        try
        {
            final BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new Mark(attributes.size(), attributes.fileKey());
        }
        catch (NoSuchFileException exception)
        {
            return Mark.START;
        }
        catch (IOException exception)
        {
            log.fine(() -> "Could not read the attributes of '%s': %s".formatted(path, exception.getMessage()));
            return Mark.START;
        }
    }

    /**
     * Stops following the file. Does nothing if the tailer is not running.
     */
    public void stop()
    {
        synchronized (lock)
        {
            if (!running)
                return;

            running = false;
            if (pollTask != null)
                pollTask.cancel();
            pollTask = null;
            closeChannel();
            partialLine = new byte[0];
        }
        log.fine(() -> "Stopped tailing '" + path + "'.");
    }

    public boolean isRunning()
    {
        synchronized (lock)
        {
            return running;
        }
    }

    /**
     * @return The byte offset up to which the file has been consumed.
     */
    public long position()
    {
        synchronized (lock)
        {
            return position;
        }
    }

    public Path path()
    {
        return path;
    }

    /**
     * Reads new content from the file and emits it. Normally called by the scheduler.
     */
    void poll()
    {
        final List<String> lines;
        synchronized (lock)
        {
            if (!running)
                return;
            lines = readNewLines();
        }

        final Instant now = scheduler.now();
        for (final String line : lines)
        {
            final ServerLogEntry entry = ServerLogParser.parseLogLine(line, now);
            listeners.notify(listener -> listener.onLine(line, entry));

            final @Nullable ServerEvent event = ServerLogParser.parseEvent(line);
            if (event != null)
                listeners.notify(listener -> listener.onEvent(event));
        }
    }

    /**
     * Reads the last lines of the file without affecting the tailing position.
     *
     * @param lineCount
     *     The maximum number of lines to return.
     * @return The parsed lines, oldest first. Empty if the file does not exist.
     */
    public List<ServerLogEntry> readLastLines(int lineCount)
    {
        final Instant now = scheduler.now();
        return readLastRawLines(lineCount).stream()
            .map(line -> ServerLogParser.parseLogLine(line, now))
            .toList();
    }

    /**
     * Reads the last non-blank lines of the file, trimmed.
     *
     * @param lineCount
     *     The maximum number of lines to return.
     * @return The lines, oldest first. Empty if the file does not exist or could not be read.
     */
    public List<String> readLastRawLines(int lineCount)
    {
        if (lineCount <= 0)
            return List.of();

        try (FileChannel reader = FileChannel.open(path, StandardOpenOption.READ))
        {
            long start = reader.size();
            byte[] content = new byte[0];
            List<String> lines = List.of();
            while (start > 0)
            {
                final int chunkSize = (int) Math.min(READ_LAST_LINES_CHUNK_SIZE, start);
                start -= chunkSize;

                final ByteBuffer chunk = ByteBuffer.allocate(chunkSize);
                readFully(reader, chunk, start);

                final byte[] combined = new byte[chunkSize + content.length];
                System.arraycopy(chunk.array(), 0, combined, 0, chunkSize);
                System.arraycopy(content, 0, combined, chunkSize, content.length);
                content = combined;

                // Unless the start of the file was reached, the first segment may be an incomplete line.
                lines = splitLines(content, start > 0);
                if (lines.size() >= lineCount)
                    break;
            }
            return List.copyOf(lines.subList(Math.max(0, lines.size() - lineCount), lines.size()));
        }
        catch (NoSuchFileException exception)
        {
            return List.of();
        }
        catch (IOException exception)
        {
            log.fine(() -> "Failed to read the last lines of '%s': %s".formatted(path, exception.getMessage()));
            return List.of();
        }
    }

    @GuardedBy("lock")
    private List<String> readNewLines()
    {
        try
        {
            if (!prepareChannel())
                return List.of();

            final FileChannel current = Objects.requireNonNull(channel);
            final long size = current.size();
            if (size < position)
            {
                log.fine(() -> "File '%s' was truncated; reading from the start.".formatted(path));
                position = 0L;
                partialLine = new byte[0];
                return List.of();
            }
            if (size == position)
                return List.of();

            final List<String> lines = new ArrayList<>();
            final ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(READ_CHUNK_SIZE, size - position));
            while (position < size)
            {
                buffer.clear();
                buffer.limit((int) Math.min(buffer.capacity(), size - position));
                final int read = current.read(buffer, position);
                if (read <= 0)
                    break;
                position += read;
                consume(buffer.array(), read, lines);
            }
            return lines;
        }
        catch (IOException exception)
        {
            log.fine(() -> "Failed to read '%s': %s".formatted(path, exception.getMessage()));
            closeChannel();
            return List.of();
        }
    }

    /**
     * Makes sure the channel is open on the file that currently lives at the path.
     *
     * @return False if the file does not exist.
     */
    @GuardedBy("lock")
    private boolean prepareChannel()
        throws IOException
    {
        final BasicFileAttributes attributes;
        try
        {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        }
        catch (NoSuchFileException exception)
        {
            if (channel != null)
                resetAfterReplacement();
            return false;
        }

        final @Nullable Object key = attributes.fileKey();
        if (channel != null && key != null && !key.equals(fileKey))
            resetAfterReplacement();

        if (channel == null)
        {
            if (fileKey != null && key != null && !key.equals(fileKey))
                resetAfterReplacement();
            channel = FileChannel.open(path, StandardOpenOption.READ);
            fileKey = key;
        }
        return true;
    }

    @GuardedBy("lock")
    private void resetAfterReplacement()
    {
        log.fine(() -> "File '%s' was replaced; reading from the start.".formatted(path));
        closeChannel();
        position = 0L;
        partialLine = new byte[0];
    }

    @GuardedBy("lock")
    private void consume(byte[] data, int length, List<String> lines)
    {
        final byte[] pending = Arrays.copyOf(partialLine, partialLine.length + length);
        System.arraycopy(data, 0, pending, partialLine.length, length);

        int lineStart = 0;
        for (int idx = 0; idx < pending.length; ++idx)
        {
            if (pending[idx] != '\n')
                continue;
            addLine(pending, lineStart, idx, lines);
            lineStart = idx + 1;
        }
        partialLine = Arrays.copyOfRange(pending, lineStart, pending.length);
    }

    @GuardedBy("lock")
    private void closeChannel()
    {
        final @Nullable FileChannel current = channel;
        channel = null;
        fileKey = null;
        if (current == null)
            return;
        try
        {
            current.close();
        }
        catch (IOException exception)
        {
            log.fine(() -> "Failed to close '%s' cleanly: %s".formatted(path, exception.getMessage()));
        }
    }

    private static void readFully(FileChannel reader, ByteBuffer target, long offset)
        throws IOException
    {
        while (target.hasRemaining())
        {
            if (reader.read(target, offset + target.position()) < 0)
                throw new IOException("Unexpected end of file at offset " + (offset + target.position()) + ".");
        }
    }

    static List<String> splitLines(byte[] content, boolean dropFirstSegment)
    {
        final List<String> lines = new ArrayList<>();
        int lineStart = 0;
        boolean first = true;
        for (int idx = 0; idx <= content.length; ++idx)
        {
            if (idx < content.length && content[idx] != '\n')
                continue;
            if (!(first && dropFirstSegment))
                addLine(content, lineStart, idx, lines);
            first = false;
            lineStart = idx + 1;
        }
        return lines;
    }

    private static void addLine(byte[] content, int start, int end, List<String> lines)
    {
        final String line = new String(content, start, end - start, StandardCharsets.UTF_8).trim();
        if (!line.isEmpty())
            lines.add(line);
    }

    /**
     * A position in the file, together with the identity of the file it was taken from.
     *
     * @param position
     *     The byte offset.
     * @param fileKey
     *     The key of the file, or null if the file did not exist or the file system has no file keys.
     */
    public record Mark(long position, @Nullable Object fileKey)
    {
        public static final Mark START = new Mark(0L, null);
    }
}
