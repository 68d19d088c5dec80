package nl.pim16aap2.valheimkeeper.runtime;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.java.Log;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads and writes the {@link ProcessRecord} of the supervised server.
 */
@Log
public final class ProcessRecordStore
{
    private static final String APPLICATION_DIRECTORY = "valheimkeeper";
    private static final String RECORD_FILE = "server.pid";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path path;

    public ProcessRecordStore(Path path)
    {
        this.path = Objects.requireNonNull(path, "path may not be null.");
    }

    /**
     * Creates a store at the platform's configuration directory.
     * <p>
     * This is {@code %APPDATA%} on Windows and {@code $XDG_CONFIG_HOME} (or {@code ~/.config}) elsewhere.
     *
     * @return The store.
     */
    public static ProcessRecordStore atDefaultLocation()
    {
        return new ProcessRecordStore(defaultConfigDirectory().resolve(APPLICATION_DIRECTORY).resolve(RECORD_FILE));
    }

    public Path path()
    {
        return path;
    }

    public void write(ProcessRecord processRecord)
        throws IOException
    {
        final Path parent = path.getParent();
        if (parent != null)
            Files.createDirectories(parent);
        try (OutputStream outputStream = Files.newOutputStream(path))
        {
            objectMapper.writeValue(outputStream, processRecord);
        }
    }

    /**
     * Reads the record.
     *
     * @return The record, or null if there is no record or it could not be parsed.
     */
    public @Nullable ProcessRecord read()
    {
        if (Files.notExists(path))
            return null;

        try (InputStream inputStream = Files.newInputStream(path))
        {
            return objectMapper.readValue(inputStream, ProcessRecord.class);
        }
        catch (IOException exception)
        {
            log.fine(() -> "Ignoring unreadable process record '%s': %s".formatted(path, exception.getMessage()));
            return null;
        }
    }

    public void remove()
    {
        try
        {
            Files.deleteIfExists(path);
        }
        catch (IOException exception)
        {
            log.warning(() -> "Failed to remove process record '%s': %s".formatted(path, exception.getMessage()));
        }
    }

    /**
     * Reads the record and verifies that its process is still alive.
     * <p>
     * A record whose process is no longer running is stale and is removed.
     *
     * @return The record of the running server, or null if no server is running.
     */
    public @Nullable ProcessRecord getRunningServer()
    {
        final @Nullable ProcessRecord processRecord = read();
        if (processRecord == null)
            return null;

        if (!isProcessRunning(processRecord.pid()))
        {
            log.fine(() -> "Removing stale process record for pid " + processRecord.pid() + ".");
            remove();
            return null;
        }
        return processRecord;
    }

    public static boolean isProcessRunning(long pid)
    {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    /**
     * Terminates the process described by a record.
     * <p>
     * The process is first asked to shut down gracefully. If it is still alive after the timeout it is killed.
     *
     * @param processRecord
     *     The record of the process to terminate.
     * @param timeout
     *     How long to wait for a graceful shutdown.
     * @return True if the process is no longer running.
     */
    public boolean terminate(ProcessRecord processRecord, Duration timeout)
    {
        final Optional<ProcessHandle> handle = ProcessHandle.of(processRecord.pid());
        if (handle.isEmpty() || !handle.get().isAlive())
        {
            remove();
            return true;
        }

        final ProcessHandle processHandle = handle.get();
        processHandle.destroy();
        try
        {
            processHandle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException exception)
        {
            log.warning(() -> "Process " + processRecord.pid() + " did not stop within " + timeout + ", killing it.");
            processHandle.destroyForcibly();
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            processHandle.destroyForcibly();
        }
        catch (ExecutionException exception)
        {
            throw new IllegalStateException("Failed to wait for process " + processRecord.pid() + ".", exception);
        }

        final boolean stopped = !processHandle.isAlive();
        if (stopped)
            remove();
        return stopped;
    }

    static Path defaultConfigDirectory()
    {
        final String osName = System.getProperty("os.name", "").toLowerCase();
        if (osName.contains("win"))
        {
            final String appData = System.getenv("APPDATA");
            if (appData != null && !appData.isBlank())
                return Path.of(appData);
        }

        final String xdgConfigHome = System.getenv("XDG_CONFIG_HOME");
        if (xdgConfigHome != null && !xdgConfigHome.isBlank())
            return Path.of(xdgConfigHome);
        return Path.of(System.getProperty("user.home"), ".config");
    }
}
