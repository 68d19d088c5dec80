package nl.pim16aap2.valheimkeeper.server.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Launcher that hands out {@link FakeServerProcess}es. By default every launch starts with an empty log file; tests
 * that need to mimic a server that opens its log only later can turn that off.
 */
public final class FakeServerProcessLauncher implements ServerProcessLauncher
{
    private static final long FIRST_PID = 1_000_000_000L;

    private final List<FakeServerProcess> processes = new CopyOnWriteArrayList<>();
    private final List<Path> logFiles = new CopyOnWriteArrayList<>();

    private volatile boolean exitOnDestroy = true;
    private volatile boolean failing;
    private volatile boolean truncateLogFile = true;

    public void setExitOnDestroy(boolean exitOnDestroy)
    {
        this.exitOnDestroy = exitOnDestroy;
    }

    public void setFailing(boolean failing)
    {
        this.failing = failing;
    }

    public void setTruncateLogFile(boolean truncateLogFile)
    {
        this.truncateLogFile = truncateLogFile;
    }

    @Override
    public ServerProcess launch(ServerLaunchConfig config, Path logFile)
        throws ProcessSpawnFailedException
    {
        if (failing)
            throw new ProcessSpawnFailedException("Launch failed on purpose.");

        if (truncateLogFile)
            truncate(logFile);

        final FakeServerProcess process = new FakeServerProcess(FIRST_PID + processes.size(), exitOnDestroy);
        processes.add(process);
        logFiles.add(logFile);
        return process;
    }

    public int launchCount()
    {
        return processes.size();
    }

    public FakeServerProcess lastProcess()
    {
        if (processes.isEmpty())
            throw new IllegalStateException("No process has been launched.");
        return processes.get(processes.size() - 1);
    }

    public List<Path> logFiles()
    {
        return List.copyOf(logFiles);
    }

    private static void truncate(Path logFile)
        throws ProcessSpawnFailedException
    {
        try
        {
            Files.writeString(logFile, "");
        }
        catch (IOException exception)
        {
            throw new ProcessSpawnFailedException("Failed to create log file.", exception);
        }
    }
}
