package nl.pim16aap2.valheimkeeper.server.process;

import lombok.extern.java.Log;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Launches the server as a child process of the current JVM.
 * <p>
 * The server writes its own log file, so its standard output and error are discarded.
 */
@Log
public final class DefaultServerProcessLauncher implements ServerProcessLauncher
{
    private final boolean linux;

    public DefaultServerProcessLauncher()
    {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux"));
    }

    DefaultServerProcessLauncher(boolean linux)
    {
        this.linux = linux;
    }

    @Override
    public ServerProcess launch(ServerLaunchConfig config, Path logFile)
        throws ProcessSpawnFailedException
    {
        if (!Files.isRegularFile(config.executable()))
        {
            throw new ProcessSpawnFailedException(
                "Server executable '%s' does not exist.".formatted(config.executable()));
        }

        final List<String> command = new ArrayList<>();
        command.add(config.executable().toString());
        command.addAll(config.arguments(logFile));

        final ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.directory(config.workingDirectory().toFile());
        processBuilder.redirectErrorStream(true);
        processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        final Map<String, String> environment = processBuilder.environment();
        final Map<String, String> merged = config.environment(Map.copyOf(environment), linux);
        environment.clear();
        environment.putAll(merged);

        try
        {
            final Process process = processBuilder.start();
            log.info(() -> "Started server process %d: %s".formatted(process.pid(), String.join(" ", command)));
            return new JdkServerProcess(process);
        }
        catch (IOException exception)
        {
            throw new ProcessSpawnFailedException(
                "Failed to start server executable '%s'.".formatted(config.executable()), exception);
        }
    }

    private static final class JdkServerProcess implements ServerProcess
    {
        private final Process process;

        private JdkServerProcess(Process process)
        {
            this.process = Objects.requireNonNull(process, "process may not be null.");
        }

        @Override
        public long pid()
        {
            return process.pid();
        }

        @Override
        public boolean isAlive()
        {
            return process.isAlive();
        }

        @Override
        public void onExit(IntConsumer callback)
        {
            process.onExit().thenAccept(exited -> callback.accept(exited.exitValue()));
        }

        @Override
        public void destroy()
        {
            process.destroy();
        }

        @Override
        public void destroyForcibly()
        {
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout)
            throws InterruptedException
        {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
