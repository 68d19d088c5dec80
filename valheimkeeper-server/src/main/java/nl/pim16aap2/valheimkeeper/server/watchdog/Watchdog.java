package nl.pim16aap2.valheimkeeper.server.watchdog;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.rcon.RconManager;
import nl.pim16aap2.valheimkeeper.runtime.ListenerRegistry;
import nl.pim16aap2.valheimkeeper.runtime.ProcessRecord;
import nl.pim16aap2.valheimkeeper.runtime.ProcessRecordStore;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.ScheduledTask;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import nl.pim16aap2.valheimkeeper.server.log.LogTailListener;
import nl.pim16aap2.valheimkeeper.server.log.LogTailer;
import nl.pim16aap2.valheimkeeper.server.log.ServerEvent;
import nl.pim16aap2.valheimkeeper.server.log.ServerLogEntry;
import nl.pim16aap2.valheimkeeper.server.process.PlayerSessionTracker;
import nl.pim16aap2.valheimkeeper.server.process.ProcessSpawnFailedException;
import nl.pim16aap2.valheimkeeper.server.process.ProcessState;
import nl.pim16aap2.valheimkeeper.server.process.ServerLaunchConfig;
import nl.pim16aap2.valheimkeeper.server.process.ServerProcess;
import nl.pim16aap2.valheimkeeper.server.process.ServerProcessLauncher;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Supervises the dedicated server process.
 * <p>
 * The watchdog spawns the server, follows the new output of its log file to find out when it is ready, and restarts it
 * with an exponential backoff when it exits without being asked to. Once the server is online the RCON manager, if
 * any, is asked to connect. It is disconnected again whenever the process goes away.
 * <p>
 * All timers run on the watchdog's scheduler and process exits are handed over to it as well. Listener notifications
 * are delivered after the watchdog's own state has been updated, never while its lock is held.
 */
@Log
public final class Watchdog
{
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    /**
     * How long to wait for a forcibly killed process to disappear.
     */
    static final Duration KILL_TIMEOUT = Duration.ofSeconds(5);

    private static final DateTimeFormatter LOG_FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private final ServerLaunchConfig launchConfig;
    private final ServerProcessLauncher launcher;
    private final TaskScheduler scheduler;
    private final ProcessRecordStore recordStore;
    private final @Nullable RconManager rconManager;
    private final Path logDirectory;
    private final ListenerRegistry<WatchdogListener> listeners = new ListenerRegistry<>("Watchdog");
    private final PlayerSessionTracker sessions = new PlayerSessionTracker();

    private final Object lock = new Object();
    @GuardedBy("lock")
    private WatchdogConfig config;
    @GuardedBy("lock")
    private ProcessState state = ProcessState.OFFLINE;
    @GuardedBy("lock")
    private @Nullable RestartPolicy restartPolicy;
    @GuardedBy("lock")
    private boolean maxRestartsReported;
    @GuardedBy("lock")
    private @Nullable ServerProcess process;
    /**
     * The process that {@link #stop(Duration)} is waiting for, so it can still be killed in the meantime.
     */
    @GuardedBy("lock")
    private @Nullable ServerProcess stoppingProcess;
    @GuardedBy("lock")
    private @Nullable Instant startedAt;
    @GuardedBy("lock")
    private @Nullable Path logFile;
    @GuardedBy("lock")
    private @Nullable LogTailer tailer;
    @GuardedBy("lock")
    private @Nullable Subscription tailerSubscription;
    @GuardedBy("lock")
    private @Nullable ScheduledTask restartTask;
    @GuardedBy("lock")
    private @Nullable ScheduledTask cooldownTask;
    @GuardedBy("lock")
    private @Nullable ScheduledTask readinessTask;

    /**
     * @param launchConfig
     *     How to launch the server.
     * @param config
     *     The restart policy settings.
     * @param launcher
     *     Spawns the server process.
     * @param scheduler
     *     Runs the watchdog's timers and the log tailer.
     * @param recordStore
     *     Where the record of the running process is kept.
     * @param rconManager
     *     The RCON manager to connect once the server is online, or null to not use RCON.
     * @param logDirectory
     *     The directory for the server log when the launch configuration does not specify a log file.
     */
    public Watchdog(
        ServerLaunchConfig launchConfig,
        WatchdogConfig config,
        ServerProcessLauncher launcher,
        TaskScheduler scheduler,
        ProcessRecordStore recordStore,
        @Nullable RconManager rconManager,
        Path logDirectory)
    {
        this.launchConfig = Objects.requireNonNull(launchConfig, "launchConfig may not be null.");
        this.config = Objects.requireNonNull(config, "config may not be null.");
        this.launcher = Objects.requireNonNull(launcher, "launcher may not be null.");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler may not be null.");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore may not be null.");
        this.rconManager = rconManager;
        this.logDirectory = Objects.requireNonNull(logDirectory, "logDirectory may not be null.");
    }

    public Subscription subscribe(WatchdogListener listener)
    {
        return listeners.subscribe(listener);
    }

    /**
     * Starts the server.
     *
     * @throws IllegalStateException
     *     When the server is not offline or crashed.
     * @throws ProcessSpawnFailedException
     *     When the process could not be spawned. The watchdog is left in the crashed state.
     */
    public void start()
        throws ProcessSpawnFailedException
    {
        final List<Consumer<WatchdogListener>> notifications = new ArrayList<>();
        try
        {
            synchronized (lock)
            {
                if (state != ProcessState.OFFLINE && state != ProcessState.CRASHED)
                    throw new IllegalStateException("Cannot start the server while it is " + state + ".");

                cancelTasksLocked();
                restartPolicy = new RestartPolicy(config);
                maxRestartsReported = false;
                spawnLocked(notifications);
            }
        }
        finally
        {
            publish(notifications);
        }
    }

    public void stop()
    {
        stop(DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Stops the server gracefully, killing it if it does not exit in time. Pending restarts are cancelled.
     *
     * @param timeout
     *     How long to wait for the server to shut down before killing it.
     */
    public void stop(Duration timeout)
    {
        final @Nullable ServerProcess target;
        synchronized (lock)
        {
            if (state == ProcessState.OFFLINE || state == ProcessState.STOPPING)
                return;
            target = process;
            releaseLocked();
            restartPolicy = null;
            stoppingProcess = target;
            state = ProcessState.STOPPING;
        }
        publishState(ProcessState.STOPPING);
        disconnectRcon();

        if (target != null)
            terminate(target, timeout);

        synchronized (lock)
        {
            if (stoppingProcess == target)
                stoppingProcess = null;
            // Killed while waiting; the kill already finished the job.
            if (state != ProcessState.STOPPING)
                return;
            recordStore.remove();
            state = ProcessState.OFFLINE;
        }
        publishState(ProcessState.OFFLINE);
    }

    /**
     * Kills the server immediately. Pending restarts are cancelled.
     */
    public void kill()
    {
        final @Nullable ServerProcess target;
        synchronized (lock)
        {
            if (state == ProcessState.OFFLINE)
                return;
            target = process != null ? process : stoppingProcess;
            stoppingProcess = null;
            releaseLocked();
            restartPolicy = null;
            state = ProcessState.OFFLINE;
        }

        if (target != null)
        {
            log.info(() -> "Killing server process " + target.pid() + ".");
            target.destroyForcibly();
        }
        disconnectRcon();
        recordStore.remove();
        publishState(ProcessState.OFFLINE);
    }

    /**
     * Lets go of the server without stopping it.
     * <p>
     * The process keeps running after the watchdog, and even the JVM, has gone away. Its process record is kept, and
     * marked as detached, so the server can be found and stopped later.
     * <p>
     * When no process is attached, a pending restart is cancelled instead and the watchdog goes offline.
     *
     * @return The record of the detached process, or null if no process was running.
     */
    public @Nullable ProcessRecord detach()
    {
        final @Nullable ProcessRecord processRecord;
        final List<Consumer<WatchdogListener>> notifications = new ArrayList<>();
        synchronized (lock)
        {
            final @Nullable ServerProcess target = process;
            if (target == null)
            {
                processRecord = null;
                // A stop in progress owns the transition to offline.
                if (state != ProcessState.STOPPING)
                {
                    cancelTasksLocked();
                    restartPolicy = null;
                    setStateLocked(ProcessState.OFFLINE, notifications);
                }
            }
            else
            {
                processRecord = createRecord(target, true);
                releaseLocked();
                restartPolicy = null;
                setStateLocked(ProcessState.OFFLINE, notifications);
            }
        }

        if (processRecord == null)
        {
            publish(notifications);
            return null;
        }

        disconnectRcon();
        writeRecord(processRecord);
        log.info(() -> "Detached from server process " + processRecord.pid() + ".");
        publish(notifications);
        return processRecord;
    }

    public void updateConfig(WatchdogConfig config)
    {
        Objects.requireNonNull(config, "config may not be null.");
        synchronized (lock)
        {
            this.config = config;
            if (restartPolicy != null)
                restartPolicy.updateConfig(config);
        }
    }

    public void resetRestartCount()
    {
        synchronized (lock)
        {
            if (restartPolicy != null)
                restartPolicy.reset();
            maxRestartsReported = false;
        }
    }

    public int currentRestartCount()
    {
        synchronized (lock)
        {
            return restartPolicy == null ? 0 : restartPolicy.attemptCount();
        }
    }

    public ProcessState currentState()
    {
        synchronized (lock)
        {
            return state;
        }
    }

    public WatchdogConfig config()
    {
        synchronized (lock)
        {
            return config;
        }
    }

    public OptionalLong pid()
    {
        synchronized (lock)
        {
            return process == null ? OptionalLong.empty() : OptionalLong.of(process.pid());
        }
    }

    /**
     * @return The log file of the current or most recent server process, or null if none was started yet.
     */
    public @Nullable Path logFile()
    {
        synchronized (lock)
        {
            return logFile;
        }
    }

    /**
     * @return The players that are online according to the server log, in join order.
     */
    public List<String> onlinePlayers()
    {
        return sessions.onlinePlayers();
    }

    @GuardedBy("lock")
    private void spawnLocked(List<Consumer<WatchdogListener>> notifications)
        throws ProcessSpawnFailedException
    {
        setStateLocked(ProcessState.STARTING, notifications);

        final Path effectiveLogFile = nextLogFileLocked();
        final LogTailer newTailer = new LogTailer(effectiveLogFile, scheduler);

        final ServerProcess spawned;
        final LogTailer.Mark mark;
        try
        {
            final @Nullable Path parent = effectiveLogFile.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            // Content left by an earlier run is skipped.
            mark = newTailer.mark();
            spawned = launcher.launch(launchConfig, effectiveLogFile);
        }
        catch (IOException | ProcessSpawnFailedException exception)
        {
            final ProcessSpawnFailedException failure = exception instanceof ProcessSpawnFailedException spawnFailure ?
                spawnFailure :
                new ProcessSpawnFailedException("Failed to prepare log file '" + effectiveLogFile + "'.", exception);
            log.warning(() -> "Failed to spawn the server: " + failure.getMessage());
            setStateLocked(ProcessState.CRASHED, notifications);
            notifications.add(listener -> listener.onError(failure));
            throw failure;
        }

        log.info(() -> "Spawned server process %d, logging to '%s'.".formatted(spawned.pid(), effectiveLogFile));
        process = spawned;
        startedAt = scheduler.now();
        logFile = effectiveLogFile;
        sessions.clear();
        writeRecord(createRecord(spawned, false));

        tailerSubscription = newTailer.subscribe(new ProcessLogListener(spawned));
        tailer = newTailer;
        newTailer.start(mark);

        readinessTask = scheduler.schedule(() -> onReadinessTimeout(spawned), config.readinessTimeout());
        spawned.onExit(exitCode -> dispatchExit(spawned, exitCode));
    }

    /**
     * @return The configured log file, or a new timestamped file in the log directory that no earlier launch used.
     */
    @GuardedBy("lock")
    private Path nextLogFileLocked()
    {
        final @Nullable Path configured = launchConfig.logFile();
        if (configured != null)
            return configured;

        final String timestamp = LOG_FILE_TIMESTAMP.format(scheduler.now());
        Path candidate = logDirectory.resolve("valheim-" + timestamp + ".log");
        for (int suffix = 2; candidate.equals(logFile) || Files.exists(candidate); ++suffix)
            candidate = logDirectory.resolve("valheim-%s-%d.log".formatted(timestamp, suffix));
        return candidate;
    }

    private void dispatchExit(ServerProcess exited, int exitCode)
    {
        try
        {
            scheduler.execute(() -> handleExit(exited, exitCode));
        }
        catch (RejectedExecutionException | IllegalStateException exception)
        {
            log.fine(() -> "Ignoring exit of process %d after shutdown.".formatted(exited.pid()));
        }
    }

    private void handleExit(ServerProcess exited, int exitCode)
    {
        final List<Consumer<WatchdogListener>> notifications = new ArrayList<>();
        synchronized (lock)
        {
            // Stopped, killed, detached or replaced in the meantime.
            if (process != exited || state == ProcessState.STOPPING)
                return;

            log.warning(() -> "Server process %d exited unexpectedly with code %d.".formatted(exited.pid(), exitCode));
            releaseLocked();
            setStateLocked(ProcessState.CRASHED, notifications);
            final ServerErrorException error =
                new ServerErrorException("Server exited unexpectedly with code " + exitCode + ".");
            notifications.add(listener -> listener.onError(error));
            afterCrashLocked(notifications);
        }

        disconnectRcon();
        recordStore.remove();
        publish(notifications);
    }

    /**
     * Schedules a restart, or gives up when the restart limit has been reached.
     */
    @GuardedBy("lock")
    private void afterCrashLocked(List<Consumer<WatchdogListener>> notifications)
    {
        if (!config.enabled())
        {
            log.info("Automatic restarts are disabled; leaving the server offline.");
            return;
        }

        if (restartPolicy == null)
            restartPolicy = new RestartPolicy(config);
        final RestartPolicy policy = restartPolicy;

        if (!policy.canRestart())
        {
            if (maxRestartsReported)
                return;
            maxRestartsReported = true;
            final int maxRestarts = config.maxRestarts();
            log.severe(() -> "Server crashed %d time(s) in a row; giving up.".formatted(maxRestarts + 1));
            notifications.add(WatchdogListener::onWatchdogMaxRestarts);
            final MaxRestartsExceededException exception = new MaxRestartsExceededException(maxRestarts);
            notifications.add(listener -> listener.onError(exception));
            return;
        }

        final Duration delay = policy.nextDelay();
        final int attempt = policy.recordRestart(scheduler.now());
        final int maxRestarts = config.maxRestarts();
        log.warning(() -> "Restarting server in %s (attempt %d of %d).".formatted(delay, attempt, maxRestarts));
        notifications.add(listener -> listener.onWatchdogRestart(attempt, maxRestarts));
        restartTask = scheduler.schedule(this::restart, delay);
    }

    private void restart()
    {
        final List<Consumer<WatchdogListener>> notifications = new ArrayList<>();
        synchronized (lock)
        {
            restartTask = null;
            if (state != ProcessState.CRASHED || process != null)
                return;
            try
            {
                spawnLocked(notifications);
            }
            catch (ProcessSpawnFailedException exception)
            {
                afterCrashLocked(notifications);
            }
        }
        publish(notifications);
    }

    private void markOnline(ServerProcess owner)
    {
        synchronized (lock)
        {
            if (process != owner || state != ProcessState.STARTING)
                return;

            if (readinessTask != null)
                readinessTask.cancel();
            readinessTask = null;
            state = ProcessState.ONLINE;
            cooldownTask = scheduler.schedule(() -> resetAfterCooldown(owner), config.cooldownPeriod());
        }

        log.info("Server is online.");
        publishState(ProcessState.ONLINE);
        if (rconManager != null)
            rconManager.connectInBackground();
    }

    private void onReadinessTimeout(ServerProcess owner)
    {
        synchronized (lock)
        {
            readinessTask = null;
            if (process != owner || state != ProcessState.STARTING)
                return;
        }
        log.info("Server did not report readiness in time; assuming it is online.");
        markOnline(owner);
    }

    private void resetAfterCooldown(ServerProcess owner)
    {
        synchronized (lock)
        {
            cooldownTask = null;
            if (process != owner || state != ProcessState.ONLINE || restartPolicy == null)
                return;
            if (restartPolicy.attemptCount() > 0)
                log.fine("Server has been stable for the cooldown period; resetting the restart counter.");
            restartPolicy.reset();
            maxRestartsReported = false;
        }
    }

    private void handleEvent(ServerProcess owner, ServerEvent event)
    {
        synchronized (lock)
        {
            if (process != owner)
                return;
        }

        listeners.notify(listener -> listener.onEvent(event));
        if (event instanceof ServerEvent.PlayerJoined joined)
        {
            if (sessions.joined(joined.name()))
                listeners.notify(listener -> listener.onPlayerJoin(joined.name()));
        }
        else if (event instanceof ServerEvent.PlayerConnecting connecting)
        {
            sessions.connecting(connecting.steamId());
        }
        else if (event instanceof ServerEvent.PlayerDisconnected disconnected)
        {
            final @Nullable String name = sessions.disconnected(disconnected.steamId());
            if (name != null)
            {
                final ServerEvent.PlayerLeft left = new ServerEvent.PlayerLeft(name);
                listeners.notify(listener -> listener.onEvent(left));
                listeners.notify(listener -> listener.onPlayerLeave(name));
            }
        }
        else if (event instanceof ServerEvent.ServerReady)
        {
            markOnline(owner);
        }
        else if (event instanceof ServerEvent.ErrorLogged errorLogged)
        {
            final ServerErrorException error = new ServerErrorException(errorLogged.message());
            listeners.notify(listener -> listener.onError(error));
        }
    }

    private void handleLine(ServerProcess owner, String line)
    {
        synchronized (lock)
        {
            if (process != owner)
                return;
        }
        listeners.notify(listener -> listener.onLog(line));
    }

    /**
     * Forgets the current process and stops everything attached to it, without touching the process itself.
     */
    @GuardedBy("lock")
    private void releaseLocked()
    {
        process = null;
        startedAt = null;
        cancelTasksLocked();
        if (tailerSubscription != null)
            tailerSubscription.unsubscribe();
        if (tailer != null)
            tailer.stop();
        tailerSubscription = null;
        tailer = null;
        sessions.clear();
    }

    @GuardedBy("lock")
    private void cancelTasksLocked()
    {
        if (restartTask != null)
            restartTask.cancel();
        if (cooldownTask != null)
            cooldownTask.cancel();
        if (readinessTask != null)
            readinessTask.cancel();
        restartTask = null;
        cooldownTask = null;
        readinessTask = null;
    }

    @GuardedBy("lock")
    private void setStateLocked(ProcessState newState, List<Consumer<WatchdogListener>> notifications)
    {
        if (state == newState)
            return;
        state = newState;
        notifications.add(listener -> listener.onStateChange(newState));
    }

    @GuardedBy("lock")
    private ProcessRecord createRecord(ServerProcess target, boolean detached)
    {
        final Instant started = Objects.requireNonNullElseGet(startedAt, scheduler::now);
        return new ProcessRecord(
            target.pid(),
            launchConfig.world(),
            launchConfig.port(),
            started.toString(),
            detached,
            logFile == null ? null : logFile.toString()
        );
    }

    private void writeRecord(ProcessRecord processRecord)
    {
        try
        {
            recordStore.write(processRecord);
        }
        catch (IOException exception)
        {
            log.warning(() -> "Failed to write process record '%s': %s"
                .formatted(recordStore.path(), exception.getMessage()));
        }
    }

    private void disconnectRcon()
    {
        if (rconManager != null)
            rconManager.disconnect();
    }

    private static void terminate(ServerProcess target, Duration timeout)
    {
        log.info(() -> "Stopping server process " + target.pid() + ".");
        target.destroy();
        try
        {
            if (target.waitFor(timeout))
                return;

            log.warning(() -> "Server process %d did not stop within %s; killing it.".formatted(target.pid(), timeout));
            target.destroyForcibly();
            if (!target.waitFor(KILL_TIMEOUT))
                log.warning(() -> "Server process " + target.pid() + " is still alive after being killed.");
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            target.destroyForcibly();
        }
    }

    private void publishState(ProcessState newState)
    {
        listeners.notify(listener -> listener.onStateChange(newState));
    }

    private void publish(List<Consumer<WatchdogListener>> notifications)
    {
        for (final Consumer<WatchdogListener> notification : notifications)
            listeners.notify(notification);
    }

    /**
     * Routes the output of the log tailer of one process into the watchdog.
     */
    private final class ProcessLogListener implements LogTailListener
    {
        private final ServerProcess owner;

        private ProcessLogListener(ServerProcess owner)
        {
            this.owner = owner;
        }

        @Override
        public void onLine(String line, ServerLogEntry entry)
        {
            handleLine(owner, line);
        }

        @Override
        public void onEvent(ServerEvent event)
        {
            handleEvent(owner, event);
        }
    }
}
