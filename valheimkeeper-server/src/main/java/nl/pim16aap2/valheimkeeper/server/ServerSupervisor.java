package nl.pim16aap2.valheimkeeper.server;

import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.rcon.ConnectionState;
import nl.pim16aap2.valheimkeeper.rcon.RconManager;
import nl.pim16aap2.valheimkeeper.rcon.RconManagerListener;
import nl.pim16aap2.valheimkeeper.runtime.ProcessRecord;
import nl.pim16aap2.valheimkeeper.runtime.ProcessRecordStore;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.ExecutorTaskScheduler;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import nl.pim16aap2.valheimkeeper.server.bepinex.BepInExLogMonitor;
import nl.pim16aap2.valheimkeeper.server.config.KeeperConfig;
import nl.pim16aap2.valheimkeeper.server.log.LogBuffer;
import nl.pim16aap2.valheimkeeper.server.log.ServerLogEntry;
import nl.pim16aap2.valheimkeeper.server.process.DefaultServerProcessLauncher;
import nl.pim16aap2.valheimkeeper.server.process.ProcessSpawnFailedException;
import nl.pim16aap2.valheimkeeper.server.process.ProcessState;
import nl.pim16aap2.valheimkeeper.server.watchdog.Watchdog;
import nl.pim16aap2.valheimkeeper.server.watchdog.WatchdogListener;
import org.jspecify.annotations.Nullable;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for supervising one dedicated server.
 * <p>
 * Ties the watchdog, the RCON manager, the BepInEx log monitor and the in-memory server log together. Create one
 * with {@link #create(KeeperConfig)}, or through {@link SupervisorComponent} to replace its collaborators.
 */
@Log
@Singleton
public final class ServerSupervisor implements AutoCloseable
{
    private final KeeperConfig config;
    private final Watchdog watchdog;
    private final RconManager rconManager;
    private final BepInExLogMonitor bepInExLogMonitor;
    private final LogBuffer logBuffer;
    private final ProcessRecordStore processRecordStore;
    private final List<TaskScheduler> schedulers;
    private final Subscription watchdogSubscription;

    @Inject
    ServerSupervisor(
        KeeperConfig config,
        Watchdog watchdog,
        RconManager rconManager,
        BepInExLogMonitor bepInExLogMonitor,
        LogBuffer logBuffer,
        ProcessRecordStore processRecordStore,
        @Named(SupervisorModule.WATCHDOG) TaskScheduler watchdogScheduler,
        @Named(SupervisorModule.RCON) TaskScheduler rconScheduler,
        @Named(SupervisorModule.BEPINEX) TaskScheduler bepInExScheduler)
    {
        this.config = Objects.requireNonNull(config, "config may not be null.");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog may not be null.");
        this.rconManager = Objects.requireNonNull(rconManager, "rconManager may not be null.");
        this.bepInExLogMonitor = Objects.requireNonNull(bepInExLogMonitor, "bepInExLogMonitor may not be null.");
        this.logBuffer = Objects.requireNonNull(logBuffer, "logBuffer may not be null.");
        this.processRecordStore = Objects.requireNonNull(processRecordStore, "processRecordStore may not be null.");
        this.schedulers = List.of(watchdogScheduler, rconScheduler, bepInExScheduler);

        this.rconManager.initialize(config.rcon(), new LoggingRconListener());
        this.watchdogSubscription = watchdog.subscribe(new WatchdogListener()
        {
            @Override
            public void onLog(String line)
            {
                logBuffer.add(line);
            }

            @Override
            public void onWatchdogMaxRestarts()
            {
                bepInExLogMonitor.stop();
            }
        });
    }

    /**
     * Creates a supervisor that launches the real server executable.
     *
     * @param config
     *     The configuration.
     * @return The supervisor.
     */
    public static ServerSupervisor create(KeeperConfig config)
    {
        return DaggerSupervisorComponent.factory()
            .create(config, new DefaultServerProcessLauncher(), ExecutorTaskScheduler::new)
            .supervisor();
    }

    /**
     * Starts the server and begins following the BepInEx log.
     *
     * @throws IllegalStateException
     *     When a detached server from an earlier session is still running, or this supervisor's server is not
     *     offline.
     * @throws ProcessSpawnFailedException
     *     When the server could not be spawned.
     */
    public void start()
        throws ProcessSpawnFailedException
    {
        final @Nullable ProcessRecord running = processRecordStore.getRunningServer();
        if (running != null && watchdog.pid().orElse(-1L) != running.pid())
        {
            throw new IllegalStateException(
                "A server is already running with pid %d (world '%s')."
                    .formatted(running.pid(), running.world()));
        }

        logBuffer.clear();
        watchdog.start();
        bepInExLogMonitor.start(config.server().workingDirectory(), true);
    }

    public void stop()
    {
        stop(Watchdog.DEFAULT_STOP_TIMEOUT);
    }

    public void stop(Duration timeout)
    {
        watchdog.stop(timeout);
        bepInExLogMonitor.stop();
    }

    public void kill()
    {
        watchdog.kill();
        bepInExLogMonitor.stop();
    }

    /**
     * Lets go of the running server without stopping it.
     *
     * @return The record through which the server can be found later, or null if no server was running.
     */
    public @Nullable ProcessRecord detach()
    {
        final @Nullable ProcessRecord processRecord = watchdog.detach();
        bepInExLogMonitor.stop();
        return processRecord;
    }

    /**
     * @return The record of a server that is still running, possibly one that was detached by an earlier session.
     */
    public @Nullable ProcessRecord runningServer()
    {
        return processRecordStore.getRunningServer();
    }

    /**
     * Stops a server that was detached by an earlier session.
     *
     * @param timeout
     *     How long to wait for a graceful shutdown before killing the server.
     * @return True if no detached server is running anymore.
     */
    public boolean stopDetached(Duration timeout)
    {
        final @Nullable ProcessRecord running = processRecordStore.getRunningServer();
        if (running == null)
            return true;
        log.info(() -> "Stopping detached server with pid " + running.pid() + ".");
        return processRecordStore.terminate(running, timeout);
    }

    public ProcessState state()
    {
        return watchdog.currentState();
    }

    public Watchdog watchdog()
    {
        return watchdog;
    }

    public RconManager rcon()
    {
        return rconManager;
    }

    public BepInExLogMonitor bepInExLog()
    {
        return bepInExLogMonitor;
    }

    public LogBuffer logBuffer()
    {
        return logBuffer;
    }

    public List<ServerLogEntry> recentLogs(int count)
    {
        return logBuffer.getRecent(count);
    }

    public KeeperConfig config()
    {
        return config;
    }

    /**
     * Stops the server if it is still running and releases every resource of the supervisor.
     */
    @Override
    public void close()
    {
        if (watchdog.currentState() != ProcessState.OFFLINE)
            watchdog.stop();
        watchdogSubscription.unsubscribe();
        bepInExLogMonitor.stop();
        rconManager.close();
        schedulers.forEach(TaskScheduler::close);
    }

    private static final class LoggingRconListener implements RconManagerListener
    {
        @Override
        public void onConnectionStateChange(ConnectionState state)
        {
            log.fine(() -> "RCON connection is now " + state + ".");
        }

        @Override
        public void onPlayerListUpdate(List<String> players)
        {
            log.finest(() -> "Players online: " + players);
        }
    }
}
