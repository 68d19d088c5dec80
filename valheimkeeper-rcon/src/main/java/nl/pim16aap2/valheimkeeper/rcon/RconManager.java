package nl.pim16aap2.valheimkeeper.rcon;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.runtime.ListenerRegistry;
import nl.pim16aap2.valheimkeeper.runtime.Subscription;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.ScheduledTask;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps an RCON connection to the server alive and exposes the Valheim admin commands.
 * <p>
 * The manager polls the player list while connected and, when configured to, reconnects after a failed or lost
 * connection. Timers run on the {@link TaskScheduler} passed to the constructor. Commands block the calling thread.
 */
@Log
public final class RconManager implements AutoCloseable
{
    /**
     * Delay between a failed or lost connection and the next attempt.
     */
    public static final Duration RECONNECT_DELAY = Duration.ofMillis(5_000);

    static final String PLAYERS_COMMAND = "players";
    static final String PLAYERS_HEADER = "Players:";

    private final TaskScheduler scheduler;
    private final Function<RconManagerConfig, RconConnection> connectionFactory;
    private final ListenerRegistry<RconManagerListener> listeners = new ListenerRegistry<>("RconManager");

    private final Object lock = new Object();
    @GuardedBy("lock")
    private @Nullable RconManagerConfig config;
    @GuardedBy("lock")
    private @Nullable Subscription primarySubscription;
    @GuardedBy("lock")
    private @Nullable RconConnection connection;
    @GuardedBy("lock")
    private ConnectionState state = ConnectionState.DISCONNECTED;
    @GuardedBy("lock")
    private boolean connecting;
    /**
     * Incremented by every disconnect. A connect attempt that finishes under a different generation is stale.
     */
    @GuardedBy("lock")
    private long generation;
    @GuardedBy("lock")
    private @Nullable ScheduledTask pollTask;
    @GuardedBy("lock")
    private @Nullable ScheduledTask reconnectTask;

    public RconManager(TaskScheduler scheduler)
    {
        this(scheduler, RconClient::new);
    }

    public RconManager(TaskScheduler scheduler, Function<RconManagerConfig, RconConnection> connectionFactory)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler may not be null.");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory may not be null.");
    }

    /**
     * Configures the manager.
     * <p>
     * If the manager is already connected to the same host and port with the same password, the connection is kept
     * and only the listener and the remaining settings are replaced. Otherwise the current connection is closed first.
     * This method does not connect.
     *
     * @param config
     *     The new configuration.
     * @param listener
     *     The primary listener. It replaces the primary listener passed to a previous call.
     */
    public void initialize(RconManagerConfig config, RconManagerListener listener)
    {
        Objects.requireNonNull(config, "config may not be null.");
        Objects.requireNonNull(listener, "listener may not be null.");

        synchronized (lock)
        {
            if (this.config != null && this.config.sameEndpoint(config) && isConnectedLocked())
            {
                this.config = config;
                replacePrimaryListenerLocked(listener);
                return;
            }
        }

        disconnect();

        synchronized (lock)
        {
            this.config = config;
            replacePrimaryListenerLocked(listener);
        }
    }

    /**
     * Connects to the configured server, blocking until the attempt completes.
     * <p>
     * Does nothing if the manager has not been initialized, is disabled, or is already connected or connecting. A
     * failed attempt moves the manager to {@link ConnectionState#ERROR} and schedules a reconnect if enabled.
     */
    public void connect()
    {
        final RconManagerConfig currentConfig;
        final RconConnection newConnection;
        final long attemptGeneration;
        final boolean dropped;
        synchronized (lock)
        {
            if (config == null)
            {
                log.warning("Cannot connect: RCON manager has not been initialized.");
                return;
            }
            if (!config.enabled())
            {
                log.info("RCON is disabled.");
                return;
            }
            if (connecting || isConnectedLocked())
                return;

            // A connection that dropped without a failed request still has to pass through DISCONNECTED.
            dropped = connection != null && setStateLocked(ConnectionState.DISCONNECTED);
            cancelPollingLocked();
            cancelReconnectLocked();
            currentConfig = config;
            attemptGeneration = generation;
            newConnection = connectionFactory.apply(currentConfig);
            connection = newConnection;
            connecting = true;
            setStateLocked(ConnectionState.CONNECTING);
        }
        if (dropped)
            publishState(ConnectionState.DISCONNECTED);
        publishState(ConnectionState.CONNECTING);

        try
        {
            newConnection.connect();
        }
        catch (RconException exception)
        {
            final boolean current;
            synchronized (lock)
            {
                current = attemptGeneration == generation && connection == newConnection;
                if (current)
                {
                    connection = null;
                    connecting = false;
                    setStateLocked(ConnectionState.ERROR);
                    if (currentConfig.autoReconnect())
                        scheduleReconnectLocked();
                }
            }
            if (!current)
                return;

            log.warning(() -> "RCON connection to %s:%d failed: %s"
                .formatted(currentConfig.host(), currentConfig.port(), exception.getMessage()));
            publishState(ConnectionState.ERROR);
            return;
        }

        final boolean stale;
        synchronized (lock)
        {
            stale = attemptGeneration != generation || connection != newConnection;
            if (!stale)
            {
                connecting = false;
                setStateLocked(ConnectionState.CONNECTED);
                startPollingLocked(currentConfig.pollInterval());
            }
        }
        if (stale)
        {
            log.fine("Discarding RCON connection that completed after a disconnect.");
            newConnection.disconnect();
            return;
        }

        log.info(() -> "RCON connected to %s:%d.".formatted(currentConfig.host(), currentConfig.port()));
        publishState(ConnectionState.CONNECTED);
    }

    /**
     * Runs {@link #connect()} on this manager's scheduler.
     */
    public void connectInBackground()
    {
        scheduler.execute(this::connect);
    }

    /**
     * Closes the connection and cancels polling and pending reconnects. Safe to call at any time.
     */
    public void disconnect()
    {
        final @Nullable RconConnection oldConnection;
        final boolean changed;
        synchronized (lock)
        {
            ++generation;
            cancelPollingLocked();
            cancelReconnectLocked();
            oldConnection = connection;
            connection = null;
            connecting = false;
            changed = setStateLocked(ConnectionState.DISCONNECTED);
        }

        if (oldConnection != null)
            oldConnection.disconnect();
        if (changed)
            publishState(ConnectionState.DISCONNECTED);
    }

    public boolean isConnected()
    {
        synchronized (lock)
        {
            return isConnectedLocked();
        }
    }

    public ConnectionState state()
    {
        synchronized (lock)
        {
            return state;
        }
    }

    /**
     * Adds a listener in addition to the primary one.
     *
     * @param listener
     *     The listener.
     * @return The subscription that removes the listener again.
     */
    public Subscription subscribe(RconManagerListener listener)
    {
        return listeners.subscribe(listener);
    }

    public @Nullable String kickPlayer(String playerName)
    {
        return sendCommand("kick " + playerName);
    }

    public @Nullable String banPlayer(String playerName)
    {
        return sendCommand("ban " + playerName);
    }

    /**
     * @param playerIdentifier
     *     The name or platform id of the player.
     */
    public @Nullable String unbanPlayer(String playerIdentifier)
    {
        return sendCommand("unban " + playerIdentifier);
    }

    /**
     * @return The banned players, or an empty list if the command failed.
     */
    public List<String> getBannedPlayers()
    {
        return splitLines(sendCommand("banned"));
    }

    public @Nullable String triggerEvent(String eventKey)
    {
        return sendCommand("randomevent " + eventKey);
    }

    public @Nullable String triggerEvent(ValheimEvent event)
    {
        return triggerEvent(event.key());
    }

    public @Nullable String triggerRandomEvent()
    {
        return sendCommand("randomevent");
    }

    public @Nullable String stopEvent()
    {
        return sendCommand("stopevent");
    }

    /**
     * @return The active global keys, or an empty list if the command failed.
     */
    public List<String> listGlobalKeys()
    {
        return splitLines(sendCommand("listkeys"));
    }

    public @Nullable String setGlobalKey(String keyName)
    {
        return sendCommand("setkey " + keyName);
    }

    public @Nullable String setGlobalKey(GlobalKey key)
    {
        return setGlobalKey(key.key());
    }

    public @Nullable String removeGlobalKey(String keyName)
    {
        return sendCommand("removekey " + keyName);
    }

    public @Nullable String removeGlobalKey(GlobalKey key)
    {
        return removeGlobalKey(key.key());
    }

    public @Nullable String resetGlobalKeys()
    {
        return sendCommand("resetkeys");
    }

    /**
     * Skips the night.
     */
    public @Nullable String sleep()
    {
        return sendCommand("sleep");
    }

    public @Nullable String skipTime(long seconds)
    {
        return sendCommand("skiptime " + seconds);
    }

    public @Nullable String getServerInfo()
    {
        return sendCommand("info");
    }

    public @Nullable String pingServer()
    {
        return sendCommand("ping");
    }

    /**
     * Removes all items lying on the ground.
     */
    public @Nullable String removeDrops()
    {
        return sendCommand("removedrops");
    }

    /**
     * Forces a world save.
     */
    public @Nullable String save()
    {
        return sendCommand("save");
    }

    /**
     * Sends a raw command.
     *
     * @param command
     *     The command text.
     * @return The response, or null if the manager is not connected or the command failed.
     */
    public @Nullable String sendCommand(String command)
    {
        Objects.requireNonNull(command, "command may not be null.");
        final @Nullable RconConnection current;
        synchronized (lock)
        {
            current = isConnectedLocked() ? connection : null;
        }
        if (current == null)
        {
            log.warning(() -> "Cannot send command '%s': not connected.".formatted(command));
            return null;
        }

        try
        {
            return current.send(command);
        }
        catch (RconException exception)
        {
            log.warning(() -> "Command '%s' failed: %s".formatted(command, exception.getMessage()));
            handleFailure(current);
            return null;
        }
    }

    @Override
    public void close()
    {
        disconnect();
        listeners.clear();
        synchronized (lock)
        {
            primarySubscription = null;
        }
    }

    void poll()
    {
        final @Nullable RconConnection current;
        synchronized (lock)
        {
            current = isConnectedLocked() ? connection : null;
        }
        if (current == null)
            return;

        final List<String> players;
        try
        {
            players = parsePlayers(current.send(PLAYERS_COMMAND));
        }
        catch (RconException exception)
        {
            log.fine(() -> "Player poll failed: " + exception.getMessage());
            handleFailure(current);
            return;
        }
        listeners.notify(listener -> listener.onPlayerListUpdate(players));
    }

    static List<String> parsePlayers(@Nullable String response)
    {
        return splitLines(response).stream()
            .filter(line -> !PLAYERS_HEADER.equals(line))
            .collect(Collectors.toUnmodifiableList());
    }

    static List<String> splitLines(@Nullable String response)
    {
        if (response == null)
            return List.of();
        return Arrays.stream(response.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Moves to {@link ConnectionState#DISCONNECTED} if a failed request dropped the connection.
     */
    private void handleFailure(RconConnection failed)
    {
        if (failed.isConnected())
            return;

        synchronized (lock)
        {
            if (connection != failed)
                return;
            connection = null;
            cancelPollingLocked();
            setStateLocked(ConnectionState.DISCONNECTED);
            if (config != null && config.autoReconnect())
                scheduleReconnectLocked();
        }
        log.warning("RCON connection lost.");
        publishState(ConnectionState.DISCONNECTED);
    }

    /**
     * @return True if the state changed and listeners have to be notified through {@link #publishState}.
     */
    @GuardedBy("lock")
    private boolean setStateLocked(ConnectionState newState)
    {
        if (state == newState)
            return false;
        state = newState;
        return true;
    }

    private void publishState(ConnectionState newState)
    {
        log.fine(() -> "RCON connection state changed to " + newState + ".");
        listeners.notify(listener -> listener.onConnectionStateChange(newState));
    }

    @GuardedBy("lock")
    private boolean isConnectedLocked()
    {
        return !connecting && connection != null && connection.isConnected();
    }

    @GuardedBy("lock")
    private void replacePrimaryListenerLocked(RconManagerListener listener)
    {
        if (primarySubscription != null)
            primarySubscription.unsubscribe();
        primarySubscription = listeners.subscribe(listener);
    }

    @GuardedBy("lock")
    private void startPollingLocked(Duration interval)
    {
        cancelPollingLocked();
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, interval, interval);
    }

    @GuardedBy("lock")
    private void cancelPollingLocked()
    {
        if (pollTask != null)
        {
            pollTask.cancel();
            pollTask = null;
        }
    }

    @GuardedBy("lock")
    private void scheduleReconnectLocked()
    {
        cancelReconnectLocked();
        reconnectTask = scheduler.schedule(
            () ->
            {
                log.info("Attempting RCON reconnect.");
                connect();
            },
            RECONNECT_DELAY
        );
    }

    @GuardedBy("lock")
    private void cancelReconnectLocked()
    {
        if (reconnectTask != null)
        {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }
}
