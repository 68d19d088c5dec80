package nl.pim16aap2.valheimkeeper.rcon;

import nl.pim16aap2.valheimkeeper.runtime.scheduling.DeterministicTaskScheduler;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class RconManagerTest
{
    private static final RconManagerConfig CONFIG = new RconManagerConfig(
        "localhost", 2458, "secret", Duration.ofSeconds(5), true, true, Duration.ofSeconds(10));

    @Test
    void connect_shouldDoNothingWhenNotInitialized()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);

        // execute
        manager.connect();

        // verify
        assertThat(factory.created).isEmpty();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void connect_shouldDoNothingWhenDisabled()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        manager.initialize(
            new RconManagerConfig("localhost", 2458, "secret", false, true), new RecordingListener());

        // execute
        manager.connect();

        // verify
        assertThat(factory.created).isEmpty();
        assertThat(manager.isConnected()).isFalse();
    }

    @Test
    void connect_shouldNotifyConnectingThenConnected()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);

        // execute
        manager.connect();
        manager.connect();

        // verify
        assertThat(factory.created).hasSize(1);
        assertThat(manager.isConnected()).isTrue();
        assertThat(manager.state()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(listener.states).containsExactly(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
    }

    @Test
    void connect_shouldRetryAfterReconnectDelayWhenConnectFails()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        factory.failingConnects = 2;
        final RconManager manager = new RconManager(scheduler, factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);

        // execute
        manager.connect();
        scheduler.advance(RconManager.RECONNECT_DELAY.minusMillis(1));

        // verify
        assertThat(factory.created).hasSize(1);
        assertThat(manager.state()).isEqualTo(ConnectionState.ERROR);

        // execute
        scheduler.advance(Duration.ofMillis(1));

        // verify
        assertThat(factory.created).hasSize(2);
        assertThat(manager.state()).isEqualTo(ConnectionState.ERROR);

        // execute
        scheduler.advance(RconManager.RECONNECT_DELAY);

        // verify
        assertThat(factory.created).hasSize(3);
        assertThat(manager.isConnected()).isTrue();
        assertThat(listener.states).containsExactly(
            ConnectionState.CONNECTING, ConnectionState.ERROR,
            ConnectionState.CONNECTING, ConnectionState.ERROR,
            ConnectionState.CONNECTING, ConnectionState.CONNECTED
        );
    }

    @Test
    void connect_shouldNotRetryWhenAutoReconnectIsDisabled()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        factory.failingConnects = 1;
        final RconManager manager = new RconManager(scheduler, factory);
        manager.initialize(new RconManagerConfig("localhost", 2458, "secret", true, false), new RecordingListener());

        // execute
        manager.connect();
        scheduler.advance(Duration.ofMinutes(1));

        // verify
        assertThat(factory.created).hasSize(1);
        assertThat(manager.state()).isEqualTo(ConnectionState.ERROR);
        assertThat(scheduler.pendingTaskCount()).isZero();
    }

    @Test
    void connect_shouldDiscardConnectionWhenDisconnectRacesTheAttempt()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);
        factory.duringConnect = manager::disconnect;

        // execute
        manager.connect();

        // verify
        assertThat(factory.created).hasSize(1);
        assertThat(factory.created.get(0).disconnectCalls).isPositive();
        assertThat(factory.created.get(0).isConnected()).isFalse();
        assertThat(manager.isConnected()).isFalse();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(listener.states).containsExactly(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
    }

    @Test
    void connectInBackground_shouldConnectOnTheScheduler()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(scheduler, factory);
        manager.initialize(CONFIG, new RecordingListener());

        // execute
        manager.connectInBackground();

        // verify
        assertThat(manager.isConnected()).isFalse();

        // execute
        scheduler.runPending();

        // verify
        assertThat(manager.isConnected()).isTrue();
    }

    @Test
    void initialize_shouldKeepConnectionAndSwapListenerWhenEndpointIsUnchanged()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        factory.responder = command -> "Players:\nAlice";
        final RconManager manager = new RconManager(scheduler, factory);
        final RecordingListener first = new RecordingListener();
        final RecordingListener second = new RecordingListener();
        manager.initialize(CONFIG, first);
        manager.connect();

        // execute
        manager.initialize(CONFIG, second);
        scheduler.advance(CONFIG.pollInterval());

        // verify
        assertThat(factory.created).hasSize(1);
        assertThat(factory.created.get(0).disconnectCalls).isZero();
        assertThat(manager.isConnected()).isTrue();
        assertThat(first.playerLists).isEmpty();
        assertThat(second.playerLists).containsExactly(List.of("Alice"));
    }

    @Test
    void initialize_shouldDisconnectWhenEndpointChanges()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);
        manager.connect();

        // execute
        manager.initialize(
            new RconManagerConfig("localhost", 2459, "secret", true, true), listener);

        // verify
        assertThat(factory.created.get(0).disconnectCalls).isEqualTo(1);
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void poll_shouldPublishPlayerNamesWithoutHeader()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        factory.responder = command -> "Players:\n  Alice \n\nBob\n";
        final RconManager manager = new RconManager(scheduler, factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);
        manager.connect();

        // execute
        scheduler.advance(CONFIG.pollInterval().multipliedBy(2));

        // verify
        assertThat(listener.playerLists).containsExactly(List.of("Alice", "Bob"), List.of("Alice", "Bob"));
        assertThat(factory.created.get(0).commands).containsExactly("players", "players");
    }

    @Test
    void poll_shouldDisconnectAndReconnectWhenConnectionDrops()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(scheduler, factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);
        manager.connect();
        factory.created.get(0).dropOnNextSend = true;

        // execute
        scheduler.advance(CONFIG.pollInterval());

        // verify
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);

        // execute
        scheduler.advance(RconManager.RECONNECT_DELAY);

        // verify
        assertThat(factory.created).hasSize(2);
        assertThat(manager.isConnected()).isTrue();
        assertThat(listener.states).containsExactly(
            ConnectionState.CONNECTING, ConnectionState.CONNECTED,
            ConnectionState.DISCONNECTED,
            ConnectionState.CONNECTING, ConnectionState.CONNECTED
        );
    }

    @Test
    void sendCommand_shouldReturnNullWhenNotConnected()
    {
        // setup
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), new ConnectionFactory());
        manager.initialize(CONFIG, new RecordingListener());

        // execute & verify
        assertThat(manager.sendCommand("info")).isNull();
        assertThat(manager.getBannedPlayers()).isEmpty();
    }

    @Test
    void sendCommand_shouldReturnNullAndScheduleReconnectWhenConnectionDrops()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(scheduler, factory);
        manager.initialize(CONFIG, new RecordingListener());
        manager.connect();
        factory.created.get(0).dropOnNextSend = true;

        // execute
        final @Nullable String response = manager.kickPlayer("Alice");

        // verify
        assertThat(response).isNull();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);

        // execute
        scheduler.advance(RconManager.RECONNECT_DELAY);

        // verify
        assertThat(manager.isConnected()).isTrue();
    }

    @Test
    void commands_shouldSendValheimCommandText()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        factory.responder = command -> "ok";
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        manager.initialize(CONFIG, new RecordingListener());
        manager.connect();

        // execute
        manager.kickPlayer("Alice");
        manager.banPlayer("Bob");
        manager.unbanPlayer("76561198000000000");
        manager.triggerEvent(ValheimEvent.ARMY_EIKTHYR);
        manager.triggerRandomEvent();
        manager.stopEvent();
        manager.setGlobalKey(GlobalKey.DEFEATED_QUEEN);
        manager.removeGlobalKey("defeated_dragon");
        manager.resetGlobalKeys();
        manager.sleep();
        manager.skipTime(3600);
        manager.getServerInfo();
        manager.pingServer();
        manager.removeDrops();
        manager.save();

        // verify
        assertThat(factory.created.get(0).commands).containsExactly(
            "kick Alice",
            "ban Bob",
            "unban 76561198000000000",
            "randomevent army_eikthyr",
            "randomevent",
            "stopevent",
            "setkey defeated_queen",
            "removekey defeated_dragon",
            "resetkeys",
            "sleep",
            "skiptime 3600",
            "info",
            "ping",
            "removedrops",
            "save"
        );
    }

    @Test
    void listGlobalKeys_shouldSplitTrimmedNonBlankLines()
    {
        // setup
        final ConnectionFactory factory = new ConnectionFactory();
        factory.responder = command -> " defeated_eikthyr \r\n\ndefeated_gdking\n";
        final RconManager manager = new RconManager(new DeterministicTaskScheduler(), factory);
        manager.initialize(CONFIG, new RecordingListener());
        manager.connect();

        // execute
        final List<String> keys = manager.listGlobalKeys();

        // verify
        assertThat(keys).containsExactly("defeated_eikthyr", "defeated_gdking");
    }

    @Test
    void disconnect_shouldNotifyOnlyOnRealTransitions()
    {
        // setup
        final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler();
        final ConnectionFactory factory = new ConnectionFactory();
        final RconManager manager = new RconManager(scheduler, factory);
        final RecordingListener listener = new RecordingListener();
        manager.initialize(CONFIG, listener);
        manager.connect();

        // execute
        manager.disconnect();
        manager.disconnect();

        // verify
        assertThat(listener.states).containsExactly(
            ConnectionState.CONNECTING, ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);
        assertThat(scheduler.pendingTaskCount()).isZero();
    }

    private static final class RecordingListener implements RconManagerListener
    {
        private final List<ConnectionState> states = new CopyOnWriteArrayList<>();
        private final List<List<String>> playerLists = new CopyOnWriteArrayList<>();

        @Override
        public void onConnectionStateChange(ConnectionState state)
        {
            states.add(state);
        }

        @Override
        public void onPlayerListUpdate(List<String> players)
        {
            playerLists.add(players);
        }
    }

    private static final class ConnectionFactory implements Function<RconManagerConfig, RconConnection>
    {
        private final List<FakeConnection> created = new ArrayList<>();
        private int failingConnects;
        private @Nullable Runnable duringConnect;
        private Function<String, String> responder = command -> "";

        @Override
        public RconConnection apply(RconManagerConfig config)
        {
            final FakeConnection connection = new FakeConnection(this);
            created.add(connection);
            return connection;
        }
    }

    private static final class FakeConnection implements RconConnection
    {
        private final ConnectionFactory factory;
        private final List<String> commands = new ArrayList<>();
        private boolean connected;
        private boolean dropOnNextSend;
        private int disconnectCalls;

        private FakeConnection(ConnectionFactory factory)
        {
            this.factory = factory;
        }

        @Override
        public void connect()
            throws RconException
        {
            if (factory.failingConnects > 0)
            {
                --factory.failingConnects;
                throw new RconException(RconException.Reason.CONNECTION_REFUSED, "Connection refused.");
            }
            final @Nullable Runnable duringConnect = factory.duringConnect;
            if (duringConnect != null)
                duringConnect.run();
            connected = true;
        }

        @Override
        public String send(String command)
            throws RconException
        {
            if (!connected)
                throw new RconException(RconException.Reason.DISCONNECTED, "Not connected.");
            commands.add(command);
            if (dropOnNextSend)
            {
                connected = false;
                throw new RconException(RconException.Reason.DISCONNECTED, "Connection reset.");
            }
            return factory.responder.apply(command);
        }

        @Override
        public void disconnect()
        {
            ++disconnectCalls;
            connected = false;
        }

        @Override
        public boolean isConnected()
        {
            return connected;
        }
    }
}
