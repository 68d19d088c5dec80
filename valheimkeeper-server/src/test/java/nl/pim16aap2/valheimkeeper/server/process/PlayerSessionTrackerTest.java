package nl.pim16aap2.valheimkeeper.server.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerSessionTrackerTest
{
    @Test
    void joined_shouldPairCharacterWithOldestPendingConnection()
    {
        // setup
        final PlayerSessionTracker tracker = new PlayerSessionTracker();
        tracker.connecting("76561198000000001");
        tracker.connecting("76561198000000002");

        // execute
        tracker.joined("Ragnar");
        tracker.joined("Lagertha");

        // verify
        assertThat(tracker.disconnected("76561198000000002")).isEqualTo("Lagertha");
        assertThat(tracker.onlinePlayers()).containsExactly("Ragnar");
    }

    @Test
    void joined_shouldReturnFalseWhenPlayerIsAlreadyOnline()
    {
        // setup
        final PlayerSessionTracker tracker = new PlayerSessionTracker();
        tracker.connecting("1");

        // execute
        final boolean first = tracker.joined("Ragnar");
        final boolean respawn = tracker.joined("Ragnar");

        // verify
        assertThat(first).isTrue();
        assertThat(respawn).isFalse();
        assertThat(tracker.onlinePlayers()).containsExactly("Ragnar");
    }

    @Test
    void connecting_shouldIgnoreDuplicateConnections()
    {
        // setup
        final PlayerSessionTracker tracker = new PlayerSessionTracker();
        tracker.connecting("1");
        tracker.connecting("1");
        tracker.joined("Ragnar");

        // execute
        tracker.connecting("1");
        tracker.joined("Bjorn");

        // verify
        assertThat(tracker.disconnected("1")).isEqualTo("Ragnar");
        assertThat(tracker.onlinePlayers()).containsExactly("Bjorn");
    }

    @Test
    void disconnected_shouldReturnNullForConnectionWithoutCharacter()
    {
        // setup
        final PlayerSessionTracker tracker = new PlayerSessionTracker();
        tracker.connecting("1");

        // execute
        final String name = tracker.disconnected("1");
        tracker.joined("Ragnar");

        // verify
        assertThat(name).isNull();
        assertThat(tracker.disconnected("1")).isNull();
        assertThat(tracker.onlinePlayers()).containsExactly("Ragnar");
    }

    @Test
    void clear_shouldForgetAllSessions()
    {
        // setup
        final PlayerSessionTracker tracker = new PlayerSessionTracker();
        tracker.connecting("1");
        tracker.joined("Ragnar");
        tracker.connecting("2");

        // execute
        tracker.clear();
        tracker.joined("Bjorn");

        // verify
        assertThat(tracker.onlinePlayers()).containsExactly("Bjorn");
        assertThat(tracker.disconnected("2")).isNull();
    }
}
