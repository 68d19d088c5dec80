package nl.pim16aap2.valheimkeeper.server.log;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogBufferTest
{
    @Test
    void add_shouldEvictOldestEntriesWhenFull()
    {
        // setup
        final LogBuffer buffer = new LogBuffer(3);

        // execute
        for (int idx = 1; idx <= 5; ++idx)
            buffer.add("line " + idx);

        // verify
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.getAll()).extracting(ServerLogEntry::message).containsExactly("line 3", "line 4", "line 5");
    }

    @Test
    void getRecent_shouldReturnNewestEntriesOldestFirst()
    {
        // setup
        final LogBuffer buffer = new LogBuffer();
        buffer.add("a");
        buffer.add("b");
        buffer.add("c");

        // execute & verify
        assertThat(buffer.getRecent(2)).extracting(ServerLogEntry::message).containsExactly("b", "c");
        assertThat(buffer.getRecent(10)).hasSize(3);
        assertThat(buffer.getRecent(0)).isEmpty();
    }

    @Test
    void getFiltered_shouldReturnOnlyEntriesOfLevel()
    {
        // setup
        final LogBuffer buffer = new LogBuffer();
        buffer.add("all good");
        buffer.add("Exception: broken");
        buffer.add("Warning: hmm");

        // execute
        final List<ServerLogEntry> errors = buffer.getFiltered(ServerLogLevel.ERROR);

        // verify
        assertThat(errors).extracting(ServerLogEntry::message).containsExactly("Exception: broken");
    }

    @Test
    void subscribe_shouldKeepNotifyingWhenSubscriberThrows()
    {
        // setup
        final LogBuffer buffer = new LogBuffer();
        final List<String> received = new ArrayList<>();
        buffer.subscribe(entry ->
        {
            throw new IllegalStateException("boom");
        });
        buffer.subscribe(entry -> received.add(entry.message()));

        // execute
        buffer.add("first");

        // verify
        assertThat(received).containsExactly("first");
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void clear_shouldRemoveEntriesButKeepSubscribers()
    {
        // setup
        final LogBuffer buffer = new LogBuffer();
        final List<String> received = new ArrayList<>();
        buffer.subscribe(entry -> received.add(entry.message()));
        buffer.add("first");

        // execute
        buffer.clear();
        buffer.add("second");

        // verify
        assertThat(buffer.getAll()).extracting(ServerLogEntry::message).containsExactly("second");
        assertThat(received).containsExactly("first", "second");
    }

    @Test
    void constructor_shouldRejectNonPositiveSize()
    {
        assertThatThrownBy(() -> new LogBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
