package nl.pim16aap2.valheimkeeper.server.bepinex;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BepInExLogParserTest
{
    private static final Instant TIMESTAMP = Instant.parse("2024-02-15T12:00:00Z");

    @Test
    void parse_shouldSplitLevelSourceAndMessage()
    {
        // execute
        final BepInExLogEntry entry =
            BepInExLogParser.parse("[Info   :   BepInEx] BepInEx 5.4.22.0 - valheim", TIMESTAMP);

        // verify
        assertThat(entry.level()).isEqualTo(BepInExLogLevel.INFO);
        assertThat(entry.source()).isEqualTo("BepInEx");
        assertThat(entry.message()).isEqualTo("BepInEx 5.4.22.0 - valheim");
        assertThat(entry.timestamp()).isEqualTo(TIMESTAMP);
        assertThat(entry.raw()).isEqualTo("[Info   :   BepInEx] BepInEx 5.4.22.0 - valheim");
    }

    @Test
    void parse_shouldKeepSourcesWithSpaces()
    {
        // execute
        final BepInExLogEntry entry =
            BepInExLogParser.parse("[Error  :Unity Log] NullReferenceException: Object reference", TIMESTAMP);

        // verify
        assertThat(entry.level()).isEqualTo(BepInExLogLevel.ERROR);
        assertThat(entry.source()).isEqualTo("Unity Log");
        assertThat(entry.message()).isEqualTo("NullReferenceException: Object reference");
    }

    @Test
    void parseLevel_shouldMapKnownLevelsCaseInsensitively()
    {
        // execute & verify
        assertThat(BepInExLogParser.parseLevel("Debug")).isEqualTo(BepInExLogLevel.DEBUG);
        assertThat(BepInExLogParser.parseLevel("Warning")).isEqualTo(BepInExLogLevel.WARN);
        assertThat(BepInExLogParser.parseLevel("WARN")).isEqualTo(BepInExLogLevel.WARN);
        assertThat(BepInExLogParser.parseLevel("error")).isEqualTo(BepInExLogLevel.ERROR);
        assertThat(BepInExLogParser.parseLevel("Fatal")).isEqualTo(BepInExLogLevel.FATAL);
        assertThat(BepInExLogParser.parseLevel("Message")).isEqualTo(BepInExLogLevel.INFO);
    }

    @Test
    void parse_shouldGuessLevelOfUnprefixedLines()
    {
        // execute
        final BepInExLogEntry stackTrace = BepInExLogParser.parse("  at SomeMod.Awake () [0x00000] Exception", TIMESTAMP);
        final BepInExLogEntry warning = BepInExLogParser.parse("Warning: deprecated config", TIMESTAMP);
        final BepInExLogEntry plain = BepInExLogParser.parse("Chainloader started", TIMESTAMP);

        // verify
        assertThat(stackTrace.level()).isEqualTo(BepInExLogLevel.ERROR);
        assertThat(stackTrace.source()).isEqualTo(BepInExLogParser.DEFAULT_SOURCE);
        assertThat(stackTrace.message()).isEqualTo("at SomeMod.Awake () [0x00000] Exception");
        assertThat(warning.level()).isEqualTo(BepInExLogLevel.WARN);
        assertThat(plain.level()).isEqualTo(BepInExLogLevel.INFO);
    }
}
