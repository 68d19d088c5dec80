package nl.pim16aap2.valheimkeeper.server.config;

import nl.pim16aap2.valheimkeeper.rcon.RconManagerConfig;
import nl.pim16aap2.valheimkeeper.server.watchdog.WatchdogConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeeperConfigReaderTest
{
    private static final Path BASE_DIRECTORY = Path.of("/srv/keeper");

    private final KeeperConfigReader reader = new KeeperConfigReader();

    @Test
    void parse_shouldApplyDefaultsForMissingFields()
        throws IOException
    {
        // execute
        final KeeperConfig config = reader.parse(
            """
            {
              "server": { "executable": "valheim/valheim_server.x86_64" }
            }
            """, BASE_DIRECTORY);

        // verify
        assertThat(config.server().executable()).isEqualTo(BASE_DIRECTORY.resolve("valheim/valheim_server.x86_64"));
        assertThat(config.server().workingDirectory()).isEqualTo(BASE_DIRECTORY.resolve("valheim"));
        assertThat(config.server().name()).isEqualTo(KeeperConfigReader.DEFAULT_SERVER_NAME);
        assertThat(config.server().world()).isEqualTo(KeeperConfigReader.DEFAULT_WORLD);
        assertThat(config.server().password()).isEmpty();
        assertThat(config.server().port()).isEqualTo(2456);
        assertThat(config.server().publicServer()).isFalse();
        assertThat(config.server().saveInterval()).isNull();
        assertThat(config.server().logFile()).isNull();
        assertThat(config.server().environment()).isEmpty();
        assertThat(config.watchdog()).isEqualTo(WatchdogConfig.DEFAULTS);
        assertThat(config.rcon().enabled()).isFalse();
        assertThat(config.rcon().host()).isEqualTo(RconManagerConfig.DEFAULT_HOST);
        assertThat(config.rcon().port()).isEqualTo(RconManagerConfig.DEFAULT_PORT);
        assertThat(config.stateDirectory()).isEqualTo(BASE_DIRECTORY.resolve("state"));
        assertThat(config.processRecordFile()).isEqualTo(BASE_DIRECTORY.resolve("state").resolve("server.pid"));
    }

    @Test
    void parse_shouldReadAllSections()
        throws IOException
    {
        // execute
        final KeeperConfig config = reader.parse(
            """
            {
              "server": {
                "executable": "/opt/valheim/valheim_server.x86_64",
                "workingDirectory": "/opt/valheim",
                "name": "Vikings Only",
                "world": "Midgard",
                "password": "hunter2",
                "port": 2460,
                "public": true,
                "crossplay": true,
                "saveDirectory": "saves",
                "logFile": "logs/valheim.log",
                "saveInterval": 600,
                "backups": 4,
                "environment": { "TZ": "UTC" },
                "unknownField": 42
              },
              "watchdog": {
                "enabled": false,
                "maxRestarts": 10,
                "restartDelay": 2000,
                "cooldownPeriod": 120000,
                "backoffMultiplier": 1.5,
                "readinessTimeout": 60000
              },
              "rcon": {
                "host": "10.0.0.5",
                "port": 25580,
                "password": "rconpass",
                "timeout": 3000,
                "enabled": true,
                "autoReconnect": true,
                "pollInterval": 15000
              },
              "stateDirectory": "/var/lib/valheimkeeper"
            }
            """, BASE_DIRECTORY);

        // verify
        assertThat(config.server().name()).isEqualTo("Vikings Only");
        assertThat(config.server().world()).isEqualTo("Midgard");
        assertThat(config.server().password()).isEqualTo("hunter2");
        assertThat(config.server().port()).isEqualTo(2460);
        assertThat(config.server().publicServer()).isTrue();
        assertThat(config.server().crossplay()).isTrue();
        assertThat(config.server().saveDirectory()).isEqualTo(BASE_DIRECTORY.resolve("saves"));
        assertThat(config.server().logFile()).isEqualTo(BASE_DIRECTORY.resolve("logs/valheim.log"));
        assertThat(config.server().saveInterval()).isEqualTo(600);
        assertThat(config.server().backups()).isEqualTo(4);
        assertThat(config.server().environment()).containsExactlyEntriesOf(Map.of("TZ", "UTC"));

        assertThat(config.watchdog()).isEqualTo(new WatchdogConfig(
            false, 10, Duration.ofSeconds(2), Duration.ofMinutes(2), 1.5D, Duration.ofMinutes(1)));

        assertThat(config.rcon().host()).isEqualTo("10.0.0.5");
        assertThat(config.rcon().port()).isEqualTo(25_580);
        assertThat(config.rcon().password()).isEqualTo("rconpass");
        assertThat(config.rcon().timeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(config.rcon().enabled()).isTrue();
        assertThat(config.rcon().autoReconnect()).isTrue();
        assertThat(config.rcon().pollInterval()).isEqualTo(Duration.ofSeconds(15));

        assertThat(config.stateDirectory()).isEqualTo(Path.of("/var/lib/valheimkeeper"));
        assertThat(config.logDirectory()).isEqualTo(Path.of("/var/lib/valheimkeeper/logs"));
    }

    @Test
    void parse_shouldThrowExceptionWhenExecutableIsMissing()
    {
        // execute
        final var thrown = assertThatThrownBy(() -> reader.parse("{ \"server\": {} }", BASE_DIRECTORY));

        // verify
        thrown.isInstanceOf(IOException.class).hasMessage("Missing required field 'server.executable'.");
    }

    @Test
    void parse_shouldNameFieldThatIsOutOfRange()
    {
        // execute
        final var thrown = assertThatThrownBy(() -> reader.parse(
            """
            {
              "server": { "executable": "valheim_server.x86_64" },
              "watchdog": { "maxRestarts": 101 }
            }
            """, BASE_DIRECTORY));

        // verify
        thrown
            .isInstanceOf(IOException.class)
            .hasMessage("Field 'watchdog.maxRestarts' must be between 0 and 100, got 101.");
    }

    @Test
    void parse_shouldRejectPrivilegedRconPort()
    {
        // execute
        final var thrown = assertThatThrownBy(() -> reader.parse(
            """
            {
              "server": { "executable": "valheim_server.x86_64" },
              "rcon": { "port": 100 }
            }
            """, BASE_DIRECTORY));

        // verify
        thrown
            .isInstanceOf(IOException.class)
            .hasMessage("Field 'rcon.port' must be between 1024 and 65535, got 100.");
    }

    @Test
    void parse_shouldRejectFieldOfWrongType()
    {
        // execute
        final var thrown = assertThatThrownBy(() -> reader.parse(
            """
            {
              "server": { "executable": "valheim_server.x86_64", "port": "2456" }
            }
            """, BASE_DIRECTORY));

        // verify
        thrown.isInstanceOf(IOException.class).hasMessage("Field 'server.port' must be an integer.");
    }

    @Test
    void parse_shouldRejectShortPassword()
    {
        // execute
        final var thrown = assertThatThrownBy(() -> reader.parse(
            """
            {
              "server": { "executable": "valheim_server.x86_64", "password": "abc" }
            }
            """, BASE_DIRECTORY));

        // verify
        thrown.isInstanceOf(IOException.class).hasMessageContaining("server.password");
    }

    @Test
    void parse_shouldRejectInvalidJson()
    {
        // execute & verify
        assertThatThrownBy(() -> reader.parse("{ \"server\": ", BASE_DIRECTORY))
            .isInstanceOf(IOException.class)
            .hasMessageStartingWith("Configuration is not valid JSON");
        assertThatThrownBy(() -> reader.parse("[]", BASE_DIRECTORY))
            .isInstanceOf(IOException.class)
            .hasMessage("Configuration must be a JSON object.");
    }

    @Test
    void read_shouldResolvePathsAgainstDirectoryOfFile(@TempDir Path tempDirectory)
        throws IOException
    {
        // setup
        final Path configFile = tempDirectory.resolve("valheimkeeper.json");
        Files.writeString(configFile, "{ \"server\": { \"executable\": \"server/valheim_server.x86_64\" } }");

        // execute
        final KeeperConfig config = reader.read(configFile);

        // verify
        assertThat(config.server().executable())
            .isEqualTo(tempDirectory.toAbsolutePath().resolve("server/valheim_server.x86_64"));
        assertThat(config.stateDirectory()).isEqualTo(tempDirectory.toAbsolutePath().resolve("state"));
    }
}
