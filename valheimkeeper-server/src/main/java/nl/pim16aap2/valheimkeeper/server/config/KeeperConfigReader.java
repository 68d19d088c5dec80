package nl.pim16aap2.valheimkeeper.server.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.pim16aap2.valheimkeeper.rcon.RconManagerConfig;
import nl.pim16aap2.valheimkeeper.server.process.ServerLaunchConfig;
import nl.pim16aap2.valheimkeeper.server.watchdog.WatchdogConfig;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a {@link KeeperConfig} from a JSON file.
 * <p>
 * Only {@code server.executable} is required. Missing sections and fields get their defaults, unknown fields are
 * ignored and relative paths are resolved against the directory of the file. Durations are given in milliseconds.
 * A value that is out of range results in an {@link IOException} that names the offending field.
 */
public final class KeeperConfigReader
{
    static final String DEFAULT_SERVER_NAME = "ValheimKeeper";
    static final String DEFAULT_WORLD = "Dedicated";
    static final String DEFAULT_STATE_DIRECTORY = "state";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public KeeperConfig read(Path path)
        throws IOException
    {
        final Path baseDirectory = path.toAbsolutePath().getParent();
        return parse(Files.readString(path), baseDirectory == null ? Path.of("") : baseDirectory);
    }

    /**
     * Parses a configuration.
     *
     * @param json
     *     The JSON text.
     * @param baseDirectory
     *     The directory against which relative paths are resolved.
     * @return The configuration.
     *
     * @throws IOException
     *     When the text is not valid JSON or a field is missing or out of range.
     */
    public KeeperConfig parse(String json, Path baseDirectory)
        throws IOException
    {
        final JsonNode root;
        try
        {
            root = objectMapper.readTree(json);
        }
        catch (JsonProcessingException exception)
        {
            throw new IOException("Configuration is not valid JSON: " + exception.getOriginalMessage(), exception);
        }
        if (root == null || !root.isObject())
            throw new IOException("Configuration must be a JSON object.");

        final ServerLaunchConfig server = readServer(root.path("server"), baseDirectory);
        final WatchdogConfig watchdog = readWatchdog(root.path("watchdog"));
        final RconManagerConfig rcon = readRcon(root.path("rcon"));
        final Path stateDirectory = baseDirectory.resolve(
            optionalString(root, "", "stateDirectory", DEFAULT_STATE_DIRECTORY));
        return new KeeperConfig(server, watchdog, rcon, stateDirectory);
    }

    private static ServerLaunchConfig readServer(JsonNode node, Path baseDirectory)
        throws IOException
    {
        final String section = "server";
        final @Nullable String executableText = optionalNullableString(node, section, "executable");
        if (executableText == null || executableText.isBlank())
            throw new IOException("Missing required field 'server.executable'.");
        final Path executable = baseDirectory.resolve(executableText);

        final @Nullable Path executableDirectory = executable.getParent();
        final @Nullable String workingDirectoryText = optionalNullableString(node, section, "workingDirectory");
        final Path workingDirectory = workingDirectoryText != null ?
            baseDirectory.resolve(workingDirectoryText) :
            executableDirectory == null ? baseDirectory : executableDirectory;

        final String name = boundedString(node, section, "name", DEFAULT_SERVER_NAME, 1, 64);
        final String world = boundedString(node, section, "world", DEFAULT_WORLD, 1, 64);
        final String password = boundedString(node, section, "password", "", 0, 64);
        if (!password.isEmpty() && password.length() < 5)
            throw new IOException("Field 'server.password' must be empty or at least 5 characters long.");

        final int port = intInRange(node, section, "port", ServerLaunchConfig.DEFAULT_PORT, 1024, 65_535);
        final boolean publicServer = optionalBoolean(node, section, "public", false);
        final boolean crossplay = optionalBoolean(node, section, "crossplay", false);

        final @Nullable String saveDirectory = optionalNullableString(node, section, "saveDirectory");
        final @Nullable String logFile = optionalNullableString(node, section, "logFile");
        final @Nullable Integer saveInterval = optionalIntInRange(node, section, "saveInterval", 60, 7_200);
        final @Nullable Integer backups = optionalIntInRange(node, section, "backups", 1, 100);

        return new ServerLaunchConfig(
            executable,
            workingDirectory,
            name,
            port,
            world,
            password,
            publicServer,
            crossplay,
            saveDirectory == null ? null : baseDirectory.resolve(saveDirectory),
            logFile == null ? null : baseDirectory.resolve(logFile),
            saveInterval,
            backups,
            readEnvironment(node.path("environment"))
        );
    }

    private static WatchdogConfig readWatchdog(JsonNode node)
        throws IOException
    {
        final String section = "watchdog";
        final WatchdogConfig defaults = WatchdogConfig.DEFAULTS;
        return new WatchdogConfig(
            optionalBoolean(node, section, "enabled", defaults.enabled()),
            intInRange(node, section, "maxRestarts", defaults.maxRestarts(), 0, 100),
            millisInRange(node, section, "restartDelay", defaults.restartDelay(), 1_000, 300_000),
            millisInRange(node, section, "cooldownPeriod", defaults.cooldownPeriod(), 60_000, 3_600_000),
            doubleInRange(node, section, "backoffMultiplier", defaults.backoffMultiplier(), 1.0D, 10.0D),
            millisInRange(node, section, "readinessTimeout", defaults.readinessTimeout(), 1_000, 3_600_000)
        );
    }

    private static RconManagerConfig readRcon(JsonNode node)
        throws IOException
    {
        final String section = "rcon";
        return new RconManagerConfig(
            optionalString(node, section, "host", RconManagerConfig.DEFAULT_HOST),
            intInRange(node, section, "port", RconManagerConfig.DEFAULT_PORT, 1024, 65_535),
            optionalString(node, section, "password", ""),
            millisInRange(node, section, "timeout", RconManagerConfig.DEFAULT_TIMEOUT, 1_000, 60_000),
            optionalBoolean(node, section, "enabled", false),
            optionalBoolean(node, section, "autoReconnect", false),
            millisInRange(
                node, section, "pollInterval", RconManagerConfig.DEFAULT_POLL_INTERVAL, 1_000, 3_600_000)
        );
    }

    private static Map<String, String> readEnvironment(JsonNode node)
        throws IOException
    {
        if (node.isMissingNode() || node.isNull())
            return Map.of();
        if (!node.isObject())
            throw new IOException("Field 'server.environment' must be an object.");

        final Map<String, String> environment = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext())
        {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual())
                throw new IOException("Field 'server.environment.%s' must be a string.".formatted(field.getKey()));
            environment.put(field.getKey(), field.getValue().asText());
        }
        return environment;
    }

    private static String qualified(String section, String field)
    {
        return section.isEmpty() ? field : section + "." + field;
    }

    private static @Nullable JsonNode field(JsonNode node, String field)
    {
        final JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value;
    }

    private static String optionalString(JsonNode node, String section, String field, String defaultValue)
        throws IOException
    {
        final @Nullable String value = optionalNullableString(node, section, field);
        return value == null ? defaultValue : value;
    }

    private static @Nullable String optionalNullableString(JsonNode node, String section, String field)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return null;
        if (!value.isTextual())
            throw new IOException("Field '%s' must be a string.".formatted(qualified(section, field)));
        return value.asText();
    }

    private static String boundedString(
        JsonNode node, String section, String field, String defaultValue, int minLength, int maxLength)
        throws IOException
    {
        final String value = optionalString(node, section, field, defaultValue);
        if (value.length() < minLength || value.length() > maxLength)
        {
            throw new IOException("Field '%s' must be between %d and %d characters long, got %d."
                .formatted(qualified(section, field), minLength, maxLength, value.length()));
        }
        return value;
    }

    private static boolean optionalBoolean(JsonNode node, String section, String field, boolean defaultValue)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return defaultValue;
        if (!value.isBoolean())
            throw new IOException("Field '%s' must be a boolean.".formatted(qualified(section, field)));
        return value.asBoolean();
    }

    private static @Nullable Integer optionalIntInRange(JsonNode node, String section, String field, int min, int max)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return null;
        return checkRange(section, field, value, min, max);
    }

    private static int intInRange(JsonNode node, String section, String field, int defaultValue, int min, int max)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return defaultValue;
        return checkRange(section, field, value, min, max);
    }

    private static int checkRange(String section, String field, JsonNode value, int min, int max)
        throws IOException
    {
        if (!value.canConvertToInt() || !value.isIntegralNumber())
            throw new IOException("Field '%s' must be an integer.".formatted(qualified(section, field)));
        final int result = value.asInt();
        if (result < min || result > max)
        {
            throw new IOException("Field '%s' must be between %d and %d, got %d."
                .formatted(qualified(section, field), min, max, result));
        }
        return result;
    }

    private static Duration millisInRange(
        JsonNode node, String section, String field, Duration defaultValue, int min, int max)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return defaultValue;
        return Duration.ofMillis(checkRange(section, field, value, min, max));
    }

    private static double doubleInRange(
        JsonNode node, String section, String field, double defaultValue, double min, double max)
        throws IOException
    {
        final @Nullable JsonNode value = field(node, field);
        if (value == null)
            return defaultValue;
        if (!value.isNumber())
            throw new IOException("Field '%s' must be a number.".formatted(qualified(section, field)));
        final double result = value.asDouble();
        if (result < min || result > max)
        {
            throw new IOException("Field '%s' must be between %s and %s, got %s."
                .formatted(qualified(section, field), min, max, result));
        }
        return result;
    }
}
