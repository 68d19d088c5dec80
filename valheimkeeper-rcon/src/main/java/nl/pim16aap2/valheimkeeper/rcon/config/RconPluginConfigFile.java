package nl.pim16aap2.valheimkeeper.rcon.config;

import lombok.extern.java.Log;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes the INI file of the BepInEx RCON plugin.
 * <p>
 * The file lives at {@code <server>/BepInEx/config/nl.avii.plugins.rcon.cfg}.
 */
@Log
public final class RconPluginConfigFile
{
    public static final String FILE_NAME = "nl.avii.plugins.rcon.cfg";

    private RconPluginConfigFile()
    {
    }

    public static Path path(Path serverDirectory)
    {
        return serverDirectory.resolve("BepInEx").resolve("config").resolve(FILE_NAME);
    }

    public static boolean exists(Path serverDirectory)
    {
        return Files.isRegularFile(path(serverDirectory));
    }

    /**
     * Reads the plugin configuration of a server.
     *
     * @param serverDirectory
     *     The root directory of the Valheim server.
     * @return The configuration, or null if the plugin has not written its file yet.
     *
     * @throws IOException
     *     When the file exists but cannot be read.
     */
    public static @Nullable RconPluginConfig read(Path serverDirectory)
        throws IOException
    {
        final Path file = path(serverDirectory);
        try
        {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        }
        catch (NoSuchFileException exception)
        {
            log.fine(() -> "RCON plugin config '%s' does not exist.".formatted(file));
            return null;
        }
    }

    public static void write(RconPluginConfig config, Path serverDirectory)
        throws IOException
    {
        final Path file = path(serverDirectory);
        Files.createDirectories(file.getParent());
        Files.writeString(file, serialize(config), StandardCharsets.UTF_8);
        log.fine(() -> "Wrote RCON plugin config '%s'.".formatted(file));
    }

    /**
     * Parses the content of the INI file.
     * <p>
     * Keys are case-insensitive and the first {@code =} separates key and value. Comments, section headers, unknown
     * keys and lines without a separator are ignored. Missing settings and ports that are not a number between 1024
     * and 65535 keep their defaults.
     *
     * @param content
     *     The file content.
     * @return The parsed configuration.
     */
    public static RconPluginConfig parse(String content)
    {
        boolean enabled = RconPluginConfig.DEFAULTS.enabled();
        int port = RconPluginConfig.DEFAULTS.port();
        String password = RconPluginConfig.DEFAULTS.password();

        for (final String rawLine : content.split("\n"))
        {
            final String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";") || line.startsWith("["))
                continue;

            final int separator = line.indexOf('=');
            if (separator < 0)
                continue;

            final String key = line.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            final String value = line.substring(separator + 1).trim();
            switch (key)
            {
                case "enabled" -> enabled = "true".equalsIgnoreCase(value);
                case "port" -> port = parsePort(value, port);
                case "password" -> password = value;
                default -> log.finest(() -> "Ignoring unknown RCON plugin setting '%s'.".formatted(key));
            }
        }
        return new RconPluginConfig(enabled, port, password);
    }

    public static String serialize(RconPluginConfig config)
    {
        return """
            ## Settings file was created by ValheimKeeper

            [rcon]

            ## Enable RCON Communication
            # Setting type: Boolean
            # Default value: true
            enabled = %s

            ## Port to use for RCON Communication
            # Setting type: Int32
            # Default value: %d
            port = %d

            ## Password to use for RCON Communication
            # Setting type: String
            # Default value: %s
            password = %s
            """.formatted(
            config.enabled(),
            RconPluginConfig.DEFAULT_PORT,
            config.port(),
            RconPluginConfig.DEFAULT_PASSWORD,
            config.password()
        );
    }

    private static int parsePort(String value, int fallback)
    {
        try
        {
            final int port = Integer.parseInt(value);
            if (RconPluginConfig.isValidPort(port))
                return port;
            log.fine(() -> "Ignoring out-of-range RCON plugin port " + port + ".");
        }
        catch (NumberFormatException exception)
        {
            log.fine(() -> "Ignoring non-numeric RCON plugin port '%s'.".formatted(value));
        }
        return fallback;
    }
}
