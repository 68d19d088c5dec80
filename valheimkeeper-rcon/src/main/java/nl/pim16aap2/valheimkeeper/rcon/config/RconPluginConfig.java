package nl.pim16aap2.valheimkeeper.rcon.config;

import java.util.Objects;

/**
 * Settings of the BepInEx RCON plugin that runs inside the Valheim server.
 *
 * @param enabled
 *     Whether the plugin accepts RCON connections.
 * @param port
 *     The TCP port the plugin listens on.
 * @param password
 *     The password clients have to authenticate with. May be empty.
 */
public record RconPluginConfig(boolean enabled, int port, String password)
{
    public static final int DEFAULT_PORT = 2458;
    public static final String DEFAULT_PASSWORD = "ChangeMe";
    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65_535;

    /**
     * The configuration the plugin generates on first start.
     */
    public static final RconPluginConfig DEFAULTS = new RconPluginConfig(true, DEFAULT_PORT, DEFAULT_PASSWORD);

    public RconPluginConfig
    {
        Objects.requireNonNull(password, "password may not be null.");
        if (!isValidPort(port))
            throw new IllegalArgumentException(
                "Port must be between %d and %d, got %d.".formatted(MIN_PORT, MAX_PORT, port));
    }

    public static boolean isValidPort(int port)
    {
        return port >= MIN_PORT && port <= MAX_PORT;
    }

    public RconPluginConfig withEnabled(boolean enabled)
    {
        return new RconPluginConfig(enabled, port, password);
    }

    public RconPluginConfig withPort(int port)
    {
        return new RconPluginConfig(enabled, port, password);
    }

    public RconPluginConfig withPassword(String password)
    {
        return new RconPluginConfig(enabled, port, password);
    }

    @Override
    public String toString()
    {
        return "RconPluginConfig[enabled=%s, port=%d]".formatted(enabled, port);
    }
}
