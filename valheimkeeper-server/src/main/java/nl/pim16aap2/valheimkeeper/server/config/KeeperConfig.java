package nl.pim16aap2.valheimkeeper.server.config;

import nl.pim16aap2.valheimkeeper.rcon.RconManagerConfig;
import nl.pim16aap2.valheimkeeper.server.process.ServerLaunchConfig;
import nl.pim16aap2.valheimkeeper.server.watchdog.WatchdogConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Complete configuration of a supervised server.
 *
 * @param server
 *     How to launch the server.
 * @param watchdog
 *     The restart policy.
 * @param rcon
 *     How to reach the server's RCON plugin.
 * @param stateDirectory
 *     Where the process record and the server logs are kept.
 */
public record KeeperConfig(
    ServerLaunchConfig server,
    WatchdogConfig watchdog,
    RconManagerConfig rcon,
    Path stateDirectory)
{
    public KeeperConfig
    {
        Objects.requireNonNull(server, "server may not be null.");
        Objects.requireNonNull(watchdog, "watchdog may not be null.");
        Objects.requireNonNull(rcon, "rcon may not be null.");
        Objects.requireNonNull(stateDirectory, "stateDirectory may not be null.");
    }

    public Path processRecordFile()
    {
        return stateDirectory.resolve("server.pid");
    }

    public Path logDirectory()
    {
        return stateDirectory.resolve("logs");
    }
}
