package nl.pim16aap2.valheimkeeper.server.process;

import java.nio.file.Path;

/**
 * Spawns server processes.
 */
@FunctionalInterface
public interface ServerProcessLauncher
{
    /**
     * Spawns a server.
     *
     * @param config
     *     The launch configuration.
     * @param logFile
     *     The log file the server should write to.
     * @return The running process.
     *
     * @throws ProcessSpawnFailedException
     *     When the process could not be started.
     */
    ServerProcess launch(ServerLaunchConfig config, Path logFile)
        throws ProcessSpawnFailedException;
}
