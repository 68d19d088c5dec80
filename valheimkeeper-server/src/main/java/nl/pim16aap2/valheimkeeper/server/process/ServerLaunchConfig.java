package nl.pim16aap2.valheimkeeper.server.process;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes how to launch the dedicated server.
 *
 * @param executable
 *     The server executable.
 * @param workingDirectory
 *     The directory the server runs in.
 * @param name
 *     The name under which the server is listed.
 * @param port
 *     The game port.
 * @param world
 *     The name of the world to load or create.
 * @param password
 *     The password players need to join.
 * @param publicServer
 *     Whether the server is listed in the public server browser.
 * @param crossplay
 *     Whether crossplay is enabled.
 * @param saveDirectory
 *     Where worlds are saved, or null for the server's default.
 * @param logFile
 *     The log file the server writes to, or null to pick one per launch.
 * @param saveInterval
 *     Seconds between world saves, or null for the server's default.
 * @param backups
 *     Number of world backups to keep, or null for the server's default.
 * @param environment
 *     Extra environment variables for the process.
 */
public record ServerLaunchConfig(
    Path executable,
    Path workingDirectory,
    String name,
    int port,
    String world,
    String password,
    boolean publicServer,
    boolean crossplay,
    @Nullable Path saveDirectory,
    @Nullable Path logFile,
    @Nullable Integer saveInterval,
    @Nullable Integer backups,
    Map<String, String> environment)
{
    /**
     * Steam app id of the game itself. The dedicated server needs it to initialize Steam.
     */
    public static final String STEAM_APP_ID = "892970";

    public static final int DEFAULT_PORT = 2456;

    public ServerLaunchConfig
    {
        Objects.requireNonNull(executable, "executable may not be null.");
        Objects.requireNonNull(workingDirectory, "workingDirectory may not be null.");
        Objects.requireNonNull(name, "name may not be null.");
        Objects.requireNonNull(world, "world may not be null.");
        Objects.requireNonNull(password, "password may not be null.");
        if (port < 1 || port > 65_535)
            throw new IllegalArgumentException("Port must be between 1 and 65535, got " + port + ".");
        environment = Map.copyOf(Objects.requireNonNullElse(environment, Map.of()));
    }

    public ServerLaunchConfig(
        Path executable, Path workingDirectory, String name, int port, String world, String password)
    {
        this(
            executable, workingDirectory, name, port, world, password,
            false, false, null, null, null, null, Map.of()
        );
    }

    public ServerLaunchConfig withLogFile(@Nullable Path logFile)
    {
        return new ServerLaunchConfig(
            executable, workingDirectory, name, port, world, password, publicServer, crossplay,
            saveDirectory, logFile, saveInterval, backups, environment
        );
    }

    /**
     * Builds the command line arguments of the server.
     *
     * @param effectiveLogFile
     *     The log file the server should write to.
     * @return The arguments, excluding the executable.
     */
    public List<String> arguments(Path effectiveLogFile)
    {
        final List<String> arguments = new ArrayList<>(List.of(
            "-nographics",
            "-batchmode",
            "-name", name,
            "-port", Integer.toString(port),
            "-world", world,
            "-password", password,
            "-public", publicServer ? "1" : "0"
        ));

        if (crossplay)
            arguments.add("-crossplay");
        if (saveDirectory != null)
            arguments.addAll(List.of("-savedir", saveDirectory.toString()));
        arguments.addAll(List.of("-logFile", effectiveLogFile.toString()));
        if (saveInterval != null && saveInterval > 0)
            arguments.addAll(List.of("-saveinterval", saveInterval.toString()));
        if (backups != null && backups > 0)
            arguments.addAll(List.of("-backups", backups.toString()));
        return arguments;
    }

    /**
     * Builds the environment of the server process.
     *
     * @param base
     *     The environment to start from, usually that of the current process.
     * @param linux
     *     Whether the server runs on Linux, where it needs its bundled Steam libraries on the library path.
     * @return The environment.
     */
    public Map<String, String> environment(Map<String, String> base, boolean linux)
    {
        final Map<String, String> result = new HashMap<>(base);
        if (linux)
        {
            final @Nullable Path parent = executable.toAbsolutePath().getParent();
            final String libraryDirectory = (parent == null ? Path.of("linux64") : parent.resolve("linux64")).toString();
            final @Nullable String current = base.get("LD_LIBRARY_PATH");
            result.put(
                "LD_LIBRARY_PATH",
                current == null || current.isBlank() ? libraryDirectory : libraryDirectory + ":" + current
            );
        }
        result.put("SteamAppId", STEAM_APP_ID);
        result.putAll(environment);
        return result;
    }
}
