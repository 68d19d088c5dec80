package nl.pim16aap2.valheimkeeper.server.log;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses lines of the Valheim server log.
 */
public final class ServerLogParser
{
    private static final Pattern TIMESTAMP_PREFIX =
        Pattern.compile("^(\\d{2}/\\d{2}/\\d{4} \\d{2}:\\d{2}:\\d{2}): (.+)$");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss");

    private static final Pattern CHARACTER_ZDOID =
        Pattern.compile("Got character ZDOID from (.+?) : (-?\\d+):(\\d+)");
    private static final Pattern CHARACTER_ZDOID_NAME = Pattern.compile("Got character ZDOID from (\\S+)");
    private static final Pattern CONNECTION_STEAM_ID = Pattern.compile("Got connection SteamID (\\d+)");
    private static final Pattern CLOSING_SOCKET = Pattern.compile("Closing socket (\\d+)");

    private ServerLogParser()
    {
    }

    public static ServerLogEntry parseLogLine(String line)
    {
        return parseLogLine(line, Instant.now());
    }

    /**
     * Parses a line into an entry.
     *
     * @param line
     *     The raw line.
     * @param fallbackTimestamp
     *     The timestamp to use when the line does not start with one.
     * @return The parsed entry.
     */
    public static ServerLogEntry parseLogLine(String line, Instant fallbackTimestamp)
    {
        Instant timestamp = fallbackTimestamp;
        String message = line.trim();

        final Matcher matcher = TIMESTAMP_PREFIX.matcher(message);
        if (matcher.matches())
        {
            message = matcher.group(2);
            timestamp = parseTimestamp(matcher.group(1), fallbackTimestamp);
        }

        return new ServerLogEntry(timestamp, detectLevel(line), message, line);
    }

    /**
     * Detects an event in a line.
     *
     * @param line
     *     The raw line.
     * @return The detected event, or null if the line does not describe one.
     */
    public static @Nullable ServerEvent parseEvent(String line)
    {
        if (line.contains("Got character ZDOID from"))
            return parseCharacterZdoid(line);

        if (line.contains("Got connection SteamID"))
        {
            final Matcher matcher = CONNECTION_STEAM_ID.matcher(line);
            return matcher.find() ? new ServerEvent.PlayerConnecting(matcher.group(1)) : null;
        }

        if (line.contains("Closing socket"))
        {
            final Matcher matcher = CLOSING_SOCKET.matcher(line);
            return matcher.find() ? new ServerEvent.PlayerDisconnected(matcher.group(1)) : null;
        }

        if (line.contains("World saved"))
            return new ServerEvent.WorldSaved();

        if (line.contains("Done generating locations"))
            return new ServerEvent.WorldGenerated();

        final @Nullable StartupPhase phase = detectStartupPhase(line);
        if (phase != null)
            return new ServerEvent.StartupPhaseChanged(phase);

        if (line.contains("Game server connected"))
            return new ServerEvent.ServerReady();

        if (line.contains("OnApplicationQuit"))
            return new ServerEvent.ServerShutdown();

        if (line.contains("Error!") || line.contains("FAILED") || line.contains("Exception:"))
            return new ServerEvent.ErrorLogged(line.trim());

        return null;
    }

    static ServerLogLevel detectLevel(String line)
    {
        if (line.contains("Error") || line.contains("Exception"))
            return ServerLogLevel.ERROR;
        if (line.contains("Warning") || line.contains("WARN"))
            return ServerLogLevel.WARN;
        if (line.contains("DEBUG") || line.contains("[Debug]"))
            return ServerLogLevel.DEBUG;
        return ServerLogLevel.INFO;
    }

    private static @Nullable StartupPhase detectStartupPhase(String line)
    {
        if (line.contains("DungeonDB Start"))
            return StartupPhase.INITIALIZING;
        if (line.contains("Load world") || line.contains("Loading world"))
            return StartupPhase.LOADING_WORLD;
        if (line.contains("Generating locations"))
            return StartupPhase.GENERATING_WORLD;
        if (line.contains("Failed to place all") || line.contains("Placing locations"))
            return StartupPhase.CREATING_LOCATIONS;
        if (line.contains("ZDOMan") || line.contains("Zonesystem Start"))
            return StartupPhase.STARTING_SERVER;
        if (line.contains("Registering lobby"))
            return StartupPhase.REGISTERING_LOBBY;
        return null;
    }

    private static @Nullable ServerEvent parseCharacterZdoid(String line)
    {
        final Matcher matcher = CHARACTER_ZDOID.matcher(line);
        if (matcher.find())
        {
            // A ZDOID of 0:0 is logged when a character dies.
            if ("0".equals(matcher.group(2)) && "0".equals(matcher.group(3)))
                return null;
            return new ServerEvent.PlayerJoined(matcher.group(1).trim());
        }

        final Matcher fallback = CHARACTER_ZDOID_NAME.matcher(line);
        return fallback.find() ? new ServerEvent.PlayerJoined(fallback.group(1)) : null;
    }

    private static Instant parseTimestamp(String text, Instant fallback)
    {
        try
        {
            return LocalDateTime.parse(text, TIMESTAMP_FORMAT).atZone(ZoneId.systemDefault()).toInstant();
        }
        catch (DateTimeParseException exception)
        {
            return fallback;
        }
    }
}
