package nl.pim16aap2.valheimkeeper.server.bepinex;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses lines of the BepInEx log.
 * <p>
 * BepInEx writes lines as {@code [Level : Source] Message}, for example:
 * <pre>
 * [Info   :   BepInEx] BepInEx 5.4.22.0 - valheim
 * [Error  :Unity Log] NullReferenceException: ...
 * </pre>
 * Lines without that prefix (stack traces, for example) are attributed to BepInEx and their level is guessed from
 * their content.
 */
public final class BepInExLogParser
{
    static final String DEFAULT_SOURCE = "BepInEx";

    private static final Pattern PREFIXED_LINE = Pattern.compile("^\\[(\\w+)\\s*:\\s*([^\\]]+)\\]\\s*(.*)$");

    private BepInExLogParser()
    {
    }

    public static BepInExLogEntry parse(String line)
    {
        return parse(line, Instant.now());
    }

    public static BepInExLogEntry parse(String line, Instant timestamp)
    {
        final Matcher matcher = PREFIXED_LINE.matcher(line);
        if (matcher.matches())
        {
            return new BepInExLogEntry(
                timestamp, parseLevel(matcher.group(1)), matcher.group(2).trim(), matcher.group(3), line);
        }
        return new BepInExLogEntry(timestamp, detectLevel(line), DEFAULT_SOURCE, line.trim(), line);
    }

    static BepInExLogLevel parseLevel(String level)
    {
        return switch (level.toLowerCase(Locale.ROOT))
        {
            case "debug" -> BepInExLogLevel.DEBUG;
            case "warning", "warn" -> BepInExLogLevel.WARN;
            case "error" -> BepInExLogLevel.ERROR;
            case "fatal" -> BepInExLogLevel.FATAL;
            default -> BepInExLogLevel.INFO;
        };
    }

    private static BepInExLogLevel detectLevel(String line)
    {
        final String lowerCase = line.toLowerCase(Locale.ROOT);
        if (lowerCase.contains("error") || lowerCase.contains("exception"))
            return BepInExLogLevel.ERROR;
        if (lowerCase.contains("warn"))
            return BepInExLogLevel.WARN;
        if (lowerCase.contains("debug"))
            return BepInExLogLevel.DEBUG;
        return BepInExLogLevel.INFO;
    }
}
