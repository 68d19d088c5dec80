package nl.pim16aap2.valheimkeeper.server.log;

/**
 * Severity of a line in the server log, as derived from its content.
 */
public enum ServerLogLevel
{
    DEBUG,
    INFO,
    WARN,
    ERROR,
}
