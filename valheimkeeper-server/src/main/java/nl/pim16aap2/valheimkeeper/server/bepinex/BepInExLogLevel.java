package nl.pim16aap2.valheimkeeper.server.bepinex;

public enum BepInExLogLevel
{
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL,
}
