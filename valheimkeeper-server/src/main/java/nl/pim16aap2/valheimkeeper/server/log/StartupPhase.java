package nl.pim16aap2.valheimkeeper.server.log;

/**
 * Progress of a server through its startup sequence.
 */
public enum StartupPhase
{
    IDLE,
    INITIALIZING,
    LOADING_WORLD,
    GENERATING_WORLD,
    CREATING_LOCATIONS,
    STARTING_SERVER,
    REGISTERING_LOBBY,
    READY,
}
