package nl.pim16aap2.valheimkeeper.server.process;

/**
 * Lifecycle state of the supervised server process.
 */
public enum ProcessState
{
    /**
     * No process is running.
     */
    OFFLINE,

    /**
     * The process was spawned but has not reported that it accepts players yet.
     */
    STARTING,

    ONLINE,

    /**
     * The process exited without being asked to. A restart may be pending.
     */
    CRASHED,

    STOPPING,
}
