package nl.pim16aap2.valheimkeeper.server;

import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;

/**
 * Creates the scheduler of a single component.
 */
@FunctionalInterface
public interface TaskSchedulerFactory
{
    /**
     * @param name
     *     The name of the component, for example for naming threads.
     * @return A new scheduler.
     */
    TaskScheduler create(String name);
}
