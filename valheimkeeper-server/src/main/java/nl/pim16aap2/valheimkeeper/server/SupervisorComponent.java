package nl.pim16aap2.valheimkeeper.server;

import dagger.BindsInstance;
import dagger.Component;
import nl.pim16aap2.valheimkeeper.server.config.KeeperConfig;
import nl.pim16aap2.valheimkeeper.server.process.ServerProcessLauncher;

import javax.inject.Singleton;

/**
 * Dagger component wiring the supervisor of one server.
 */
@Singleton
@Component(modules = SupervisorModule.class)
public interface SupervisorComponent
{
    ServerSupervisor supervisor();

    @Component.Factory
    interface Factory
    {
        SupervisorComponent create(
            @BindsInstance KeeperConfig config,
            @BindsInstance ServerProcessLauncher launcher,
            @BindsInstance TaskSchedulerFactory schedulerFactory
        );
    }
}
