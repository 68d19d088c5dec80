package nl.pim16aap2.valheimkeeper.server;

import dagger.Module;
import dagger.Provides;
import nl.pim16aap2.valheimkeeper.rcon.RconManager;
import nl.pim16aap2.valheimkeeper.runtime.ProcessRecordStore;
import nl.pim16aap2.valheimkeeper.runtime.scheduling.TaskScheduler;
import nl.pim16aap2.valheimkeeper.server.bepinex.BepInExLogMonitor;
import nl.pim16aap2.valheimkeeper.server.config.KeeperConfig;
import nl.pim16aap2.valheimkeeper.server.log.LogBuffer;
import nl.pim16aap2.valheimkeeper.server.process.ServerProcessLauncher;
import nl.pim16aap2.valheimkeeper.server.watchdog.Watchdog;

import javax.inject.Named;
import javax.inject.Singleton;

@Module
final class SupervisorModule
{
    static final String WATCHDOG = "watchdog";
    static final String RCON = "rcon";
    static final String BEPINEX = "bepinex";

    private SupervisorModule()
    {
    }

    @Provides
    @Singleton
    @Named(WATCHDOG)
    static TaskScheduler watchdogScheduler(TaskSchedulerFactory schedulerFactory)
    {
        return schedulerFactory.create("valheimkeeper-watchdog");
    }

    @Provides
    @Singleton
    @Named(RCON)
    static TaskScheduler rconScheduler(TaskSchedulerFactory schedulerFactory)
    {
        return schedulerFactory.create("valheimkeeper-rcon");
    }

    @Provides
    @Singleton
    @Named(BEPINEX)
    static TaskScheduler bepInExScheduler(TaskSchedulerFactory schedulerFactory)
    {
        return schedulerFactory.create("valheimkeeper-bepinex");
    }

    @Provides
    @Singleton
    static ProcessRecordStore processRecordStore(KeeperConfig config)
    {
        return new ProcessRecordStore(config.processRecordFile());
    }

    @Provides
    @Singleton
    static RconManager rconManager(@Named(RCON) TaskScheduler scheduler)
    {
        return new RconManager(scheduler);
    }

    @Provides
    @Singleton
    static Watchdog watchdog(
        KeeperConfig config,
        ServerProcessLauncher launcher,
        @Named(WATCHDOG) TaskScheduler scheduler,
        ProcessRecordStore processRecordStore,
        RconManager rconManager)
    {
        return new Watchdog(
            config.server(),
            config.watchdog(),
            launcher,
            scheduler,
            processRecordStore,
            config.rcon().enabled() ? rconManager : null,
            config.logDirectory()
        );
    }

    @Provides
    @Singleton
    static BepInExLogMonitor bepInExLogMonitor(@Named(BEPINEX) TaskScheduler scheduler)
    {
        return new BepInExLogMonitor(scheduler);
    }

    @Provides
    @Singleton
    static LogBuffer logBuffer()
    {
        return new LogBuffer();
    }
}
