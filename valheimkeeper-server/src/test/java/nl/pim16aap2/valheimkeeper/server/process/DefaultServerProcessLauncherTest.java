package nl.pim16aap2.valheimkeeper.server.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultServerProcessLauncherTest
{
    @Test
    void launch_shouldThrowExceptionWhenExecutableDoesNotExist(@TempDir Path tempDirectory)
    {
        // setup
        final Path executable = tempDirectory.resolve("valheim_server.x86_64");
        final ServerLaunchConfig config =
            new ServerLaunchConfig(executable, tempDirectory, "My Server", 2456, "Midgard", "secret");
        final DefaultServerProcessLauncher launcher = new DefaultServerProcessLauncher(true);

        // execute
        final var thrown = assertThatThrownBy(() -> launcher.launch(config, tempDirectory.resolve("server.log")));

        // verify
        thrown
            .isInstanceOf(ProcessSpawnFailedException.class)
            .hasMessageContaining("does not exist");
    }
}
