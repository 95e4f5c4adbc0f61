package taskgraph.coordinator.config;

import taskgraph.coordinator.error.InvalidConfigurationException;
import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.exec.ProcessExecutorHook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    @TempDir
    Path dir;

    @Test
    void wiresProcessExecutorWithConfiguredInterpreter() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withOutputDirectory(dir)
                .withInterpreter("python3");

        try (Dependencies deps = Dependencies.create(config)) {
            ProcessExecutorHook hook = assertInstanceOf(ProcessExecutorHook.class, deps.executorHook());
            assertEquals("python3", hook.interpreter());
            assertEquals(dir.toAbsolutePath().normalize(), deps.outputSinks().directory());
            assertTrue(deps.orchestrator().isRunning());
            assertSame(deps.routerHandler(), deps.routerHandler());
        }
    }

    @Test
    void customHookIsUsed() {
        CoordinatorConfig config = CoordinatorConfig.defaults().withOutputDirectory(dir);

        Dependencies deps = Dependencies.create(config, task -> ExecutionOutcome.exited(0, 0));
        assertFalse(deps.executorHook() instanceof ProcessExecutorHook);

        deps.close();
        assertFalse(deps.orchestrator().isRunning());
    }

    @Test
    void unusableOutputDirectoryFailsFast() {
        CoordinatorConfig config = CoordinatorConfig.defaults().withOutputDirectory(dir.resolve("missing"));

        assertThrows(InvalidConfigurationException.class, () -> Dependencies.create(config));
    }
}
