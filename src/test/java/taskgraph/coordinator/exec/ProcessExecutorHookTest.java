package taskgraph.coordinator.exec;

import taskgraph.coordinator.model.Task;
import taskgraph.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessExecutorHookTest {

    @TempDir
    Path dir;

    private static Task task(String program, List<String> params, Path sink) {
        return Task.builder()
                .name("job")
                .programPath(program)
                .parameters(params)
                .scheduledTime(0)
                .outputSink(sink)
                .status(TaskStatus.RUNNING)
                .build();
    }

    @Test
    void commandIsProgramThenParameters() {
        ProcessExecutorHook hook = new ProcessExecutorHook();

        assertEquals(List.of("/opt/run.sh", "--day", "mon"),
                hook.command(task("/opt/run.sh", List.of("--day", "mon"), null)));
        assertNull(hook.interpreter());
    }

    @Test
    void interpreterIsPrepended() {
        ProcessExecutorHook hook = new ProcessExecutorHook(" python3 ");

        assertEquals("python3", hook.interpreter());
        assertEquals(List.of("python3", "etl.py", "-v"), hook.command(task("etl.py", List.of("-v"), null)));
    }

    @Test
    void blankInterpreterMeansNone() {
        assertNull(new ProcessExecutorHook("  ").interpreter());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void mergesOutputAndReportsExitCode() throws Exception {
        Path sink = dir.resolve("job.out");
        ProcessExecutorHook hook = new ProcessExecutorHook();

        ExecutionOutcome outcome = hook.execute(
                task("/bin/sh", List.of("-c", "echo out; echo err 1>&2; exit 3"), sink));

        assertEquals(3, outcome.exitCode());
        assertNull(outcome.error());
        assertFalse(outcome.succeeded());
        String output = Files.readString(sink, StandardCharsets.UTF_8);
        assertTrue(output.contains("out"));
        assertTrue(output.contains("err"));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void appendsAcrossRuns() throws Exception {
        Path sink = dir.resolve("job.out");
        ProcessExecutorHook hook = new ProcessExecutorHook();

        hook.execute(task("/bin/sh", List.of("-c", "echo first"), sink));
        ExecutionOutcome second = hook.execute(task("/bin/sh", List.of("-c", "echo second"), sink));

        assertTrue(second.succeeded());
        assertEquals(List.of("first", "second"), Files.readAllLines(sink, StandardCharsets.UTF_8));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void interpreterRunsTheProgram() throws Exception {
        Path script = Files.writeString(dir.resolve("hello.sh"), "echo hello \"$1\"\n");
        Path sink = dir.resolve("hello.out");

        ExecutionOutcome outcome = new ProcessExecutorHook("/bin/sh")
                .execute(task(script.toString(), List.of("world"), sink));

        assertTrue(outcome.succeeded());
        assertEquals("hello world", Files.readString(sink).trim());
    }

    @Test
    void missingProgramFailsToStart() {
        ProcessExecutorHook hook = new ProcessExecutorHook();

        assertThrows(IOException.class,
                () -> hook.execute(task(dir.resolve("no-such-program").toString(), List.of(), null)));
    }
}
