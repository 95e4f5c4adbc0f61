package taskgraph.coordinator.exec;

import taskgraph.coordinator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a task as an operating-system process.
 *
 * Command line: [interpreter] programPath parameters...
 * stdout and stderr are merged and appended to the task's output file.
 * The hook waits for the process; it never kills it.
 */
public class ProcessExecutorHook implements ExecutorHook {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutorHook.class);

    private final String interpreter;

    public ProcessExecutorHook() {
        this(null);
    }

    /**
     * @param interpreter program prepended to every command (e.g. "python3"), or null
     */
    public ProcessExecutorHook(String interpreter) {
        this.interpreter = interpreter != null && !interpreter.isBlank() ? interpreter.trim() : null;
    }

    @Override
    public ExecutionOutcome execute(Task task) throws IOException, InterruptedException {
        List<String> command = command(task);

        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (task.outputSink() != null) {
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(task.outputSink().toFile()));
        } else {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }

        long started = System.nanoTime();
        Process process = pb.start();
        log.debug("Task {} started as pid {}: {}", task.name(), process.pid(), command);

        int exitCode = process.waitFor();
        long runtimeMs = (System.nanoTime() - started) / 1_000_000;

        if (exitCode == 0) {
            log.info("Task {} exited normally in {}ms", task.name(), runtimeMs);
        } else {
            log.info("Task {} exited with code {} in {}ms (output: {})",
                    task.name(), exitCode, runtimeMs, task.outputSink());
        }
        return ExecutionOutcome.exited(exitCode, runtimeMs);
    }

    List<String> command(Task task) {
        List<String> command = new ArrayList<>(task.parameters().size() + 2);
        if (interpreter != null) {
            command.add(interpreter);
        }
        command.add(task.programPath());
        command.addAll(task.parameters());
        return command;
    }

    public String interpreter() {
        return interpreter;
    }
}
