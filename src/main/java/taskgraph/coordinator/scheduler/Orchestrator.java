package taskgraph.coordinator.scheduler;

import taskgraph.coordinator.error.DuplicateTaskException;
import taskgraph.coordinator.error.OrderingViolationException;
import taskgraph.coordinator.error.UnknownTaskException;
import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.exec.ExecutorHook;
import taskgraph.coordinator.exec.OutputSinkProvider;
import taskgraph.coordinator.graph.TaskGraph;
import taskgraph.coordinator.graph.TaskNode;
import taskgraph.coordinator.model.Task;
import taskgraph.coordinator.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dependency-aware scheduler for external programs.
 *
 * <p>
 * A single scheduler thread owns the {@link TaskGraph}. Admission, cancellation,
 * completion, inspection and every per-task timer run as jobs on that thread, so
 * graph mutations are serialized and a timer can never fire in the middle of a
 * cancel. Programs run on separate runner threads; when one exits, its completion
 * is posted back to the scheduler thread.
 *
 * <p>
 * State is held in memory only and is lost on shutdown.
 *
 * Usage:
 *
 * <pre>
 * Orchestrator orch = new Orchestrator(new ProcessExecutorHook(), new DirectoryOutputSinks(dir));
 * orch.schedule("extract", "/opt/jobs/extract.py", now + 60_000, null, null);
 * orch.schedule("load", "/opt/jobs/load.py", now + 120_000, List.of("extract"), List.of("--full"));
 * orch.cancel("extract"); // "load" no longer waits and is armed
 * </pre>
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final TaskGraph graph = new TaskGraph();
    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService runners;
    private final ExecutorHook hook;
    private final OutputSinkProvider outputSinks;
    private final Clock clock;
    private final Duration shutdownTimeout;
    private final TaskEventBus events = new TaskEventBus();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Thread schedulerThread;

    public Orchestrator(ExecutorHook hook, OutputSinkProvider outputSinks) {
        this(hook, outputSinks, Clock.systemUTC(), Duration.ofSeconds(5));
    }

    /**
     * @param hook            runs task programs
     * @param outputSinks     allocates each task's output destination
     * @param clock           source of "now" for default times and timer delays
     * @param shutdownTimeout how long {@link #close()} waits for the scheduler thread
     */
    public Orchestrator(ExecutorHook hook, OutputSinkProvider outputSinks, Clock clock, Duration shutdownTimeout) {
        this.hook = Objects.requireNonNull(hook, "hook is required");
        this.outputSinks = Objects.requireNonNull(outputSinks, "outputSinks is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout is required");

        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "taskgraph-scheduler");
            t.setDaemon(true);
            schedulerThread = t;
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        AtomicInteger runnerIds = new AtomicInteger(1);
        this.runners = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskgraph-runner-" + runnerIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------- admission

    /**
     * Schedule a task to run now, with no dependencies or parameters.
     */
    public long schedule(String name, String programPath) {
        return schedule(name, programPath, null, null, null);
    }

    /**
     * Schedule a task. It runs no earlier than {@code scheduledTime} and only after
     * every dependency still in the graph has finished.
     *
     * @param name          unique task name
     * @param programPath   program to execute
     * @param scheduledTime epoch millis; null means now
     * @param dependsOn     names of prerequisite tasks; names not in the graph are ignored
     * @param parameters    program arguments, in order
     * @return milliseconds until the intended run time, never negative
     * @throws DuplicateTaskException      if the name is already scheduled
     * @throws OrderingViolationException  if a dependency is scheduled after this task
     * @throws IllegalArgumentException    for a blank name or program path
     */
    public long schedule(String name, String programPath, Long scheduledTime,
            Collection<String> dependsOn, List<String> parameters) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (programPath == null || programPath.isBlank()) {
            throw new IllegalArgumentException("programPath is required");
        }
        List<String> deps = copyNames(dependsOn, "dependsOn");
        List<String> params = copyNames(parameters, "parameters");

        return call(() -> admit(name, programPath, scheduledTime, deps, params));
    }

    private long admit(String name, String programPath, Long scheduledTime, List<String> dependsOn,
            List<String> parameters) {
        if (graph.contains(name)) {
            throw new DuplicateTaskException(name);
        }

        long now = clock.millis();
        long runAt = scheduledTime != null ? scheduledTime : now;

        // Validate everything before touching the graph
        Set<String> upstream = new LinkedHashSet<>();
        for (String dependency : dependsOn) {
            TaskNode dep = graph.get(dependency);
            if (dep == null) {
                log.debug("Task {}: ignoring dependency {} (not scheduled)", name, dependency);
                continue;
            }
            if (dep.scheduledTime() > runAt) {
                throw new OrderingViolationException(name, runAt, dependency, dep.scheduledTime());
            }
            upstream.add(dependency);
        }

        Path sink = outputSinks.allocate(name);
        TaskNode node = new TaskNode(name, programPath, parameters, runAt, sink, clock.instant());
        graph.insert(node);
        for (String dependency : upstream) {
            graph.link(dependency, name);
        }

        long waitMs = waitMs(runAt, now);
        log.info("Scheduled task {} at {} (in {}ms), waiting on {}", name, runAt, waitMs, upstream);
        events.fireAdmitted(node.snapshot());

        // a listener may already have cancelled it
        if (node.isReady()) {
            arm(node);
        }
        return waitMs;
    }

    // ------------------------------------------------------------- cancellation

    /**
     * Remove a task from the graph. Tasks that only waited on it are armed.
     * A task whose program is already running stays running; it is only unlinked.
     *
     * @return the task as it was when cancelled
     * @throws UnknownTaskException if no such task is scheduled
     */
    public Task cancel(String name) {
        Objects.requireNonNull(name, "name is required");
        return call(() -> {
            TaskNode node = graph.get(name);
            if (node == null) {
                throw new UnknownTaskException(name);
            }
            stopTimer(node);
            Task record = node.snapshot(TaskStatus.CANCELLED);
            List<TaskNode> freed = unlink(node, TaskStatus.CANCELLED);
            for (TaskNode dependent : freed) {
                arm(dependent);
            }
            log.info("Cancelled task {}; released {}", name, names(freed));
            events.fireCancelled(record);
            return record;
        });
    }

    /**
     * Cancel a task together with every task that directly or transitively depends on it.
     *
     * @return cancelled tasks, the named task first, then dependents breadth-first
     * @throws UnknownTaskException if no such task is scheduled
     */
    public List<Task> cancelWithDependents(String name) {
        Objects.requireNonNull(name, "name is required");
        return call(() -> {
            TaskNode root = graph.get(name);
            if (root == null) {
                throw new UnknownTaskException(name);
            }

            Map<String, TaskNode> doomed = new LinkedHashMap<>();
            Deque<TaskNode> queue = new ArrayDeque<>();
            queue.add(root);
            doomed.put(root.name(), root);
            while (!queue.isEmpty()) {
                TaskNode current = queue.poll();
                for (String dependent : current.dependents()) {
                    TaskNode next = graph.get(dependent);
                    if (next != null && doomed.putIfAbsent(dependent, next) == null) {
                        queue.add(next);
                    }
                }
            }

            // Records reflect the graph before any edge is dropped
            List<Task> records = new ArrayList<>(doomed.size());
            for (TaskNode node : doomed.values()) {
                records.add(node.snapshot(TaskStatus.CANCELLED));
            }

            List<TaskNode> freed = new ArrayList<>();
            for (TaskNode node : doomed.values()) {
                stopTimer(node);
                freed.addAll(unlink(node, TaskStatus.CANCELLED));
            }
            for (TaskNode dependent : freed) {
                if (!doomed.containsKey(dependent.name())) {
                    arm(dependent);
                }
            }

            log.info("Cancelled task {} with {} dependent(s): {}", name, doomed.size() - 1, doomed.keySet());
            records.forEach(events::fireCancelled);
            return List.copyOf(records);
        });
    }

    private void stopTimer(TaskNode node) {
        if (node.status() == TaskStatus.ARMED) {
            // Timers run on this thread, so an ARMED task's timer has not fired yet
            node.disarm();
        } else if (node.status() == TaskStatus.RUNNING) {
            log.warn("Task {} is already running; its program will not be stopped", node.name());
        }
    }

    // ----------------------------------------------------------------- dispatch

    private void arm(TaskNode node) {
        if (graph.get(node.name()) != node || node.status() != TaskStatus.PENDING) {
            log.debug("Not arming task {}: no longer pending", node.name());
            return;
        }
        long delayMs = waitMs(node.scheduledTime(), clock.millis());
        node.status(TaskStatus.ARMED);
        node.timer(scheduler.schedule(() -> fire(node), delayMs, TimeUnit.MILLISECONDS));
        log.debug("Armed task {} to fire in {}ms", node.name(), delayMs);
        events.fireArmed(node.snapshot(), delayMs);
    }

    private void fire(TaskNode node) {
        if (graph.get(node.name()) != node || node.status() != TaskStatus.ARMED) {
            log.debug("Ignoring stale timer for task {}", node.name());
            return;
        }
        node.timer(null);
        node.status(TaskStatus.RUNNING);
        Task running = node.snapshot();
        log.info("Dispatching task {}: {} {}", node.name(), node.programPath(), node.parameters());
        events.fireDispatched(running);

        try {
            runners.execute(() -> run(node, running));
        } catch (RejectedExecutionException e) {
            log.warn("Task {} not started: orchestrator is shutting down", node.name());
        }
    }

    private void run(TaskNode node, Task task) {
        long started = System.nanoTime();
        ExecutionOutcome outcome = null;
        try {
            outcome = hook.execute(task);
            if (outcome == null) {
                outcome = ExecutionOutcome.failed("executor returned no outcome", elapsedMs(started));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = ExecutionOutcome.failed("interrupted", elapsedMs(started));
        } catch (IOException | RuntimeException e) {
            log.error("Executor failed for task {}", task.name(), e);
            outcome = ExecutionOutcome.failed(e.toString(), elapsedMs(started));
        } catch (Error e) {
            log.error("Executor crashed for task {}", task.name(), e);
            outcome = ExecutionOutcome.failed(e.toString(), elapsedMs(started));
            throw e;
        } finally {
            // Dependents are released whatever the hook did
            postCompletion(node, task, outcome);
        }
    }

    private void postCompletion(TaskNode node, Task task, ExecutionOutcome outcome) {
        // null only when the hook threw an undeclared checked exception
        ExecutionOutcome result = outcome != null ? outcome : ExecutionOutcome.failed("executor aborted", 0);
        try {
            scheduler.execute(() -> complete(node, result));
        } catch (RejectedExecutionException e) {
            log.warn("Task {} finished after shutdown; completion dropped", task.name());
        }
    }

    private void complete(TaskNode node, ExecutionOutcome outcome) {
        if (graph.get(node.name()) != node) {
            log.warn("Task {} finished after it was cancelled; nothing to release", node.name());
            return;
        }
        Task record = node.snapshot(TaskStatus.DONE);
        List<TaskNode> freed = unlink(node, TaskStatus.DONE);
        for (TaskNode dependent : freed) {
            arm(dependent);
        }
        log.info("Task {} done (exit {}, {}ms); released {}",
                node.name(), outcome.exitCode(), outcome.runtimeMs(), names(freed));
        events.fireCompleted(record, outcome);
    }

    /**
     * Drop every edge touching the node, then remove it.
     * Shared by completion and cancellation.
     *
     * @return dependents left with no outstanding dependency
     */
    private List<TaskNode> unlink(TaskNode node, TaskStatus terminal) {
        List<TaskNode> freed = new ArrayList<>();
        for (String dependent : List.copyOf(node.dependents())) {
            if (graph.unlink(node.name(), dependent)) {
                freed.add(graph.get(dependent));
            }
        }
        for (String dependency : List.copyOf(node.dependsOn())) {
            graph.unlink(dependency, node.name());
        }
        graph.remove(node.name());
        node.status(terminal);
        return freed;
    }

    // --------------------------------------------------------------- inspection

    /**
     * Current state of a scheduled task.
     */
    public Optional<Task> find(String name) {
        Objects.requireNonNull(name, "name is required");
        return call(() -> graph.find(name).map(TaskNode::snapshot));
    }

    /**
     * All scheduled tasks, sorted by name.
     */
    public List<Task> snapshot() {
        return call(() -> graph.nodes().stream()
                .map(TaskNode::snapshot)
                .sorted(Comparator.comparing(Task::name))
                .toList());
    }

    public int size() {
        return call(graph::size);
    }

    /**
     * Number of scheduled tasks per status (PENDING, ARMED, RUNNING).
     */
    public Map<TaskStatus, Integer> countByStatus() {
        return call(() -> {
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            counts.put(TaskStatus.PENDING, 0);
            counts.put(TaskStatus.ARMED, 0);
            counts.put(TaskStatus.RUNNING, 0);
            for (TaskNode node : graph.nodes()) {
                counts.merge(node.status(), 1, Integer::sum);
            }
            return counts;
        });
    }

    public TaskEventBus events() {
        return events;
    }

    public Clock clock() {
        return clock;
    }

    public boolean isRunning() {
        return !closed.get();
    }

    // ----------------------------------------------------------------- lifecycle

    /**
     * Stop scheduling. Pending timers are dropped and all scheduled tasks are discarded.
     * Programs already running are left to finish on their own.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        List<Runnable> dropped = scheduler.shutdownNow();
        for (Runnable r : dropped) {
            if (r instanceof Future<?> f) {
                f.cancel(false);
            }
        }

        if (Thread.currentThread() == schedulerThread) {
            // Called from a listener: this thread cannot wait for itself to stop
            Thread.interrupted(); // clear the interrupt shutdownNow() just set on us
            discardScheduled();
        } else {
            try {
                if (scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    discardScheduled();
                } else {
                    log.warn("Scheduler thread did not stop within {}", shutdownTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        runners.shutdown();
    }

    private void discardScheduled() {
        int discarded = graph.size();
        if (discarded > 0) {
            log.warn("Orchestrator stopped; {} scheduled task(s) discarded", discarded);
        } else {
            log.info("Orchestrator stopped");
        }
        for (TaskNode node : graph.nodes()) {
            node.disarm();
        }
        graph.clear();
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Run an action on the scheduler thread and wait for it.
     * Exceptions thrown by the action reach the caller unchanged.
     */
    private <T> T call(Callable<T> action) {
        if (Thread.currentThread() == schedulerThread) {
            return callInline(action);
        }

        Future<T> future;
        try {
            future = scheduler.submit(action);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("orchestrator is closed", e);
        }

        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    if (future.cancel(false)) {
                        throw new IllegalStateException("interrupted before the request was applied", e);
                    }
                    // already running: wait for the result so the caller sees what happened
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        } catch (CancellationException e) {
            throw new IllegalStateException("orchestrator is closed", e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static <T> T callInline(Callable<T> action) {
        try {
            return action.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<String> copyNames(Collection<String> values, String field) {
        if (values == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            if (value == null) {
                throw new IllegalArgumentException(field + " must not contain null");
            }
            copy.add(value);
        }
        return copy;
    }

    private static List<String> names(List<TaskNode> nodes) {
        return nodes.stream().map(TaskNode::name).toList();
    }

    /** Non-negative delay until {@code runAt}; safe for any epoch value */
    private static long waitMs(long runAt, long now) {
        return runAt <= now ? 0 : runAt - now;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
