package taskgraph.coordinator.graph;

import taskgraph.coordinator.model.Task;
import taskgraph.coordinator.model.TaskStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable graph record for one task.
 *
 * Edge sets hold names only. The owning {@link TaskGraph} map is the single
 * owner of nodes; {@code dependents} is a reverse index, nothing more.
 * Not thread-safe: nodes are only touched by the scheduler's owner thread.
 */
public final class TaskNode {

    private final String name;
    private final String programPath;
    private final List<String> parameters;
    private final long scheduledTime;
    private final Path outputSink;
    private final Instant admittedAt;

    private final Set<String> dependsOn = new LinkedHashSet<>();
    private final Set<String> dependents = new LinkedHashSet<>();

    private TaskStatus status = TaskStatus.PENDING;
    private ScheduledFuture<?> timer;

    public TaskNode(String name, String programPath, List<String> parameters, long scheduledTime,
            Path outputSink, Instant admittedAt) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.programPath = Objects.requireNonNull(programPath, "programPath is required");
        this.parameters = List.copyOf(parameters);
        this.scheduledTime = scheduledTime;
        this.outputSink = outputSink;
        this.admittedAt = admittedAt;
    }

    public String name() {
        return name;
    }

    public String programPath() {
        return programPath;
    }

    public List<String> parameters() {
        return parameters;
    }

    public long scheduledTime() {
        return scheduledTime;
    }

    public Path outputSink() {
        return outputSink;
    }

    public Set<String> dependsOn() {
        return Collections.unmodifiableSet(dependsOn);
    }

    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public TaskStatus status() {
        return status;
    }

    public void status(TaskStatus status) {
        this.status = Objects.requireNonNull(status);
    }

    public boolean isReady() {
        return dependsOn.isEmpty();
    }

    /** Pending timer, or null once fired or never armed */
    public ScheduledFuture<?> timer() {
        return timer;
    }

    public void timer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    /**
     * Cancel the pending timer if there is one.
     *
     * @return true if a timer was stopped before it ran
     */
    public boolean disarm() {
        ScheduledFuture<?> t = timer;
        timer = null;
        return t != null && t.cancel(false);
    }

    // Edge maintenance is package-private: only TaskGraph keeps the two sides in sync.
    void addDependsOn(String dependency) {
        dependsOn.add(dependency);
    }

    boolean removeDependsOn(String dependency) {
        return dependsOn.remove(dependency);
    }

    void addDependent(String dependent) {
        dependents.add(dependent);
    }

    boolean removeDependent(String dependent) {
        return dependents.remove(dependent);
    }

    /** Immutable copy with the current status */
    public Task snapshot() {
        return snapshot(status);
    }

    /** Immutable copy reporting the given status */
    public Task snapshot(TaskStatus reported) {
        return Task.builder()
                .name(name)
                .programPath(programPath)
                .parameters(parameters)
                .scheduledTime(scheduledTime)
                .dependsOn(dependsOn)
                .dependents(dependents)
                .outputSink(outputSink)
                .status(reported)
                .admittedAt(admittedAt)
                .build();
    }

    @Override
    public String toString() {
        return "TaskNode{name='" + name + "', status=" + status + ", dependsOn=" + dependsOn
                + ", dependents=" + dependents + "}";
    }
}
