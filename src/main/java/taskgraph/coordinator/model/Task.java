package taskgraph.coordinator.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a scheduled task.
 * The graph keeps its own mutable nodes; callers only ever see these copies.
 */
public final class Task {
    private final String name;
    private final String programPath;
    private final List<String> parameters;
    private final long scheduledTime; // epoch millis
    private final Set<String> dependsOn;
    private final Set<String> dependents;
    private final Path outputSink;
    private final TaskStatus status;
    private final Instant admittedAt;

    private Task(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.programPath = Objects.requireNonNull(builder.programPath, "programPath is required");
        this.parameters = List.copyOf(builder.parameters);
        this.scheduledTime = builder.scheduledTime;
        this.dependsOn = sortedCopy(builder.dependsOn);
        this.dependents = sortedCopy(builder.dependents);
        this.outputSink = builder.outputSink;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.admittedAt = builder.admittedAt;
    }

    private static Set<String> sortedCopy(Collection<String> names) {
        return Collections.unmodifiableSet(new TreeSet<>(names));
    }

    // Getters
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

    public Set<String> dependsOn() {
        return dependsOn;
    }

    public Set<String> dependents() {
        return dependents;
    }

    public Path outputSink() {
        return outputSink;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant admittedAt() {
        return admittedAt;
    }

    /** Check if the task still waits on another task */
    public boolean isBlocked() {
        return !dependsOn.isEmpty();
    }

    /** Create a builder from this task (for status changes) */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .programPath(programPath)
                .parameters(parameters)
                .scheduledTime(scheduledTime)
                .dependsOn(dependsOn)
                .dependents(dependents)
                .outputSink(outputSink)
                .status(status)
                .admittedAt(admittedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String programPath;
        private Collection<String> parameters = List.of();
        private long scheduledTime;
        private Collection<String> dependsOn = Set.of();
        private Collection<String> dependents = Set.of();
        private Path outputSink;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant admittedAt;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder programPath(String programPath) {
            this.programPath = programPath;
            return this;
        }

        public Builder parameters(Collection<String> parameters) {
            this.parameters = parameters != null ? parameters : List.of();
            return this;
        }

        public Builder scheduledTime(long scheduledTime) {
            this.scheduledTime = scheduledTime;
            return this;
        }

        public Builder dependsOn(Collection<String> dependsOn) {
            this.dependsOn = dependsOn != null ? dependsOn : Set.of();
            return this;
        }

        public Builder dependents(Collection<String> dependents) {
            this.dependents = dependents != null ? dependents : Set.of();
            return this;
        }

        public Builder outputSink(Path outputSink) {
            this.outputSink = outputSink;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder admittedAt(Instant admittedAt) {
            this.admittedAt = admittedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(name, task.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Task{name='" + name + "', status=" + status + ", scheduledTime=" + scheduledTime
                + ", dependsOn=" + dependsOn + ", dependents=" + dependents + "}";
    }
}
