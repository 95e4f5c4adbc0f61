package taskgraph.coordinator.graph;

import taskgraph.coordinator.error.DuplicateTaskException;
import taskgraph.coordinator.error.UnknownTaskException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-indexed store of live tasks and the edges between them.
 *
 * Every edge is stored on both ends, so all operations are single hash lookups.
 * The store does no locking of its own; the scheduler confines it to one thread.
 */
public final class TaskGraph {

    private final Map<String, TaskNode> nodes = new HashMap<>();

    /**
     * Insert a new node.
     *
     * @throws DuplicateTaskException if a node with the same name exists
     */
    public void insert(TaskNode node) {
        if (nodes.putIfAbsent(node.name(), node) != null) {
            throw new DuplicateTaskException(node.name());
        }
    }

    /** Node by name, or null */
    public TaskNode get(String name) {
        return nodes.get(name);
    }

    public Optional<TaskNode> find(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /**
     * Remove a node by name. Edges are not touched; callers unlink first.
     *
     * @throws UnknownTaskException if absent
     */
    public TaskNode remove(String name) {
        TaskNode removed = nodes.remove(name);
        if (removed == null) {
            throw new UnknownTaskException(name);
        }
        return removed;
    }

    /**
     * Record that {@code dependent} waits on {@code dependency}.
     * Both names must be present.
     */
    public void link(String dependency, String dependent) {
        TaskNode upstream = require(dependency);
        TaskNode downstream = require(dependent);
        upstream.addDependent(dependent);
        downstream.addDependsOn(dependency);
    }

    /**
     * Drop the edge between {@code dependency} and {@code dependent}.
     * Either end may already be gone from the store.
     *
     * @return true if the dependent still exists and no longer waits on anything
     */
    public boolean unlink(String dependency, String dependent) {
        TaskNode upstream = nodes.get(dependency);
        if (upstream != null) {
            upstream.removeDependent(dependent);
        }
        TaskNode downstream = nodes.get(dependent);
        if (downstream == null) {
            return false;
        }
        return downstream.removeDependsOn(dependency) && downstream.isReady();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Collection<TaskNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public void clear() {
        nodes.clear();
    }

    private TaskNode require(String name) {
        TaskNode node = nodes.get(name);
        if (node == null) {
            throw new UnknownTaskException(name);
        }
        return node;
    }
}
