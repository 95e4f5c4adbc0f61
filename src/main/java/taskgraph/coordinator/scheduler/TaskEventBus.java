package taskgraph.coordinator.scheduler;

import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of lifecycle events to registered listeners.
 * A failing listener is logged and skipped; it never affects scheduling.
 */
public final class TaskEventBus {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBus.class);

    private final CopyOnWriteArrayList<TaskListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(TaskListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(TaskListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    void fireAdmitted(Task task) {
        dispatch("admitted", task, l -> l.onAdmitted(task));
    }

    void fireArmed(Task task, long delayMs) {
        dispatch("armed", task, l -> l.onArmed(task, delayMs));
    }

    void fireDispatched(Task task) {
        dispatch("dispatched", task, l -> l.onDispatched(task));
    }

    void fireCompleted(Task task, ExecutionOutcome outcome) {
        dispatch("completed", task, l -> l.onCompleted(task, outcome));
    }

    void fireCancelled(Task task) {
        dispatch("cancelled", task, l -> l.onCancelled(task));
    }

    private void dispatch(String event, Task task, Consumer<TaskListener> call) {
        for (TaskListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} event for task {}", listener, event, task.name(), e);
            }
        }
    }
}
