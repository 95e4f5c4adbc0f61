package taskgraph.coordinator.scheduler;

import taskgraph.coordinator.exec.ExecutionOutcome;
import taskgraph.coordinator.model.Task;
import taskgraph.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskEventBusTest {

    private static Task task(String name) {
        return Task.builder()
                .name(name)
                .programPath(name + ".py")
                .scheduledTime(1000L)
                .status(TaskStatus.RUNNING)
                .build();
    }

    @Test
    void deliversToAllListenersInOrder() {
        TaskEventBus bus = new TaskEventBus();
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        bus.subscribe(first);
        bus.subscribe(second);

        bus.fireAdmitted(task("a"));
        bus.fireArmed(task("a"), 250);
        bus.fireDispatched(task("a"));
        bus.fireCompleted(task("a"), ExecutionOutcome.exited(0, 12));
        bus.fireCancelled(task("b"));

        List<String> expected = List.of("admitted:a", "armed:a", "dispatched:a", "completed:a", "cancelled:b");
        assertEquals(expected, first.events);
        assertEquals(expected, second.events);
        assertEquals(250L, first.armedDelays.get("a"));
        assertEquals(12, first.outcomes.get("a").runtimeMs());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        TaskEventBus bus = new TaskEventBus();
        bus.subscribe(new TaskListener() {
            @Override
            public void onCancelled(Task task) {
                throw new RuntimeException("listener bug");
            }
        });
        RecordingListener recorder = new RecordingListener();
        bus.subscribe(recorder);

        assertDoesNotThrow(() -> bus.fireCancelled(task("x")));
        assertEquals(List.of("cancelled:x"), recorder.events);
    }

    @Test
    void unsubscribeStopsDelivery() {
        TaskEventBus bus = new TaskEventBus();
        RecordingListener recorder = new RecordingListener();
        bus.subscribe(recorder);
        assertEquals(1, bus.listenerCount());

        bus.unsubscribe(recorder);
        bus.fireAdmitted(task("a"));

        assertEquals(0, bus.listenerCount());
        assertTrue(recorder.events.isEmpty());
    }

    @Test
    void defaultListenerMethodsAreNoOps() {
        TaskEventBus bus = new TaskEventBus();
        bus.subscribe(new TaskListener() {
        });

        assertDoesNotThrow(() -> bus.fireCompleted(task("a"), ExecutionOutcome.failed("boom", 0)));
    }
}
