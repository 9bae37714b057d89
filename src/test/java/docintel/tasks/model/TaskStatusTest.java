package docintel.tasks.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void onlyForwardTransitionsAreAllowed() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.PROCESSING));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.FAILED));

        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.PENDING));
        assertFalse(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.PROCESSING));
    }

    @Test
    void terminalStatusesHaveNoSuccessors() {
        for (TaskStatus terminal : new TaskStatus[] { TaskStatus.COMPLETED, TaskStatus.FAILED }) {
            assertTrue(terminal.isTerminal());
            for (TaskStatus next : TaskStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.PROCESSING.isTerminal());
    }

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(TaskStatus.COMPLETED, TaskStatus.parse("completed"));
        assertEquals(TaskStatus.PROCESSING, TaskStatus.parse(" PROCESSING "));
    }

    @Test
    void parseRejectsUnknownValues() {
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.parse("RUNNING"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.parse(null));
    }
}
