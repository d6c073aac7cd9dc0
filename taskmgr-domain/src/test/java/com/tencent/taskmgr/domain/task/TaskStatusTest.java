package com.tencent.taskmgr.domain.task;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void testTransitionTable() {
        assertTrue(TaskStatus.CREATED.canTransitionTo(TaskStatus.STARTED));
        assertTrue(TaskStatus.CREATED.canTransitionTo(TaskStatus.FINISHED));
        assertTrue(TaskStatus.STARTED.canTransitionTo(TaskStatus.FINISHED));

        assertFalse(TaskStatus.CREATED.canTransitionTo(TaskStatus.CREATED));
        assertFalse(TaskStatus.STARTED.canTransitionTo(TaskStatus.CREATED));
        assertFalse(TaskStatus.STARTED.canTransitionTo(TaskStatus.STARTED));
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TaskStatus.FINISHED.canTransitionTo(target));
        }
    }

    @Test
    void testFromCode() {
        assertEquals(TaskStatus.STARTED, TaskStatus.fromCode("started"));
        assertNull(TaskStatus.fromCode(null));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromCode("paused"));
    }

    @Test
    void testTaskUpdateRequiresField() {
        assertThrows(IllegalStateException.class, () -> TaskUpdate.builder().build());
        TaskUpdate update = TaskUpdate.builder().progress(0.5).build();
        assertFalse(update.isVersioned());
        assertTrue(update.versioned().isVersioned());
        assertTrue(update.versioned().has(TaskField.PROGRESS));
    }
}
