package com.tencent.taskmgr.domain.service;

import com.tencent.taskmgr.domain.exception.DuplicateTaskNumberException;
import com.tencent.taskmgr.domain.exception.InvalidStatusTransitionException;
import com.tencent.taskmgr.domain.exception.TaskNotFoundException;
import com.tencent.taskmgr.domain.exception.TaskPreconditionException;
import com.tencent.taskmgr.domain.exception.TaskUpdateConflictException;
import com.tencent.taskmgr.domain.repository.InMemoryTaskRepository;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskStatus;
import com.tencent.taskmgr.domain.task.TaskUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskTreeServiceTest {

    private InMemoryTaskRepository repository;
    private TaskTreeService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTaskRepository();
        service = new TaskTreeService(repository);
    }

    private Task root(String name) {
        return service.createRoot(Task.builder().name(name).build());
    }

    private Task child(Task parent, String name) {
        return service.attachChild(parent.getId(), Task.builder().name(name).build());
    }

    @Test
    void testCreateRoot_RootIdEqualsId() {
        Task root = root("Project");

        assertNotNull(root.getId());
        assertEquals(root.getId().longValue(), root.getRootId());
        assertEquals(root.getId().longValue(), service.require(root.getId()).getRootId());
        assertEquals(TaskStatus.CREATED, root.getStatus());
        assertEquals(1, root.getVersion());
    }

    @Test
    void testCreateRoot_RejectsParent() {
        Task task = Task.builder().name("x").parentId(5).build();
        assertThrows(TaskPreconditionException.class, () -> service.createRoot(task));
    }

    @Test
    void testAttachChild_DemotesParentAndNumbers() {
        Task root = root("Project");
        Task first = child(root, "first");
        Task second = child(root, "second");
        Task nested = child(first, "nested");

        assertEquals("1", first.getNumber());
        assertEquals("2", second.getNumber());
        assertEquals("1.1", nested.getNumber());
        assertEquals(root.getId().longValue(), nested.getRootId());
        assertFalse(service.require(root.getId()).isLeaf());
        assertFalse(service.require(first.getId()).isLeaf());
        assertTrue(service.require(second.getId()).isLeaf());
    }

    @Test
    void testAttachChild_DuplicateNumberRejected() {
        Task root = root("Project");
        service.attachChild(root.getId(), Task.builder().name("a").number("3").build());

        assertThrows(DuplicateTaskNumberException.class,
            () -> service.attachChild(root.getId(), Task.builder().name("b").number("3").build()));
    }

    @Test
    void testAttachChild_MissingParent() {
        assertThrows(TaskNotFoundException.class, () -> service.attachChild(42L, Task.builder().name("a").build()));
    }

    @Test
    void testVersionedUpdate_IncrementsVersion() {
        Task root = root("Project");
        root.setName("Renamed");

        service.update(root, TaskUpdate.allOf(root).versioned());

        assertEquals(2, root.getVersion());
        Task stored = service.require(root.getId());
        assertEquals(2, stored.getVersion());
        assertEquals("Renamed", stored.getName());
    }

    @Test
    void testVersionedUpdate_StaleWriterFails() {
        Task root = root("Project");
        Task writerA = service.require(root.getId());
        Task writerB = service.require(root.getId());

        service.update(writerA, TaskUpdate.builder().name("A").build().versioned());

        assertThrows(TaskUpdateConflictException.class,
            () -> service.update(writerB, TaskUpdate.builder().name("B").build().versioned()));
        assertEquals("A", service.require(root.getId()).getName());
        assertEquals(2, service.require(root.getId()).getVersion());
    }

    @Test
    void testUnversionedUpdate_MissingRowFails() {
        Task ghost = Task.builder().id(99L).build();
        assertThrows(TaskUpdateConflictException.class,
            () -> service.update(ghost, TaskUpdate.builder().name("x").build()));
    }

    @Test
    void testUpdateStatus_StampsTimes() {
        Task root = root("Project");
        Task leaf = child(root, "leaf");

        Task started = service.updateStatus(leaf.getId(), TaskStatus.STARTED);
        assertNotNull(started.getStartedTime());
        assertNull(started.getFinishedTime());
        assertEquals(2, started.getVersion());

        Task finished = service.updateStatus(leaf.getId(), TaskStatus.FINISHED);
        assertEquals(started.getStartedTime(), finished.getStartedTime());
        assertNotNull(finished.getFinishedTime());
    }

    @Test
    void testUpdateStatus_InvalidTransitions() {
        Task root = root("Project");
        Task leaf = child(root, "leaf");

        assertThrows(InvalidStatusTransitionException.class, () -> service.updateStatus(leaf.getId(), TaskStatus.CREATED));
        service.updateStatus(leaf.getId(), TaskStatus.STARTED);
        assertThrows(InvalidStatusTransitionException.class, () -> service.updateStatus(leaf.getId(), TaskStatus.CREATED));
        service.updateStatus(leaf.getId(), TaskStatus.FINISHED);
        for (TaskStatus target : TaskStatus.values()) {
            assertThrows(InvalidStatusTransitionException.class, () -> service.updateStatus(leaf.getId(), target));
        }
    }

    @Test
    void testUpdateStatus_CreatedToFinishedAllowed() {
        Task root = root("Project");
        Task leaf = child(root, "leaf");

        Task finished = service.updateStatus(leaf.getId(), TaskStatus.FINISHED);

        assertEquals(TaskStatus.FINISHED, finished.getStatus());
        assertNull(finished.getStartedTime());
        assertEquals(TaskStatus.FINISHED, service.require(root.getId()).getStatus());
    }

    @Test
    void testUpdateStatus_MissingTask() {
        assertThrows(TaskNotFoundException.class, () -> service.updateStatus(7L, TaskStatus.STARTED));
    }

    @Test
    void testPropagation_TwoChildren() {
        Task root = root("Project");
        Task a = child(root, "a");
        Task b = child(root, "b");

        service.startById(a.getId());
        service.finishById(a.getId());
        assertEquals(TaskStatus.STARTED, service.require(root.getId()).getStatus());

        service.startById(b.getId());
        service.finishById(b.getId());
        assertEquals(TaskStatus.FINISHED, service.require(root.getId()).getStatus());
    }

    @Test
    void testPropagation_ReachesRootThroughLevels() {
        Task root = root("Project");
        Task group = child(root, "group");
        Task leaf = child(group, "leaf");
        Task other = child(root, "other");

        service.startById(leaf.getId());

        assertEquals(TaskStatus.STARTED, service.require(group.getId()).getStatus());
        assertEquals(TaskStatus.STARTED, service.require(root.getId()).getStatus());
        assertEquals(TaskStatus.CREATED, service.require(other.getId()).getStatus());

        service.finishById(leaf.getId());
        assertEquals(TaskStatus.FINISHED, service.require(group.getId()).getStatus());
        assertEquals(TaskStatus.STARTED, service.require(root.getId()).getStatus());
    }

    @Test
    void testStartById_Preconditions() {
        Task root = root("Project");
        Task leaf = child(root, "leaf");

        assertThrows(TaskPreconditionException.class, () -> service.startById(root.getId()));
        assertThrows(TaskPreconditionException.class, () -> service.finishById(leaf.getId()));

        service.startById(leaf.getId());
        assertThrows(TaskPreconditionException.class, () -> service.startById(leaf.getId()));
        assertEquals(TaskStatus.STARTED, service.require(leaf.getId()).getStatus());
    }

    @Test
    void testUpdateProgress_Mean() {
        Task root = root("Project");
        Task a = child(root, "a");
        Task b = child(root, "b");

        service.updateProgress(a.getId(), 0.3);
        assertEquals(0.15, service.require(root.getId()).getProgress(), 1e-9);

        service.updateProgress(b.getId(), 0.7);
        assertEquals(0.5, service.require(root.getId()).getProgress(), 1e-9);
    }

    @Test
    void testUpdateProgress_MultiLevel() {
        Task root = root("Project");
        Task group = child(root, "group");
        Task a = child(group, "a");
        child(group, "b");
        child(root, "c");

        service.updateProgress(a.getId(), 1.0);

        assertEquals(0.5, service.require(group.getId()).getProgress(), 1e-9);
        assertEquals(0.25, service.require(root.getId()).getProgress(), 1e-9);
    }

    @Test
    void testUpdateProgress_OutOfRange() {
        Task root = root("Project");

        assertThrows(TaskPreconditionException.class, () -> service.updateProgress(root.getId(), -0.1));
        assertThrows(TaskPreconditionException.class, () -> service.updateProgress(root.getId(), 1.01));
        assertThrows(TaskPreconditionException.class, () -> service.updateProgress(root.getId(), Double.NaN));
        assertEquals(0.0, service.require(root.getId()).getProgress());
    }

    @Test
    void testDeleteById_CascadesToDescendants() {
        Task root = root("Project");
        Task group = child(root, "group");
        Task sub = child(group, "sub");
        Task deep = child(sub, "deep");
        Task sibling = child(root, "sibling");

        int deleted = service.deleteById(group.getId());

        assertEquals(3, deleted);
        assertTrue(repository.raw(group.getId()).isDeleted());
        assertTrue(repository.raw(sub.getId()).isDeleted());
        assertTrue(repository.raw(deep.getId()).isDeleted());
        assertTrue(service.getTask(deep.getId()).isEmpty());
        assertTrue(service.getTask(root.getId()).isPresent());
        assertTrue(service.getTask(sibling.getId()).isPresent());
        assertEquals(2, repository.findByRootId(root.getId()).size());
    }

    @Test
    void testDeleteById_RechecksParentStatus() {
        Task root = root("Project");
        Task a = child(root, "a");
        Task b = child(root, "b");
        service.updateStatus(a.getId(), TaskStatus.FINISHED);
        service.startById(b.getId());
        assertEquals(TaskStatus.STARTED, service.require(root.getId()).getStatus());

        service.deleteById(b.getId());

        assertEquals(TaskStatus.FINISHED, service.require(root.getId()).getStatus());
    }

    @Test
    void testDeleteById_LastChildRestoresLeaf() {
        Task root = root("Project");
        Task only = child(root, "only");

        service.deleteById(only.getId());

        assertTrue(service.require(root.getId()).isLeaf());
    }

    @Test
    void testDeleteById_MissingIsNoop() {
        assertEquals(0, service.deleteById(123L));
    }

    @Test
    void testDeleteAllAndClear() {
        Task root = root("Project");
        child(root, "a");

        assertEquals(2, service.deleteAll());
        assertTrue(service.getTask(root.getId()).isEmpty());
        assertNotNull(repository.raw(root.getId()));

        service.clear();
        assertNull(repository.raw(root.getId()));
        assertEquals(1L, root("Fresh").getId().longValue());
    }

    @Test
    void testDequeue_StartsFirstCreatedByNumber() {
        Task root = root("Project");
        service.attachChild(root.getId(), Task.builder().name("two").number("2").build());
        Task ten = service.attachChild(root.getId(), Task.builder().name("ten").number("10").build());

        Optional<Task> picked = service.dequeue(root.getId());

        assertTrue(picked.isPresent());
        assertEquals(ten.getId(), picked.get().getId());
        assertEquals(TaskStatus.STARTED, picked.get().getStatus());
    }

    @Test
    void testDequeue_ResumesStartedLeaf() {
        Task root = root("Project");
        child(root, "a");
        Task b = child(root, "b");
        service.startById(b.getId());

        Optional<Task> picked = service.startOrResume(root.getId());

        assertTrue(picked.isPresent());
        assertEquals(b.getId(), picked.get().getId());
        assertEquals(2, picked.get().getVersion());
    }

    @Test
    void testDequeue_EmptyWhenAllFinished() {
        Task root = root("Project");
        Task a = child(root, "a");
        service.updateStatus(a.getId(), TaskStatus.FINISHED);

        assertTrue(service.dequeue(root.getId()).isEmpty());
    }
}
