package com.tencent.taskmgr.domain.service;

import com.tencent.taskmgr.domain.exception.DuplicateTaskNumberException;
import com.tencent.taskmgr.domain.exception.InvalidStatusTransitionException;
import com.tencent.taskmgr.domain.exception.TaskNotFoundException;
import com.tencent.taskmgr.domain.exception.TaskPreconditionException;
import com.tencent.taskmgr.domain.repository.TaskRepository;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskNumber;
import com.tencent.taskmgr.domain.task.TaskStatus;
import com.tencent.taskmgr.domain.task.TaskUpdate;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * TaskTreeService - 任务树领域服务
 * <p>
 * 负责状态机、父任务状态推导、进度汇总、级联逻辑删除和取任务。
 * 状态与进度的向上传播都是从变更节点到根节点的逐层迭代，步数不超过树深度。
 * </p>
 * <p>
 * 本服务不开启事务。多语句操作（插入、级联删除、传播）需由调用方包裹在同一事务中。
 * </p>
 *
 * @author taskmgr
 */
@Slf4j
public class TaskTreeService {

    private final TaskRepository repository;

    public TaskTreeService(TaskRepository repository) {
        this.repository = repository;
    }

    // ==================== 查询 ====================

    public Optional<Task> getTask(long id) {
        return repository.findById(id);
    }

    /**
     * 获取任务，不存在或已删除时抛出 {@link TaskNotFoundException}
     */
    public Task require(long id) {
        return repository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    // ==================== 创建 ====================

    /**
     * 创建根任务，rootId 随插入写为自身 id
     */
    public Task createRoot(Task task) {
        if (!task.isRoot()) {
            throw new TaskPreconditionException("Root task must not have a parent, got parentId=" + task.getParentId());
        }
        if (task.getNumber() == null) {
            task.setNumber("");
        }
        repository.insert(task);
        log.info("Created root task id={}, name={}", task.getId(), task.getName());
        return task;
    }

    /**
     * 在父任务下挂载子任务。未指定编号时取父任务下一个可用编号。
     *
     * @throws TaskNotFoundException 父任务不存在
     * @throws DuplicateTaskNumberException 同一任务树中编号已被占用
     */
    public Task attachChild(long parentId, Task task) {
        Task parent = require(parentId);
        task.setParentId(parent.getId());
        task.setRootId(parent.getRootId());
        if (task.getNumber() == null || task.getNumber().isBlank()) {
            task.setNumber(TaskNumber.nextChildOf(parent, repository.findByParentId(parent.getId())));
        }
        if (repository.findByRootIdAndNumber(task.getRootId(), task.getNumber()).isPresent()) {
            throw new DuplicateTaskNumberException(task.getRootId(), task.getNumber());
        }
        repository.insert(task);
        log.debug("Attached task id={}, number={} under parent id={}", task.getId(), task.getNumber(), parentId);
        return task;
    }

    // ==================== 更新 ====================

    /**
     * 字段更新，透传到仓储；versioned 请求冲突时抛出 UpdateConflict
     */
    public Task update(Task task, TaskUpdate update) {
        repository.update(task, update);
        return task;
    }

    /**
     * 状态迁移，随后逐层推导父任务状态
     *
     * @throws TaskNotFoundException 任务不存在
     * @throws InvalidStatusTransitionException 目标状态不可达
     */
    public Task updateStatus(long id, TaskStatus status) {
        Task task = require(id);
        transition(task, status);
        propagateStatus(task.getParentId());
        return task;
    }

    /**
     * 开始叶子任务，要求当前状态为 created
     */
    public Task startById(long id) {
        Task task = require(id);
        checkLeafInStatus(task, TaskStatus.CREATED, "started");
        return updateStatus(id, TaskStatus.STARTED);
    }

    /**
     * 完成叶子任务，要求当前状态为 started
     */
    public Task finishById(long id) {
        Task task = require(id);
        checkLeafInStatus(task, TaskStatus.STARTED, "finished");
        return updateStatus(id, TaskStatus.FINISHED);
    }

    /**
     * 设置任务自身进度，然后逐层将父任务进度重算为其直接子任务进度的算术平均
     *
     * @throws TaskPreconditionException 进度不在 [0, 1] 内
     */
    public Task updateProgress(long id, double progress) {
        if (!(progress >= 0.0 && progress <= 1.0)) {
            throw new TaskPreconditionException("Progress must be within [0.0, 1.0], got " + progress);
        }
        Task task = require(id);
        writeProgress(task, progress);

        long parentId = task.getParentId();
        while (parentId != Task.NO_PARENT) {
            Optional<Task> parent = repository.findById(parentId);
            if (parent.isEmpty()) {
                break;
            }
            List<Task> children = repository.findByParentId(parentId);
            if (children.isEmpty()) {
                break;
            }
            double mean = children.stream().mapToDouble(Task::getProgress).average().orElse(0.0);
            writeProgress(parent.get(), mean);
            log.debug("Recomputed progress of task id={} to {}", parentId, mean);
            parentId = parent.get().getParentId();
        }
        return task;
    }

    // ==================== 删除 ====================

    /**
     * 级联逻辑删除：逐层标记当前层并查询下一层未删除子任务，直到某层为空。
     * 完成后重新检查原父任务：已无子任务时恢复为叶子，否则重新推导其状态。
     *
     * @return 标记删除的任务数，任务不存在时为 0
     */
    public int deleteById(long id) {
        Optional<Task> target = repository.findById(id);
        if (target.isEmpty()) {
            log.debug("Task id={} not found or already deleted, nothing to delete", id);
            return 0;
        }
        long parentId = target.get().getParentId();

        int deleted = 0;
        List<Long> level = Collections.singletonList(id);
        while (!level.isEmpty()) {
            deleted += repository.markDeleted(level);
            level = new ArrayList<>(repository.findChildIds(level));
        }
        log.info("Deleted task id={} with {} task(s) in its subtree", id, deleted);

        if (parentId != Task.NO_PARENT) {
            Optional<Task> parent = repository.findById(parentId);
            if (parent.isPresent()) {
                if (repository.findByParentId(parentId).isEmpty()) {
                    repository.update(parent.get(), TaskUpdate.builder().leaf(true).build());
                } else {
                    propagateStatus(parentId);
                }
            }
        }
        return deleted;
    }

    /**
     * 将所有任务标记为已删除
     */
    public int deleteAll() {
        int deleted = repository.markAllDeleted();
        log.info("Marked all {} task(s) as deleted", deleted);
        return deleted;
    }

    /**
     * 物理清空所有任务并重置 id 序列，不可恢复
     */
    public void clear() {
        repository.purge();
        log.info("Purged all tasks and reset id generation");
    }

    // ==================== 取任务 ====================

    /**
     * 为执行方选取一个叶子任务：优先返回已开始的叶子任务（继续执行），
     * 否则将按编号排序的第一个 created 叶子任务置为 started 后返回。
     *
     * @return 没有可执行任务时为空
     */
    public Optional<Task> dequeue(long rootId) {
        List<Task> leaves = repository.findLeaves(rootId);
        for (Task leaf : leaves) {
            if (leaf.getStatus() == TaskStatus.STARTED) {
                log.debug("Resuming task id={}, number={}", leaf.getId(), leaf.getNumber());
                return Optional.of(leaf);
            }
        }
        for (Task leaf : leaves) {
            if (leaf.getStatus() == TaskStatus.CREATED) {
                return Optional.of(startById(leaf.getId()));
            }
        }
        return Optional.empty();
    }

    public Optional<Task> startOrResume(long rootId) {
        return dequeue(rootId);
    }

    // ==================== 内部方法 ====================

    private void transition(Task task, TaskStatus target) {
        TaskStatus current = task.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(task.getId(), current, target);
        }
        LocalDateTime now = LocalDateTime.now();
        TaskUpdate.Builder update = TaskUpdate.builder()
            .status(target)
            .startedTime(target == TaskStatus.STARTED ? now : task.getStartedTime())
            .finishedTime(target == TaskStatus.FINISHED ? now : task.getFinishedTime());
        repository.update(task, update.build().versioned());
        log.info("Task id={} status {} -> {}", task.getId(), current.getCode(), target.getCode());
    }

    /**
     * 从给定父任务开始逐层向上推导状态，直到某层无需变更或到达根任务
     */
    private void propagateStatus(long parentId) {
        while (parentId != Task.NO_PARENT) {
            Optional<Task> parent = repository.findById(parentId);
            if (parent.isEmpty()) {
                return;
            }
            TaskStatus derived = deriveStatus(repository.findByParentId(parentId));
            if (derived == null || derived == parent.get().getStatus()) {
                return;
            }
            transition(parent.get(), derived);
            parentId = parent.get().getParentId();
        }
    }

    /**
     * 全部子任务完成则为 finished；任一子任务已开始或完成则为 started；否则不变
     */
    static TaskStatus deriveStatus(List<Task> children) {
        if (children.isEmpty()) {
            return null;
        }
        boolean allFinished = true;
        boolean anyActive = false;
        for (Task child : children) {
            TaskStatus status = child.getStatus();
            if (status != TaskStatus.FINISHED) {
                allFinished = false;
            }
            if (status == TaskStatus.STARTED || status == TaskStatus.FINISHED) {
                anyActive = true;
            }
        }
        if (allFinished) {
            return TaskStatus.FINISHED;
        }
        return anyActive ? TaskStatus.STARTED : null;
    }

    private void writeProgress(Task task, double progress) {
        repository.update(task, TaskUpdate.builder().progress(progress).build());
    }

    private void checkLeafInStatus(Task task, TaskStatus expected, String action) {
        if (!task.isLeaf()) {
            throw new TaskPreconditionException("Task id=" + task.getId() + " is not a leaf task and cannot be " + action + " directly");
        }
        if (task.getStatus() != expected) {
            throw new TaskPreconditionException("Task id=" + task.getId() + " must be " + expected.getCode()
                + " to be " + action + ", but is " + task.getStatus().getCode());
        }
    }
}
