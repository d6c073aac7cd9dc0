package com.tencent.taskmgr.app.service;

import com.tencent.taskmgr.app.command.CreateTaskCommand;
import com.tencent.taskmgr.app.command.UpdateTaskCommand;
import com.tencent.taskmgr.app.parser.TaskTreeYamlParser;
import com.tencent.taskmgr.domain.exception.TaskPreconditionException;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskSpec;
import com.tencent.taskmgr.domain.task.TaskStatus;
import com.tencent.taskmgr.domain.task.TaskUpdate;
import com.tencent.taskmgr.infrastructure.store.ProjectStore;
import com.tencent.taskmgr.infrastructure.store.ProjectStoreRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TaskAppService - 任务应用服务
 * <p>
 * 每个操作一个入口，参数为项目目录加普通参数。每次调用在该项目存储的一个事务中执行，
 * 失败时整体回滚，异常原样抛给调用方，不做重试。
 * </p>
 *
 * @author taskmgr
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class TaskAppService {

    private final ProjectStoreRegistry storeRegistry;
    private final TaskTreeYamlParser yamlParser;

    // ==================== 创建 ====================

    public Task createRootTask(@NotBlank String projectDir, @NotNull @Valid CreateTaskCommand command) {
        Task task = toTask(command);
        return store(projectDir).inTransaction(store -> store.taskTree().createRoot(task));
    }

    public Task attachChild(@NotBlank String projectDir, long parentId, @NotNull @Valid CreateTaskCommand command) {
        Task task = toTask(command);
        return store(projectDir).inTransaction(store -> store.taskTree().attachChild(parentId, task));
    }

    /**
     * 按编号路径添加子任务，缺失的中间节点自动创建
     */
    public Task addSubTask(@NotBlank String projectDir, long rootId, @NotBlank String number, @NotBlank String name) {
        return store(projectDir).inTransaction(store -> store.assembler().addNumbered(rootId, number, name));
    }

    /**
     * 批量按编号路径添加，任一失败则整批回滚
     */
    public List<Task> addSubTasks(@NotBlank String projectDir, long rootId, @NotEmpty Map<String, String> numberedNames) {
        return store(projectDir).inTransaction(store -> store.assembler().addSubTasks(rootId, numberedNames));
    }

    /**
     * 按嵌套规格创建一棵新任务树
     */
    public Task createTaskTree(@NotBlank String projectDir, @NotNull TaskSpec spec) {
        Task root = store(projectDir).inTransaction(store -> store.assembler().createTree(spec));
        log.info("Created task tree root id={} in {}", root.getId(), projectDir);
        return root;
    }

    public Task createTaskTreeFromYaml(@NotBlank String projectDir, @NotBlank String yamlContent) {
        return createTaskTree(projectDir, yamlParser.parse(yamlContent));
    }

    /**
     * 将嵌套规格挂到已有任务下
     */
    public Task attachTaskTree(@NotBlank String projectDir, long parentId, @NotNull TaskSpec spec) {
        return store(projectDir).inTransaction(store -> store.assembler().attachTree(parentId, spec));
    }

    // ==================== 查询 ====================

    public Task getTask(@NotBlank String projectDir, long id) {
        return store(projectDir).taskTree().require(id);
    }

    public Optional<Task> getTaskByNumber(@NotBlank String projectDir, long rootId, @NotBlank String number) {
        return store(projectDir).tasks().findByRootIdAndNumber(rootId, number);
    }

    public List<Task> listRootTasks(@NotBlank String projectDir) {
        return store(projectDir).tasks().findByParentId(Task.NO_PARENT);
    }

    /**
     * 按名称前缀查找根任务，大小写不敏感
     */
    public List<Task> findRootTasks(@NotBlank String projectDir, @NotNull String namePrefix) {
        return store(projectDir).tasks().findRootsByNamePrefix(namePrefix);
    }

    public List<Task> listChildren(@NotBlank String projectDir, long parentId) {
        return store(projectDir).tasks().findByParentId(parentId);
    }

    /**
     * 整棵任务树（含根任务）
     */
    public List<Task> listTree(@NotBlank String projectDir, long rootId) {
        return store(projectDir).tasks().findByRootId(rootId);
    }

    /**
     * 任务树中除根任务外的所有任务
     */
    public List<Task> listSubTasks(@NotBlank String projectDir, long rootId) {
        return listTree(projectDir, rootId).stream()
            .filter(task -> !task.isRoot())
            .collect(Collectors.toList());
    }

    public List<Task> listLeaves(@NotBlank String projectDir, long rootId) {
        return store(projectDir).tasks().findLeaves(rootId);
    }

    // ==================== 更新 ====================

    /**
     * 更新名称、描述和计划时间。带 expectedVersion 时以其为乐观锁条件。
     */
    public Task updateTask(@NotBlank String projectDir, @NotNull @Valid UpdateTaskCommand command) {
        if (!command.hasChanges()) {
            throw new TaskPreconditionException("No task fields to update for id=" + command.getId());
        }
        return store(projectDir).inTransaction(store -> {
            Task task = store.taskTree().require(command.getId());
            if (command.getExpectedVersion() != null) {
                task.setVersion(command.getExpectedVersion());
            }

            TaskUpdate.Builder builder = TaskUpdate.builder();
            if (command.getName() != null) {
                builder.name(command.getName());
            }
            if (command.getDescription() != null) {
                builder.description(command.getDescription());
            }
            if (command.getPlannedStartTime() != null) {
                task.setPlannedStartTime(command.getPlannedStartTime());
                builder.plannedStartTime(command.getPlannedStartTime());
            }
            if (command.getPlannedFinishTime() != null) {
                builder.plannedFinishTime(command.getPlannedFinishTime());
            }
            if (command.getPlannedDurationMinutes() != null) {
                if (task.getPlannedStartTime() == null) {
                    throw new TaskPreconditionException("Task id=" + task.getId() + " has no planned start time to apply a duration to");
                }
                task.setPlannedDuration(Duration.ofMinutes(command.getPlannedDurationMinutes()));
                builder.plannedFinishTime(task.getPlannedFinishTime());
            }

            TaskUpdate update = builder.build();
            return store.taskTree().update(task, command.getExpectedVersion() != null ? update.versioned() : update);
        });
    }

    public Task updateStatus(@NotBlank String projectDir, long id, @NotNull TaskStatus status) {
        return store(projectDir).inTransaction(store -> store.taskTree().updateStatus(id, status));
    }

    public Task startTask(@NotBlank String projectDir, long id) {
        return store(projectDir).inTransaction(store -> store.taskTree().startById(id));
    }

    public Task finishTask(@NotBlank String projectDir, long id) {
        return store(projectDir).inTransaction(store -> store.taskTree().finishById(id));
    }

    public Task updateProgress(@NotBlank String projectDir, long id, double progress) {
        return store(projectDir).inTransaction(store -> store.taskTree().updateProgress(id, progress));
    }

    /**
     * 取一个可执行的叶子任务，没有时为空
     */
    public Optional<Task> dequeue(@NotBlank String projectDir, long rootId) {
        return store(projectDir).inTransaction(store -> store.taskTree().dequeue(rootId));
    }

    // ==================== 删除 ====================

    public int deleteTask(@NotBlank String projectDir, long id) {
        return store(projectDir).inTransaction(store -> store.taskTree().deleteById(id));
    }

    public int deleteAllTasks(@NotBlank String projectDir) {
        return store(projectDir).inTransaction(store -> store.taskTree().deleteAll());
    }

    /**
     * 物理清空项目所有任务并重置 id，不可恢复
     */
    public void clearTasks(@NotBlank String projectDir) {
        log.warn("Clearing all tasks of project {}", projectDir);
        store(projectDir).runInTransaction(store -> store.taskTree().clear());
    }

    // ==================== 元数据 ====================

    public Optional<String> getMetadata(@NotBlank String projectDir, @NotBlank String key) {
        return store(projectDir).metadata().get(key);
    }

    public void setMetadata(@NotBlank String projectDir, @NotBlank String key, @NotNull String value) {
        store(projectDir).runInTransaction(store -> store.metadata().put(key, value));
    }

    /**
     * 关闭项目存储，释放连接
     */
    public void closeProject(@NotBlank String projectDir) {
        storeRegistry.close(projectDir);
    }

    // ==================== 内部方法 ====================

    private ProjectStore store(String projectDir) {
        return storeRegistry.open(projectDir);
    }

    private static Task toTask(CreateTaskCommand command) {
        return Task.builder()
            .name(command.getName())
            .description(command.getDescription() == null ? "" : command.getDescription())
            .number(command.getNumber() == null ? "" : command.getNumber().trim())
            .plannedStartTime(command.getPlannedStartTime())
            .plannedFinishTime(command.getPlannedFinishTime())
            .build();
    }
}
