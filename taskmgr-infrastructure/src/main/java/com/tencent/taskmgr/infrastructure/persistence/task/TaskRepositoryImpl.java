package com.tencent.taskmgr.infrastructure.persistence.task;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.tencent.taskmgr.domain.exception.TaskUpdateConflictException;
import com.tencent.taskmgr.domain.repository.TaskRepository;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskField;
import com.tencent.taskmgr.domain.task.TaskUpdate;
import com.tencent.taskmgr.infrastructure.persistence.task.converter.TaskConverter;
import com.tencent.taskmgr.infrastructure.persistence.task.entity.TaskDO;
import com.tencent.taskmgr.infrastructure.persistence.task.mapper.TaskMapper;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TaskRepositoryImpl - 任务仓储实现
 * <p>
 * 每个项目存储持有一个实例，Mapper 绑定该项目自己的 SqlSessionFactory。
 * 所有查询排除已删除任务并按 number 字符串排序（"10" 排在 "2" 之前）。
 * </p>
 *
 * @author taskmgr
 */
public class TaskRepositoryImpl implements TaskRepository {

    private final TaskMapper taskMapper;

    public TaskRepositoryImpl(TaskMapper taskMapper) {
        this.taskMapper = taskMapper;
    }

    @Override
    public Optional<Task> findById(long id) {
        TaskDO taskDO = taskMapper.selectOne(
            activeTasks().eq(TaskDO::getId, id)
        );
        return Optional.ofNullable(TaskConverter.toDomain(taskDO));
    }

    @Override
    public Optional<Task> findByRootIdAndNumber(long rootId, String number) {
        List<TaskDO> taskDOs = taskMapper.selectList(
            activeTasks()
                .eq(TaskDO::getRootId, rootId)
                .ne(TaskDO::getParentId, Task.NO_PARENT)
                .eq(TaskDO::getNumber, number)
                .orderByAsc(TaskDO::getId)
        );
        return taskDOs.stream().findFirst().map(TaskConverter::toDomain);
    }

    @Override
    public List<Task> findByParentId(long parentId) {
        return toDomainList(taskMapper.selectList(
            activeTasks()
                .eq(TaskDO::getParentId, parentId)
                .orderByAsc(TaskDO::getNumber)
        ));
    }

    @Override
    public List<Task> findByRootId(long rootId) {
        return toDomainList(taskMapper.selectList(
            activeTasks()
                .eq(TaskDO::getRootId, rootId)
                .orderByAsc(TaskDO::getNumber)
        ));
    }

    @Override
    public List<Task> findLeaves(long rootId) {
        return toDomainList(taskMapper.selectList(
            activeTasks()
                .eq(TaskDO::getRootId, rootId)
                .eq(TaskDO::getIsLeaf, true)
                .orderByAsc(TaskDO::getNumber)
        ));
    }

    @Override
    public List<Task> findRootsByNamePrefix(String prefix) {
        String pattern = escapeLike(prefix == null ? "" : prefix.toLowerCase(Locale.ROOT)) + "%";
        return toDomainList(taskMapper.selectList(
            activeTasks()
                .eq(TaskDO::getParentId, Task.NO_PARENT)
                .apply("LOWER(name) LIKE {0}", pattern)
                .orderByAsc(TaskDO::getName)
        ));
    }

    @Override
    public List<Long> findChildIds(Collection<Long> parentIds) {
        if (parentIds == null || parentIds.isEmpty()) {
            return Collections.emptyList();
        }
        return taskMapper.selectList(
                activeTasks()
                    .select(TaskDO::getId)
                    .in(TaskDO::getParentId, parentIds)
            ).stream()
            .map(TaskDO::getId)
            .collect(Collectors.toList());
    }

    @Override
    public void insert(Task task) {
        TaskDO taskDO = TaskConverter.toDataObject(task);
        taskDO.setId(null);
        taskMapper.insert(taskDO);
        long id = taskDO.getId();
        task.setId(id);

        if (task.isRoot()) {
            // id 插入后才可知，根任务 root_id 需要第二次写入
            taskMapper.update(null, Wrappers.lambdaUpdate(TaskDO.class)
                .set(TaskDO::getRootId, id)
                .eq(TaskDO::getId, id));
            task.setRootId(id);
        } else {
            int rows = taskMapper.update(null, Wrappers.lambdaUpdate(TaskDO.class)
                .set(TaskDO::getIsLeaf, false)
                .set(TaskDO::getUpdatedTime, LocalDateTime.now())
                .eq(TaskDO::getId, task.getParentId()));
            if (rows == 0) {
                throw new TaskUpdateConflictException(task.getParentId(), false);
            }
        }
    }

    @Override
    public void update(Task task, TaskUpdate update) {
        LocalDateTime now = LocalDateTime.now();
        LambdaUpdateWrapper<TaskDO> wrapper = toUpdateWrapper(update)
            .set(TaskDO::getUpdatedTime, now)
            .eq(TaskDO::getId, task.getId());
        if (update.isVersioned()) {
            wrapper.setSql("version = version + 1")
                .eq(TaskDO::getVersion, task.getVersion());
        }

        int rows = taskMapper.update(null, wrapper);
        if (rows == 0) {
            throw new TaskUpdateConflictException(task.getId(), update.isVersioned());
        }

        task.apply(update);
        task.setUpdatedTime(now);
        if (update.isVersioned()) {
            task.setVersion(task.getVersion() + 1);
        }
    }

    @Override
    public int markDeleted(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return taskMapper.update(null, Wrappers.lambdaUpdate(TaskDO.class)
            .set(TaskDO::getDeleted, true)
            .set(TaskDO::getUpdatedTime, LocalDateTime.now())
            .in(TaskDO::getId, ids));
    }

    @Override
    public int markAllDeleted() {
        return taskMapper.update(null, Wrappers.lambdaUpdate(TaskDO.class)
            .set(TaskDO::getDeleted, true)
            .set(TaskDO::getUpdatedTime, LocalDateTime.now())
            .eq(TaskDO::getDeleted, false));
    }

    @Override
    public void purge() {
        taskMapper.truncate();
    }

    // ==================== 内部方法 ====================

    private static LambdaQueryWrapper<TaskDO> activeTasks() {
        return Wrappers.lambdaQuery(TaskDO.class).eq(TaskDO::getDeleted, false);
    }

    private static List<Task> toDomainList(List<TaskDO> taskDOs) {
        return taskDOs.stream()
            .map(TaskConverter::toDomain)
            .collect(Collectors.toList());
    }

    private static LambdaUpdateWrapper<TaskDO> toUpdateWrapper(TaskUpdate update) {
        LambdaUpdateWrapper<TaskDO> wrapper = Wrappers.lambdaUpdate(TaskDO.class);
        for (TaskField field : update.getFields()) {
            switch (field) {
                case NAME:
                    wrapper.set(TaskDO::getName, update.getName());
                    break;
                case DESCRIPTION:
                    wrapper.set(TaskDO::getDescription, update.getDescription());
                    break;
                case STATUS:
                    wrapper.set(TaskDO::getStatus, update.getStatus().getCode());
                    break;
                case NUMBER:
                    wrapper.set(TaskDO::getNumber, update.getNumber());
                    break;
                case LEAF:
                    wrapper.set(TaskDO::getIsLeaf, update.getLeaf());
                    break;
                case ROOT_ID:
                    wrapper.set(TaskDO::getRootId, update.getRootId());
                    break;
                case PARENT_ID:
                    wrapper.set(TaskDO::getParentId, update.getParentId());
                    break;
                case CREATED_TIME:
                    wrapper.set(TaskDO::getCreatedTime, update.getCreatedTime());
                    break;
                case STARTED_TIME:
                    wrapper.set(TaskDO::getStartedTime, update.getStartedTime());
                    break;
                case FINISHED_TIME:
                    wrapper.set(TaskDO::getFinishedTime, update.getFinishedTime());
                    break;
                case PLANNED_START_TIME:
                    wrapper.set(TaskDO::getPlannedStartTime, update.getPlannedStartTime());
                    break;
                case PLANNED_FINISH_TIME:
                    wrapper.set(TaskDO::getPlannedFinishTime, update.getPlannedFinishTime());
                    break;
                case PROGRESS:
                    wrapper.set(TaskDO::getProgress, update.getProgress());
                    break;
                case DELETED:
                    wrapper.set(TaskDO::getDeleted, update.getDeleted());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported task field: " + field);
            }
        }
        return wrapper;
    }

    /**
     * 转义 LIKE 通配符，H2 默认以反斜杠为转义符
     */
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }
}
