package com.tencent.taskmgr.domain.task;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * TaskUpdate - 任务更新请求
 * <p>
 * 只写入 {@link #getFields()} 中标记的字段。versioned 为 true 时走乐观锁路径：
 * 以调用方持有的 version 作为条件，并原子递增 version。
 * </p>
 *
 * @author taskmgr
 */
@Getter
public final class TaskUpdate {

    private final Set<TaskField> fields;
    private final boolean versioned;

    private final String name;
    private final String description;
    private final TaskStatus status;
    private final String number;
    private final Boolean leaf;
    private final Long rootId;
    private final Long parentId;
    private final LocalDateTime createdTime;
    private final LocalDateTime startedTime;
    private final LocalDateTime finishedTime;
    private final LocalDateTime plannedStartTime;
    private final LocalDateTime plannedFinishTime;
    private final Double progress;
    private final Boolean deleted;

    private TaskUpdate(Builder builder, boolean versioned) {
        this.fields = Collections.unmodifiableSet(EnumSet.copyOf(builder.fields));
        this.versioned = versioned;
        this.name = builder.name;
        this.description = builder.description;
        this.status = builder.status;
        this.number = builder.number;
        this.leaf = builder.leaf;
        this.rootId = builder.rootId;
        this.parentId = builder.parentId;
        this.createdTime = builder.createdTime;
        this.startedTime = builder.startedTime;
        this.finishedTime = builder.finishedTime;
        this.plannedStartTime = builder.plannedStartTime;
        this.plannedFinishTime = builder.plannedFinishTime;
        this.progress = builder.progress;
        this.deleted = builder.deleted;
    }

    public boolean has(TaskField field) {
        return fields.contains(field);
    }

    /**
     * 返回同样字段、走乐观锁路径的更新请求
     */
    public TaskUpdate versioned() {
        return new TaskUpdate(toBuilder(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从实体中取出指定字段的当前值
     */
    public static TaskUpdate of(Task task, TaskField... fields) {
        if (fields.length == 0) {
            throw new IllegalArgumentException("At least one task field must be given");
        }
        Builder builder = builder();
        for (TaskField field : fields) {
            builder.copy(task, field);
        }
        return builder.build();
    }

    /**
     * 从实体中取出所有可更新字段
     */
    public static TaskUpdate allOf(Task task) {
        return of(task, TaskField.values());
    }

    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.fields.addAll(fields);
        builder.name = name;
        builder.description = description;
        builder.status = status;
        builder.number = number;
        builder.leaf = leaf;
        builder.rootId = rootId;
        builder.parentId = parentId;
        builder.createdTime = createdTime;
        builder.startedTime = startedTime;
        builder.finishedTime = finishedTime;
        builder.plannedStartTime = plannedStartTime;
        builder.plannedFinishTime = plannedFinishTime;
        builder.progress = progress;
        builder.deleted = deleted;
        return builder;
    }

    @Override
    public String toString() {
        return "TaskUpdate{fields=" + fields + ", versioned=" + versioned + '}';
    }

    public static final class Builder {

        private final EnumSet<TaskField> fields = EnumSet.noneOf(TaskField.class);

        private String name;
        private String description;
        private TaskStatus status;
        private String number;
        private Boolean leaf;
        private Long rootId;
        private Long parentId;
        private LocalDateTime createdTime;
        private LocalDateTime startedTime;
        private LocalDateTime finishedTime;
        private LocalDateTime plannedStartTime;
        private LocalDateTime plannedFinishTime;
        private Double progress;
        private Boolean deleted;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            fields.add(TaskField.NAME);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            fields.add(TaskField.DESCRIPTION);
            return this;
        }

        public Builder status(TaskStatus status) {
            if (status == null) {
                throw new IllegalArgumentException("Task status cannot be null");
            }
            this.status = status;
            fields.add(TaskField.STATUS);
            return this;
        }

        public Builder number(String number) {
            if (number == null) {
                throw new IllegalArgumentException("Task number cannot be null");
            }
            this.number = number;
            fields.add(TaskField.NUMBER);
            return this;
        }

        public Builder leaf(boolean leaf) {
            this.leaf = leaf;
            fields.add(TaskField.LEAF);
            return this;
        }

        public Builder rootId(long rootId) {
            this.rootId = rootId;
            fields.add(TaskField.ROOT_ID);
            return this;
        }

        public Builder parentId(long parentId) {
            this.parentId = parentId;
            fields.add(TaskField.PARENT_ID);
            return this;
        }

        public Builder createdTime(LocalDateTime createdTime) {
            if (createdTime == null) {
                throw new IllegalArgumentException("Created time cannot be null");
            }
            this.createdTime = createdTime;
            fields.add(TaskField.CREATED_TIME);
            return this;
        }

        public Builder startedTime(LocalDateTime startedTime) {
            this.startedTime = startedTime;
            fields.add(TaskField.STARTED_TIME);
            return this;
        }

        public Builder finishedTime(LocalDateTime finishedTime) {
            this.finishedTime = finishedTime;
            fields.add(TaskField.FINISHED_TIME);
            return this;
        }

        public Builder plannedStartTime(LocalDateTime plannedStartTime) {
            this.plannedStartTime = plannedStartTime;
            fields.add(TaskField.PLANNED_START_TIME);
            return this;
        }

        public Builder plannedFinishTime(LocalDateTime plannedFinishTime) {
            this.plannedFinishTime = plannedFinishTime;
            fields.add(TaskField.PLANNED_FINISH_TIME);
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            fields.add(TaskField.PROGRESS);
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
            fields.add(TaskField.DELETED);
            return this;
        }

        private void copy(Task task, TaskField field) {
            switch (field) {
                case NAME:
                    name(task.getName());
                    break;
                case DESCRIPTION:
                    description(task.getDescription());
                    break;
                case STATUS:
                    status(task.getStatus());
                    break;
                case NUMBER:
                    number(task.getNumber());
                    break;
                case LEAF:
                    leaf(task.isLeaf());
                    break;
                case ROOT_ID:
                    rootId(task.getRootId());
                    break;
                case PARENT_ID:
                    parentId(task.getParentId());
                    break;
                case CREATED_TIME:
                    createdTime(task.getCreatedTime());
                    break;
                case STARTED_TIME:
                    startedTime(task.getStartedTime());
                    break;
                case FINISHED_TIME:
                    finishedTime(task.getFinishedTime());
                    break;
                case PLANNED_START_TIME:
                    plannedStartTime(task.getPlannedStartTime());
                    break;
                case PLANNED_FINISH_TIME:
                    plannedFinishTime(task.getPlannedFinishTime());
                    break;
                case PROGRESS:
                    progress(task.getProgress());
                    break;
                case DELETED:
                    deleted(task.isDeleted());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported task field: " + field);
            }
        }

        public TaskUpdate build() {
            if (fields.isEmpty()) {
                throw new IllegalStateException("Task update must set at least one field");
            }
            return new TaskUpdate(this, false);
        }
    }
}
