package com.tencent.taskmgr.domain.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Task - 任务（任务树节点）
 * <p>
 * 项目任务森林中的一个节点。根任务的 parentId 为 0 且 rootId 等于自身 id；
 * 叶子任务承载执行状态与进度，非叶子任务的状态和进度由子任务推导。
 * </p>
 *
 * @author taskmgr
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    /**
     * 没有父任务时 parentId 的取值
     */
    public static final long NO_PARENT = 0L;

    /**
     * 主键ID，创建前为 null
     */
    private Long id;

    /**
     * 任务名称
     */
    @Builder.Default
    private String name = "";

    /**
     * 任务描述
     */
    @Builder.Default
    private String description = "";

    /**
     * 执行状态
     */
    @Builder.Default
    private TaskStatus status = TaskStatus.CREATED;

    /**
     * 乐观锁版本号，从 1 开始
     */
    @Builder.Default
    private int version = 1;

    /**
     * 层级编号，如 "1.2.3"
     */
    @Builder.Default
    private String number = "";

    /**
     * 是否叶子任务
     */
    @Builder.Default
    private boolean leaf = true;

    /**
     * 根任务ID
     */
    @Builder.Default
    private long rootId = NO_PARENT;

    /**
     * 父任务ID，0 表示根任务
     */
    @Builder.Default
    private long parentId = NO_PARENT;

    @Builder.Default
    private LocalDateTime createdTime = LocalDateTime.now();

    @Builder.Default
    private LocalDateTime updatedTime = LocalDateTime.now();

    private LocalDateTime startedTime;

    private LocalDateTime finishedTime;

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;

    /**
     * 完成进度，取值 [0.0, 1.0]
     */
    @Builder.Default
    private double progress = 0.0;

    /**
     * 逻辑删除标记
     */
    @Builder.Default
    private boolean deleted = false;

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    /**
     * 计划持续时间，计划开始或计划完成时间缺失时返回 null
     */
    public Duration getPlannedDuration() {
        if (plannedStartTime == null || plannedFinishTime == null) {
            return null;
        }
        return Duration.between(plannedStartTime, plannedFinishTime);
    }

    /**
     * 按计划开始时间推算计划完成时间；没有计划开始时间时忽略
     */
    public void setPlannedDuration(Duration duration) {
        if (plannedStartTime != null && duration != null && !duration.isZero()) {
            this.plannedFinishTime = plannedStartTime.plus(duration);
        }
    }

    /**
     * 将更新请求中的字段值写回实体
     */
    public void apply(TaskUpdate update) {
        for (TaskField field : update.getFields()) {
            switch (field) {
                case NAME:
                    this.name = update.getName();
                    break;
                case DESCRIPTION:
                    this.description = update.getDescription();
                    break;
                case STATUS:
                    this.status = update.getStatus();
                    break;
                case NUMBER:
                    this.number = update.getNumber();
                    break;
                case LEAF:
                    this.leaf = update.getLeaf();
                    break;
                case ROOT_ID:
                    this.rootId = update.getRootId();
                    break;
                case PARENT_ID:
                    this.parentId = update.getParentId();
                    break;
                case CREATED_TIME:
                    this.createdTime = update.getCreatedTime();
                    break;
                case STARTED_TIME:
                    this.startedTime = update.getStartedTime();
                    break;
                case FINISHED_TIME:
                    this.finishedTime = update.getFinishedTime();
                    break;
                case PLANNED_START_TIME:
                    this.plannedStartTime = update.getPlannedStartTime();
                    break;
                case PLANNED_FINISH_TIME:
                    this.plannedFinishTime = update.getPlannedFinishTime();
                    break;
                case PROGRESS:
                    this.progress = update.getProgress();
                    break;
                case DELETED:
                    this.deleted = update.getDeleted();
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported task field: " + field);
            }
        }
    }
}
