package com.tencent.taskmgr.domain.task;

/**
 * TaskField - 可更新的任务字段
 * <p>
 * id、version、updatedTime 不在其中：version 只由乐观锁路径递增，updatedTime 每次更新自动刷新。
 * </p>
 *
 * @author taskmgr
 */
public enum TaskField {
    NAME,
    DESCRIPTION,
    STATUS,
    NUMBER,
    LEAF,
    ROOT_ID,
    PARENT_ID,
    CREATED_TIME,
    STARTED_TIME,
    FINISHED_TIME,
    PLANNED_START_TIME,
    PLANNED_FINISH_TIME,
    PROGRESS,
    DELETED
}
