package com.tencent.taskmgr.domain.exception;

import lombok.Getter;

/**
 * 任务不存在或已被逻辑删除
 *
 * @author taskmgr
 */
@Getter
public class TaskNotFoundException extends TaskException {

    private static final long serialVersionUID = -2203881796612384502L;

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super(TaskErrorCode.TASK_NOT_FOUND, "Task id=" + taskId + " not found");
        this.taskId = taskId;
    }
}
