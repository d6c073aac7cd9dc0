package com.tencent.taskmgr.domain.exception;

import lombok.Getter;

/**
 * TaskUpdateConflictException - 更新未命中任何行
 * <p>
 * 带版本条件时既可能是任务不存在，也可能是版本已被并发修改，两者不作区分。
 * 调用方需重新读取后自行重试。
 * </p>
 *
 * @author taskmgr
 */
@Getter
public class TaskUpdateConflictException extends TaskException {

    private static final long serialVersionUID = 2918046307516920513L;

    private final long taskId;
    private final boolean versioned;

    public TaskUpdateConflictException(long taskId, boolean versioned) {
        super(TaskErrorCode.UPDATE_CONFLICT, versioned
            ? "Task update failed (id=" + taskId + " not found or version mismatch)"
            : "Task update failed (id=" + taskId + " not found)");
        this.taskId = taskId;
        this.versioned = versioned;
    }
}
