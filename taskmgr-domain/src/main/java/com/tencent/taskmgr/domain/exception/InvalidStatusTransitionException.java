package com.tencent.taskmgr.domain.exception;

import com.tencent.taskmgr.domain.task.TaskStatus;
import lombok.Getter;

/**
 * 请求的状态不能从当前状态到达
 *
 * @author taskmgr
 */
@Getter
public class InvalidStatusTransitionException extends TaskException {

    private static final long serialVersionUID = 6054214720961138374L;

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidStatusTransitionException(long taskId, TaskStatus from, TaskStatus to) {
        super(TaskErrorCode.INVALID_STATUS_TRANSITION,
            "Cannot transition Task id=" + taskId + " from " + from.getCode() + " to " + to.getCode());
        this.from = from;
        this.to = to;
    }
}
