package com.tencent.taskmgr.domain.exception;

/**
 * 前置条件不满足：叶子任务限定操作作用于非叶子任务、进度越界等
 *
 * @author taskmgr
 */
public class TaskPreconditionException extends TaskException {

    private static final long serialVersionUID = -7310518850148230917L;

    public TaskPreconditionException(String message) {
        super(TaskErrorCode.PRECONDITION_FAILED, message);
    }

    protected TaskPreconditionException(TaskErrorCode code, String message) {
        super(code, message);
    }

    protected TaskPreconditionException(TaskErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
