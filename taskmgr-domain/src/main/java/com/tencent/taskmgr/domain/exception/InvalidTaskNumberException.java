package com.tencent.taskmgr.domain.exception;

/**
 * 编号中存在非整数段
 *
 * @author taskmgr
 */
public class InvalidTaskNumberException extends TaskPreconditionException {

    private static final long serialVersionUID = 1893520374627301176L;

    public InvalidTaskNumberException(String number) {
        super(TaskErrorCode.INVALID_TASK_NUMBER, "Invalid task number: " + number);
    }

    public InvalidTaskNumberException(String number, Throwable cause) {
        super(TaskErrorCode.INVALID_TASK_NUMBER, "Invalid task number: " + number, cause);
    }
}
