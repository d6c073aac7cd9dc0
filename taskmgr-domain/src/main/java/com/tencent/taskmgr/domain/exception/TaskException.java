package com.tencent.taskmgr.domain.exception;

import lombok.Getter;

/**
 * TaskException - 任务领域异常基类
 * <p>
 * 所有任务操作失败都以此类的子类抛给直接调用方，不做内部重试。
 * </p>
 *
 * @author taskmgr
 */
@Getter
public class TaskException extends RuntimeException {

    private static final long serialVersionUID = 4471093288502541907L;

    private final TaskErrorCode code;

    public TaskException(TaskErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TaskException(TaskErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message='" + getMessage() + "'}";
    }
}
