package com.tencent.taskmgr.domain.exception;

/**
 * 同一任务树中已存在未删除的同编号任务
 *
 * @author taskmgr
 */
public class DuplicateTaskNumberException extends TaskPreconditionException {

    private static final long serialVersionUID = -5027114471869120335L;

    public DuplicateTaskNumberException(long rootId, String number) {
        super(TaskErrorCode.DUPLICATE_TASK_NUMBER,
            "Task number " + number + " already exists under root task id=" + rootId);
    }
}
