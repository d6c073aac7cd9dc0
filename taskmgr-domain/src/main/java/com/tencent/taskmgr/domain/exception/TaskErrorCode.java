package com.tencent.taskmgr.domain.exception;

import lombok.Getter;

/**
 * TaskErrorCode - 任务错误码
 *
 * @author taskmgr
 */
@Getter
public enum TaskErrorCode {

    /** 任务不存在或已删除 */
    TASK_NOT_FOUND("任务不存在"),

    /** 状态迁移不合法 */
    INVALID_STATUS_TRANSITION("状态迁移不合法"),

    /** 前置条件不满足 */
    PRECONDITION_FAILED("前置条件不满足"),

    /** 乐观锁更新未命中任何行 */
    UPDATE_CONFLICT("更新冲突"),

    /** 编号格式错误 */
    INVALID_TASK_NUMBER("编号格式错误"),

    /** 同一任务树中编号重复 */
    DUPLICATE_TASK_NUMBER("编号重复");

    private final String info;

    TaskErrorCode(String info) {
        this.info = info;
    }
}
