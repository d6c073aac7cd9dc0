package com.tencent.taskmgr.domain.task;

/**
 * TaskStatus - 任务状态枚举
 * <p>
 * 状态只能前进：created → started → finished。
 * created 允许直接跳到 finished。
 * </p>
 *
 * @author taskmgr
 */
public enum TaskStatus {

    /**
     * 已创建
     */
    CREATED("created"),

    /**
     * 执行中
     */
    STARTED("started"),

    /**
     * 已完成（终态）
     */
    FINISHED("finished");

    private final String code;

    TaskStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 是否允许从当前状态迁移到目标状态
     */
    public boolean canTransitionTo(TaskStatus target) {
        switch (this) {
            case CREATED:
                return target == STARTED || target == FINISHED;
            case STARTED:
                return target == FINISHED;
            default:
                return false;
        }
    }

    public static TaskStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
