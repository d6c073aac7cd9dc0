package com.tencent.taskmgr.app.command;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * UpdateTaskCommand - 任务字段更新命令
 * <p>
 * 只更新非空字段。指定 expectedVersion 时走乐观锁路径，版本不一致则更新失败；
 * 状态和进度不在此更新，分别走状态机和进度汇总。
 * </p>
 *
 * @author taskmgr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskCommand {

    @NotNull(message = "任务ID不能为空")
    private Long id;

    /**
     * 调用方读取时的版本号
     */
    @Positive(message = "版本号必须为正数")
    private Integer expectedVersion;

    @Size(min = 1, max = 1024, message = "任务名称长度不合法")
    private String name;

    private String description;

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;

    /**
     * 计划持续分钟数，按计划开始时间推算计划完成时间
     */
    @Positive(message = "计划持续时间必须为正数")
    private Long plannedDurationMinutes;

    public boolean hasChanges() {
        return name != null || description != null || plannedStartTime != null
            || plannedFinishTime != null || plannedDurationMinutes != null;
    }
}
