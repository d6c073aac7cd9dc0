package com.tencent.taskmgr.app.command;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * CreateTaskCommand - 创建任务命令
 * <p>
 * 对应 API: POST /api/projects/tasks（根任务）与 POST /api/projects/tasks/{parentId}/children（子任务）
 * </p>
 *
 * @author taskmgr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskCommand {

    /**
     * 任务名称
     */
    @NotBlank(message = "任务名称不能为空")
    @Size(max = 1024, message = "任务名称过长")
    private String name;

    /**
     * 任务描述，可为空
     */
    private String description;

    /**
     * 层级编号；子任务为空时自动取下一个编号，根任务为空时存为空串
     */
    @Size(max = 255, message = "任务编号过长")
    private String number;

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;
}
