package com.tencent.taskmgr.client.dto;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * TaskDTO - 任务对外视图
 *
 * @author taskmgr
 */
@Data
public class TaskDTO implements Serializable {

    private static final long serialVersionUID = -3920138745517640918L;

    private Long id;

    private String name;

    private String description;

    /**
     * created / started / finished
     */
    private String status;

    private int version;

    private String number;

    private boolean leaf;

    private long rootId;

    private long parentId;

    private LocalDateTime createdTime;

    private LocalDateTime updatedTime;

    private LocalDateTime startedTime;

    private LocalDateTime finishedTime;

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;

    /**
     * 计划持续秒数，计划时间不完整时为 null
     */
    private Long plannedDurationSeconds;

    private double progress;
}
