package com.tencent.taskmgr.infrastructure.persistence.task.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * TaskDO - 任务数据对象
 * <p>
 * 时间字段经 {@link com.tencent.taskmgr.infrastructure.persistence.typehandler.Iso8601LocalDateTimeTypeHandler}
 * 以 ISO-8601 文本落库。
 * </p>
 *
 * @author taskmgr
 */
@Data
@TableName("tasks")
public class TaskDO {

    /**
     * 主键ID（自增）
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    private String description;

    /**
     * 状态编码：created / started / finished
     */
    private String status;

    /**
     * 乐观锁版本号，只通过 version = version + 1 递增
     */
    private Integer version;

    /**
     * 层级编号
     */
    private String number;

    private Boolean isLeaf;

    private Long rootId;

    /**
     * 父任务ID，0 表示根任务
     */
    private Long parentId;

    private LocalDateTime createdTime;

    private LocalDateTime updatedTime;

    private LocalDateTime startedTime;

    private LocalDateTime finishedTime;

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;

    private Double progress;

    /**
     * 逻辑删除标记
     */
    private Boolean deleted;
}
