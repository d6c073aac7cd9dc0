package com.tencent.taskmgr.app.dto;

import lombok.Data;

import java.util.List;

/**
 * YAML 中的任务节点，children 递归嵌套
 */
@Data
public class TaskNodeYamlDto {
    private String name;
    private String description;
    private String plannedStartTime;
    private String plannedFinishTime;
    private List<TaskNodeYamlDto> children;
}
