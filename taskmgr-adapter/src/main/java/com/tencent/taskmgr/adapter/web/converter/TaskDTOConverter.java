package com.tencent.taskmgr.adapter.web.converter;

import com.tencent.taskmgr.client.dto.TaskDTO;
import com.tencent.taskmgr.domain.task.Task;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * TaskDTOConverter - 任务领域对象转对外视图
 *
 * @author taskmgr
 */
public class TaskDTOConverter {

    private TaskDTOConverter() {
    }

    public static TaskDTO toDTO(Task task) {
        if (task == null) {
            return null;
        }

        TaskDTO dto = new TaskDTO();
        dto.setId(task.getId());
        dto.setName(task.getName());
        dto.setDescription(task.getDescription());
        dto.setStatus(task.getStatus().getCode());
        dto.setVersion(task.getVersion());
        dto.setNumber(task.getNumber());
        dto.setLeaf(task.isLeaf());
        dto.setRootId(task.getRootId());
        dto.setParentId(task.getParentId());
        dto.setCreatedTime(task.getCreatedTime());
        dto.setUpdatedTime(task.getUpdatedTime());
        dto.setStartedTime(task.getStartedTime());
        dto.setFinishedTime(task.getFinishedTime());
        dto.setPlannedStartTime(task.getPlannedStartTime());
        dto.setPlannedFinishTime(task.getPlannedFinishTime());
        Duration planned = task.getPlannedDuration();
        dto.setPlannedDurationSeconds(planned == null ? null : planned.getSeconds());
        dto.setProgress(task.getProgress());
        return dto;
    }

    public static List<TaskDTO> toDTOList(List<Task> tasks) {
        return tasks.stream()
            .map(TaskDTOConverter::toDTO)
            .collect(Collectors.toList());
    }
}
