package com.tencent.taskmgr.infrastructure.persistence.task.converter;

import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskStatus;
import com.tencent.taskmgr.infrastructure.persistence.task.entity.TaskDO;

/**
 * TaskConverter - 任务转换器
 * <p>
 * 负责领域对象与数据对象之间的转换
 * </p>
 *
 * @author taskmgr
 */
public class TaskConverter {

    private TaskConverter() {
    }

    /**
     * 领域对象转数据对象
     */
    public static TaskDO toDataObject(Task domain) {
        if (domain == null) {
            return null;
        }

        TaskDO dataObject = new TaskDO();
        dataObject.setId(domain.getId());
        dataObject.setName(domain.getName());
        dataObject.setDescription(domain.getDescription() == null ? "" : domain.getDescription());
        dataObject.setStatus(domain.getStatus().getCode());
        dataObject.setVersion(domain.getVersion());
        dataObject.setNumber(domain.getNumber() == null ? "" : domain.getNumber());
        dataObject.setIsLeaf(domain.isLeaf());
        dataObject.setRootId(domain.getRootId());
        dataObject.setParentId(domain.getParentId());
        dataObject.setCreatedTime(domain.getCreatedTime());
        dataObject.setUpdatedTime(domain.getUpdatedTime());
        dataObject.setStartedTime(domain.getStartedTime());
        dataObject.setFinishedTime(domain.getFinishedTime());
        dataObject.setPlannedStartTime(domain.getPlannedStartTime());
        dataObject.setPlannedFinishTime(domain.getPlannedFinishTime());
        dataObject.setProgress(domain.getProgress());
        dataObject.setDeleted(domain.isDeleted());
        return dataObject;
    }

    /**
     * 数据对象转领域对象，缺省列按建表默认值补齐
     */
    public static Task toDomain(TaskDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        Task domain = new Task();
        domain.setId(dataObject.getId());
        domain.setName(dataObject.getName());
        domain.setDescription(dataObject.getDescription() == null ? "" : dataObject.getDescription());
        domain.setStatus(dataObject.getStatus() == null ? TaskStatus.CREATED : TaskStatus.fromCode(dataObject.getStatus()));
        domain.setVersion(dataObject.getVersion() == null ? 1 : dataObject.getVersion());
        domain.setNumber(dataObject.getNumber());
        domain.setLeaf(Boolean.TRUE.equals(dataObject.getIsLeaf()));
        domain.setRootId(dataObject.getRootId() == null ? Task.NO_PARENT : dataObject.getRootId());
        domain.setParentId(dataObject.getParentId() == null ? Task.NO_PARENT : dataObject.getParentId());
        domain.setCreatedTime(dataObject.getCreatedTime());
        domain.setUpdatedTime(dataObject.getUpdatedTime());
        domain.setStartedTime(dataObject.getStartedTime());
        domain.setFinishedTime(dataObject.getFinishedTime());
        domain.setPlannedStartTime(dataObject.getPlannedStartTime());
        domain.setPlannedFinishTime(dataObject.getPlannedFinishTime());
        domain.setProgress(dataObject.getProgress() == null ? 0.0 : dataObject.getProgress());
        domain.setDeleted(Boolean.TRUE.equals(dataObject.getDeleted()));
        return domain;
    }
}
