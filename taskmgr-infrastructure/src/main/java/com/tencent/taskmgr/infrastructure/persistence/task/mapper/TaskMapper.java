package com.tencent.taskmgr.infrastructure.persistence.task.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskmgr.infrastructure.persistence.task.entity.TaskDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Update;

/**
 * TaskMapper - 任务Mapper
 *
 * @author taskmgr
 */
@Mapper
public interface TaskMapper extends BaseMapper<TaskDO> {

    /**
     * 物理清空任务表并重置自增序列，下一个任务 id 从 1 开始
     */
    @Update("TRUNCATE TABLE tasks RESTART IDENTITY")
    void truncate();
}
