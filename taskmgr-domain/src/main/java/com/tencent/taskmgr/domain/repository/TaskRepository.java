package com.tencent.taskmgr.domain.repository;

import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * TaskRepository - 任务仓储接口
 * <p>
 * 负责单个项目任务表的持久化。所有查询都排除已逻辑删除的任务，列表按 number 字符串字典序排列。
 * 仓储本身不管理事务，多语句操作由调用方包裹事务。
 * </p>
 *
 * @author taskmgr
 */
public interface TaskRepository {

    Optional<Task> findById(long id);

    /**
     * 按编号查找任务树中的非根任务；根任务只按 id 寻址
     */
    Optional<Task> findByRootIdAndNumber(long rootId, String number);

    /**
     * 查找直接子任务；parentId 为 0 时返回所有根任务
     */
    List<Task> findByParentId(long parentId);

    /**
     * 查找整棵任务树（含根任务）
     */
    List<Task> findByRootId(long rootId);

    List<Task> findLeaves(long rootId);

    /**
     * 按名称前缀查找根任务，大小写不敏感，按名称排序
     *
     * @param prefix 名称前缀，空串匹配全部根任务
     */
    List<Task> findRootsByNamePrefix(String prefix);

    /**
     * 查找一批父任务的未删除子任务ID
     */
    List<Long> findChildIds(Collection<Long> parentIds);

    /**
     * 插入任务并回填 id。
     * <p>
     * 根任务随后把 rootId 写为自身 id；非根任务把父任务标记为非叶子。
     * </p>
     */
    void insert(Task task);

    /**
     * 按更新请求写入字段，同时刷新 updatedTime。
     * 成功后将写入的值同步到 task，带版本更新时 task 的 version 加一。
     *
     * @throws com.tencent.taskmgr.domain.exception.TaskUpdateConflictException 未命中任何行
     */
    void update(Task task, TaskUpdate update);

    /**
     * 将给定任务标记为已删除（单条语句）
     */
    int markDeleted(Collection<Long> ids);

    /**
     * 将所有任务标记为已删除
     */
    int markAllDeleted();

    /**
     * 物理清空任务表并重置自增序列
     */
    void purge();
}
