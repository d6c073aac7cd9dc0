package com.tencent.taskmgr.domain.service;

import com.tencent.taskmgr.domain.exception.DuplicateTaskNumberException;
import com.tencent.taskmgr.domain.exception.TaskPreconditionException;
import com.tencent.taskmgr.domain.repository.TaskRepository;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskNumber;
import com.tencent.taskmgr.domain.task.TaskSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TaskTreeAssembler - 任务树批量组装
 * <p>
 * 两种入口：
 * <ul>
 *   <li>嵌套规格：每个 {@link TaskSpec} 节点创建一个任务，is_leaf 取自规格中是否有子节点</li>
 *   <li>编号路径：如 "1.2.3"，从根任务向下查找，缺失的中间节点自动创建并命名为 "Task 1.2"</li>
 * </ul>
 * 组装过程由多条插入组成，调用方应包裹在同一事务中，避免出现半棵树。
 * </p>
 *
 * @author taskmgr
 */
@Slf4j
public class TaskTreeAssembler {

    private static final String AUTO_NAME_PREFIX = "Task ";

    private final TaskRepository repository;
    private final TaskTreeService taskTreeService;

    public TaskTreeAssembler(TaskRepository repository, TaskTreeService taskTreeService) {
        this.repository = repository;
        this.taskTreeService = taskTreeService;
    }

    /**
     * 以规格根节点创建一棵新任务树
     *
     * @return 新根任务
     */
    public Task createTree(TaskSpec spec) {
        Task root = taskTreeService.createRoot(fromSpec(spec));
        insertChildren(root, spec);
        return root;
    }

    /**
     * 将规格整体挂到已有任务下，规格根节点取父任务下一个可用编号
     *
     * @return 规格根节点对应的任务
     */
    public Task attachTree(long parentId, TaskSpec spec) {
        Task node = taskTreeService.attachChild(parentId, fromSpec(spec));
        insertChildren(node, spec);
        return node;
    }

    /**
     * 按编号路径添加子任务，缺失的中间节点自动创建
     *
     * @param rootId 根任务ID
     * @param number 编号路径，如 "1.2.3"
     * @param name   目标任务名称
     * @throws com.tencent.taskmgr.domain.exception.InvalidTaskNumberException 编号中存在非整数段
     * @throws DuplicateTaskNumberException 目标编号已存在
     */
    public Task addNumbered(long rootId, String number, String name) {
        return addNumbered(rootId, number, name, "");
    }

    public Task addNumbered(long rootId, String number, String name, String description) {
        Task root = taskTreeService.require(rootId);
        if (!root.isRoot()) {
            throw new TaskPreconditionException("Task id=" + rootId + " is not a root task");
        }
        List<Integer> levels = TaskNumber.parse(number);
        String fullNumber = TaskNumber.format(levels);
        if (repository.findByRootIdAndNumber(rootId, fullNumber).isPresent()) {
            throw new DuplicateTaskNumberException(rootId, fullNumber);
        }

        Task parent = root;
        for (int depth = 1; depth < levels.size(); depth++) {
            String partial = TaskNumber.format(levels.subList(0, depth));
            Optional<Task> existing = repository.findByRootIdAndNumber(rootId, partial);
            if (existing.isPresent()) {
                parent = existing.get();
            } else {
                parent = taskTreeService.attachChild(parent.getId(), Task.builder()
                    .name(AUTO_NAME_PREFIX + partial)
                    .number(partial)
                    .build());
                log.debug("Auto-created intermediate task number={} under root id={}", partial, rootId);
            }
        }
        return taskTreeService.attachChild(parent.getId(), Task.builder()
            .name(name)
            .description(description == null ? "" : description)
            .number(fullNumber)
            .build());
    }

    /**
     * 批量按编号路径添加，按给定顺序依次插入
     *
     * @param numberedNames 编号到名称的有序映射
     */
    public List<Task> addSubTasks(long rootId, Map<String, String> numberedNames) {
        List<Task> created = new ArrayList<>(numberedNames.size());
        for (Map.Entry<String, String> entry : numberedNames.entrySet()) {
            created.add(addNumbered(rootId, entry.getKey(), entry.getValue()));
        }
        return created;
    }

    private void insertChildren(Task parent, TaskSpec spec) {
        if (!spec.hasChildren()) {
            return;
        }
        int index = 1;
        for (TaskSpec childSpec : spec.getChildren()) {
            Task child = fromSpec(childSpec);
            child.setNumber(TaskNumber.childOf(parent, index++));
            taskTreeService.attachChild(parent.getId(), child);
            insertChildren(child, childSpec);
        }
    }

    private static Task fromSpec(TaskSpec spec) {
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new TaskPreconditionException("Task name must not be blank");
        }
        return Task.builder()
            .name(spec.getName())
            .description(spec.getDescription() == null ? "" : spec.getDescription())
            .plannedStartTime(spec.getPlannedStartTime())
            .plannedFinishTime(spec.getPlannedFinishTime())
            .leaf(!spec.hasChildren())
            .build();
    }
}
