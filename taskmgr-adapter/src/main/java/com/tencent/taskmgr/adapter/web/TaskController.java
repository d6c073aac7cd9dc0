package com.tencent.taskmgr.adapter.web;

import com.tencent.taskmgr.adapter.web.converter.TaskDTOConverter;
import com.tencent.taskmgr.app.command.CreateTaskCommand;
import com.tencent.taskmgr.app.command.UpdateTaskCommand;
import com.tencent.taskmgr.app.service.TaskAppService;
import com.tencent.taskmgr.client.dto.MultiResponse;
import com.tencent.taskmgr.client.dto.Response;
import com.tencent.taskmgr.client.dto.SingleResponse;
import com.tencent.taskmgr.client.dto.TaskDTO;
import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.domain.task.TaskStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TaskController - 任务接口
 * <p>
 * 所有接口以 projectDir 参数指定项目，结果包装为 SingleResponse / MultiResponse。
 * </p>
 *
 * @author taskmgr
 */
@RestController
@RequestMapping("/api/projects/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskAppService taskAppService;

    // ==================== 创建 ====================

    @PostMapping
    public SingleResponse<TaskDTO> createRoot(@RequestParam String projectDir,
                                              @Valid @RequestBody CreateTaskCommand command) {
        return single(taskAppService.createRootTask(projectDir, command));
    }

    @PostMapping("/{parentId}/children")
    public SingleResponse<TaskDTO> attachChild(@RequestParam String projectDir,
                                               @PathVariable long parentId,
                                               @Valid @RequestBody CreateTaskCommand command) {
        return single(taskAppService.attachChild(projectDir, parentId, command));
    }

    @PostMapping("/{rootId}/subtasks")
    public SingleResponse<TaskDTO> addSubTask(@RequestParam String projectDir,
                                              @PathVariable long rootId,
                                              @RequestParam String number,
                                              @RequestParam String name) {
        return single(taskAppService.addSubTask(projectDir, rootId, number, name));
    }

    /**
     * 请求体为编号到名称的映射，按 JSON 中的顺序插入
     */
    @PostMapping("/{rootId}/subtasks/batch")
    public MultiResponse<TaskDTO> addSubTasks(@RequestParam String projectDir,
                                              @PathVariable long rootId,
                                              @RequestBody LinkedHashMap<String, String> numberedNames) {
        return multi(taskAppService.addSubTasks(projectDir, rootId, numberedNames));
    }

    @PostMapping(value = "/tree", consumes = {"application/x-yaml", "application/yaml", MediaType.TEXT_PLAIN_VALUE})
    public SingleResponse<TaskDTO> createTree(@RequestParam String projectDir, @RequestBody String yamlContent) {
        return single(taskAppService.createTaskTreeFromYaml(projectDir, yamlContent));
    }

    // ==================== 查询 ====================

    @GetMapping("/{id}")
    public SingleResponse<TaskDTO> getTask(@RequestParam String projectDir, @PathVariable long id) {
        return single(taskAppService.getTask(projectDir, id));
    }

    @GetMapping("/{rootId}/by-number")
    public SingleResponse<TaskDTO> getTaskByNumber(@RequestParam String projectDir,
                                                   @PathVariable long rootId,
                                                   @RequestParam String number) {
        return taskAppService.getTaskByNumber(projectDir, rootId, number)
            .map(this::single)
            .orElseGet(SingleResponse::empty);
    }

    /**
     * 根任务列表；带 namePrefix 时按名称前缀过滤（大小写不敏感）
     */
    @GetMapping
    public MultiResponse<TaskDTO> listRoots(@RequestParam String projectDir,
                                            @RequestParam(required = false) String namePrefix) {
        if (namePrefix == null) {
            return multi(taskAppService.listRootTasks(projectDir));
        }
        return multi(taskAppService.findRootTasks(projectDir, namePrefix));
    }

    @GetMapping("/{id}/children")
    public MultiResponse<TaskDTO> listChildren(@RequestParam String projectDir, @PathVariable long id) {
        return multi(taskAppService.listChildren(projectDir, id));
    }

    @GetMapping("/{rootId}/tree")
    public MultiResponse<TaskDTO> listTree(@RequestParam String projectDir, @PathVariable long rootId) {
        return multi(taskAppService.listTree(projectDir, rootId));
    }

    @GetMapping("/{rootId}/subtasks")
    public MultiResponse<TaskDTO> listSubTasks(@RequestParam String projectDir, @PathVariable long rootId) {
        return multi(taskAppService.listSubTasks(projectDir, rootId));
    }

    @GetMapping("/{rootId}/leaves")
    public MultiResponse<TaskDTO> listLeaves(@RequestParam String projectDir, @PathVariable long rootId) {
        return multi(taskAppService.listLeaves(projectDir, rootId));
    }

    // ==================== 更新 ====================

    @PatchMapping("/{id}")
    public SingleResponse<TaskDTO> updateTask(@RequestParam String projectDir,
                                              @PathVariable long id,
                                              @RequestBody UpdateTaskCommand command) {
        command.setId(id);
        return single(taskAppService.updateTask(projectDir, command));
    }

    @PutMapping("/{id}/status")
    public SingleResponse<TaskDTO> updateStatus(@RequestParam String projectDir,
                                                @PathVariable long id,
                                                @RequestParam String status) {
        return single(taskAppService.updateStatus(projectDir, id, TaskStatus.fromCode(status)));
    }

    @PostMapping("/{id}/start")
    public SingleResponse<TaskDTO> start(@RequestParam String projectDir, @PathVariable long id) {
        return single(taskAppService.startTask(projectDir, id));
    }

    @PostMapping("/{id}/finish")
    public SingleResponse<TaskDTO> finish(@RequestParam String projectDir, @PathVariable long id) {
        return single(taskAppService.finishTask(projectDir, id));
    }

    @PutMapping("/{id}/progress")
    public SingleResponse<TaskDTO> updateProgress(@RequestParam String projectDir,
                                                  @PathVariable long id,
                                                  @RequestParam double progress) {
        return single(taskAppService.updateProgress(projectDir, id, progress));
    }

    /**
     * 取一个可执行的叶子任务；data 为空表示没有可执行任务
     */
    @PostMapping("/{rootId}/dequeue")
    public SingleResponse<TaskDTO> dequeue(@RequestParam String projectDir, @PathVariable long rootId) {
        return taskAppService.dequeue(projectDir, rootId)
            .map(this::single)
            .orElseGet(SingleResponse::empty);
    }

    // ==================== 删除 ====================

    @DeleteMapping("/{id}")
    public SingleResponse<Integer> delete(@RequestParam String projectDir, @PathVariable long id) {
        return SingleResponse.of(taskAppService.deleteTask(projectDir, id));
    }

    @DeleteMapping
    public SingleResponse<Integer> deleteAll(@RequestParam String projectDir) {
        return SingleResponse.of(taskAppService.deleteAllTasks(projectDir));
    }

    @PostMapping("/clear")
    public Response clear(@RequestParam String projectDir) {
        taskAppService.clearTasks(projectDir);
        return Response.buildSuccess();
    }

    private SingleResponse<TaskDTO> single(Task task) {
        return SingleResponse.of(TaskDTOConverter.toDTO(task));
    }

    private MultiResponse<TaskDTO> multi(List<Task> tasks) {
        return MultiResponse.of(TaskDTOConverter.toDTOList(tasks));
    }
}
