package com.tencent.taskmgr.adapter.web;

import com.tencent.taskmgr.app.service.TaskAppService;
import com.tencent.taskmgr.client.dto.Response;
import com.tencent.taskmgr.client.dto.SingleResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 项目级元数据与存储生命周期
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectMetadataController {

    private final TaskAppService taskAppService;

    @GetMapping("/metadata/{key}")
    public SingleResponse<String> get(@RequestParam String projectDir, @PathVariable String key) {
        return taskAppService.getMetadata(projectDir, key)
            .map(SingleResponse::of)
            .orElseGet(SingleResponse::empty);
    }

    @PutMapping("/metadata/{key}")
    public Response put(@RequestParam String projectDir, @PathVariable String key, @RequestBody String value) {
        taskAppService.setMetadata(projectDir, key, value);
        return Response.buildSuccess();
    }

    /**
     * 关闭项目存储，下次访问时重新打开
     */
    @DeleteMapping("/store")
    public Response close(@RequestParam String projectDir) {
        taskAppService.closeProject(projectDir);
        return Response.buildSuccess();
    }
}
