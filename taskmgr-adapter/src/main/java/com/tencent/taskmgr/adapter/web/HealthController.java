package com.tencent.taskmgr.adapter.web;

import com.tencent.taskmgr.client.dto.Response;
import com.tencent.taskmgr.client.dto.SingleResponse;
import com.tencent.taskmgr.infrastructure.store.ProjectStoreRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康检查，可选查询某个项目存储是否已打开
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final ProjectStoreRegistry storeRegistry;

    @GetMapping("/health")
    public Response health() {
        return Response.buildSuccess();
    }

    @GetMapping("/health/project")
    public SingleResponse<Boolean> projectOpen(@RequestParam String projectDir) {
        return SingleResponse.of(storeRegistry.isOpen(projectDir));
    }
}
