package com.tencent.taskmgr.infrastructure.store;

import com.tencent.taskmgr.infrastructure.config.TaskStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ProjectStoreRegistry - 项目存储注册表
 * <p>
 * 以项目目录的规范化绝对路径为键缓存已打开的 {@link ProjectStore}，
 * 由 Spring 容器持有，容器关闭时关闭全部存储。
 * </p>
 *
 * @author taskmgr
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectStoreRegistry implements DisposableBean {

    private final TaskStoreProperties properties;

    private final Map<String, ProjectStore> stores = new ConcurrentHashMap<>();

    /**
     * 返回项目的存储，首次访问时创建数据目录、建表并登记
     *
     * @param projectDir 项目目录
     */
    public ProjectStore open(String projectDir) {
        return stores.computeIfAbsent(projectKey(projectDir), this::createStore);
    }

    public boolean isOpen(String projectDir) {
        return stores.containsKey(projectKey(projectDir));
    }

    /**
     * 关闭并移除项目存储，未打开时忽略
     */
    public void close(String projectDir) {
        ProjectStore store = stores.remove(projectKey(projectDir));
        if (store != null) {
            store.close();
        }
    }

    public void closeAll() {
        List<String> keys = new ArrayList<>(stores.keySet());
        for (String key : keys) {
            ProjectStore store = stores.remove(key);
            if (store != null) {
                store.close();
            }
        }
    }

    /**
     * 项目库文件路径（不含 H2 扩展名）
     */
    public Path resolveDatabasePath(String projectDir) {
        return Paths.get(projectKey(projectDir))
            .resolve(properties.getDataDirName())
            .resolve(properties.getDatabaseName());
    }

    @Override
    public void destroy() {
        log.info("Closing {} project store(s)", stores.size());
        closeAll();
    }

    private ProjectStore createStore(String projectKey) {
        return new ProjectStore(projectKey, jdbcUrl(projectKey), properties);
    }

    private String jdbcUrl(String projectKey) {
        if (properties.getMode() == TaskStoreProperties.StoreMode.MEMORY) {
            return "jdbc:h2:mem:" + memoryDatabaseName(projectKey) + ";DB_CLOSE_DELAY=-1";
        }
        Path databasePath = resolveDatabasePath(projectKey);
        try {
            Files.createDirectories(databasePath.getParent());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create data directory " + databasePath.getParent(), e);
        }
        return "jdbc:h2:file:" + databasePath;
    }

    private static String memoryDatabaseName(String projectKey) {
        String sanitized = projectKey.replaceAll("[^A-Za-z0-9]", "_");
        if (sanitized.length() > 64) {
            sanitized = sanitized.substring(sanitized.length() - 64);
        }
        return sanitized + "_" + Integer.toHexString(projectKey.hashCode());
    }

    private static String projectKey(String projectDir) {
        if (projectDir == null || projectDir.isBlank()) {
            throw new IllegalArgumentException("Project directory must not be blank");
        }
        return Paths.get(projectDir).toAbsolutePath().normalize().toString();
    }
}
