package com.tencent.taskmgr.infrastructure.store;

import com.tencent.taskmgr.domain.task.Task;
import com.tencent.taskmgr.infrastructure.config.TaskStoreProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ProjectStoreRegistryTest {

    @Autowired
    private ProjectStoreRegistry registry;

    @Autowired
    private TaskStoreProperties properties;

    @Test
    void propertiesBoundFromApplicationYml() {
        assertThat(properties.getMode()).isEqualTo(TaskStoreProperties.StoreMode.MEMORY);
        assertThat(properties.getDataDirName()).isEqualTo(".taskmgr");
    }

    @Test
    void projectsAreIsolated() {
        String alpha = "/projects/alpha-" + UUID.randomUUID();
        String beta = "/projects/beta-" + UUID.randomUUID();

        registry.open(alpha).inTransaction(s -> s.taskTree().createRoot(Task.builder().name("Alpha").build()));

        assertThat(registry.open(alpha).tasks().findRootsByNamePrefix("")).hasSize(1);
        assertThat(registry.open(beta).tasks().findRootsByNamePrefix("")).isEmpty();
        assertThat(registry.open(alpha)).isSameAs(registry.open(alpha + "/."));

        registry.close(alpha);
        registry.close(beta);
        assertThat(registry.isOpen(alpha)).isFalse();
    }

    @Test
    void blankProjectDirRejected() {
        assertThatThrownBy(() -> registry.open(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileModePersistsAcrossReopen(@TempDir Path projectDir) {
        TaskStoreProperties fileProperties = new TaskStoreProperties();
        ProjectStoreRegistry fileRegistry = new ProjectStoreRegistry(fileProperties);
        String dir = projectDir.toString();

        ProjectStore store = fileRegistry.open(dir);
        assertThat(store.getJdbcUrl()).startsWith("jdbc:h2:file:");
        Task root = store.inTransaction(s -> s.taskTree().createRoot(Task.builder().name("Persisted").build()));
        fileRegistry.close(dir);
        assertThat(store.isClosed()).isTrue();

        Path databaseFile = fileRegistry.resolveDatabasePath(dir).resolveSibling("taskmgr.mv.db");
        assertThat(Files.exists(databaseFile)).isTrue();

        ProjectStore reopened = fileRegistry.open(dir);
        assertThat(reopened.tasks().findById(root.getId())).map(Task::getName).contains("Persisted");
        fileRegistry.closeAll();
    }
}
