package com.tencent.taskmgr.infrastructure.store;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.config.GlobalConfig;
import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.tencent.taskmgr.domain.repository.MetadataRepository;
import com.tencent.taskmgr.domain.repository.TaskRepository;
import com.tencent.taskmgr.domain.service.TaskTreeAssembler;
import com.tencent.taskmgr.domain.service.TaskTreeService;
import com.tencent.taskmgr.infrastructure.config.TaskStoreProperties;
import com.tencent.taskmgr.infrastructure.persistence.metadata.MetadataRepositoryImpl;
import com.tencent.taskmgr.infrastructure.persistence.metadata.mapper.MetadataMapper;
import com.tencent.taskmgr.infrastructure.persistence.task.TaskRepositoryImpl;
import com.tencent.taskmgr.infrastructure.persistence.task.mapper.TaskMapper;
import com.tencent.taskmgr.infrastructure.persistence.typehandler.Iso8601LocalDateTimeTypeHandler;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.type.JdbcType;
import org.mybatis.spring.SqlSessionTemplate;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * ProjectStore - 单个项目的存储句柄
 * <p>
 * 持有该项目的连接池、SqlSessionFactory、事务模板以及绑定其上的仓储和领域服务。
 * 由 {@link ProjectStoreRegistry} 创建和关闭，调用方不直接构造。
 * </p>
 *
 * @author taskmgr
 */
@Slf4j
public class ProjectStore implements AutoCloseable {

    public static final String SCHEMA_VERSION_KEY = "schema_version";

    public static final String SCHEMA_VERSION = "1";

    private static final String SCHEMA_SCRIPT = "schema/taskmgr-schema.sql";

    @Getter
    private final String projectKey;

    @Getter
    private final String jdbcUrl;

    private final HikariDataSource dataSource;
    private final TransactionTemplate transactionTemplate;
    private final TaskRepository taskRepository;
    private final MetadataRepository metadataRepository;
    private final TaskTreeService taskTreeService;
    private final TaskTreeAssembler taskTreeAssembler;

    ProjectStore(String projectKey, String jdbcUrl, TaskStoreProperties properties) {
        this.projectKey = projectKey;
        this.jdbcUrl = jdbcUrl;
        this.dataSource = createDataSource(projectKey, jdbcUrl, properties);
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)).execute(dataSource);

            SqlSessionTemplate sqlSession = new SqlSessionTemplate(buildSqlSessionFactory(dataSource));
            this.taskRepository = new TaskRepositoryImpl(sqlSession.getMapper(TaskMapper.class));
            this.metadataRepository = new MetadataRepositoryImpl(sqlSession.getMapper(MetadataMapper.class));
            this.taskTreeService = new TaskTreeService(taskRepository);
            this.taskTreeAssembler = new TaskTreeAssembler(taskRepository, taskTreeService);
            this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

            runInTransaction(store -> {
                if (store.metadata().get(SCHEMA_VERSION_KEY).isEmpty()) {
                    store.metadata().put(SCHEMA_VERSION_KEY, SCHEMA_VERSION);
                }
            });
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        log.info("Opened project store {} at {}", projectKey, jdbcUrl);
    }

    public TaskRepository tasks() {
        return taskRepository;
    }

    public MetadataRepository metadata() {
        return metadataRepository;
    }

    public TaskTreeService taskTree() {
        return taskTreeService;
    }

    public TaskTreeAssembler assembler() {
        return taskTreeAssembler;
    }

    /**
     * 在本项目的一个事务中执行回调，回调抛出异常时整体回滚并原样抛出
     */
    public <T> T inTransaction(Function<ProjectStore, T> callback) {
        return transactionTemplate.execute(status -> callback.apply(this));
    }

    public void runInTransaction(Consumer<ProjectStore> callback) {
        transactionTemplate.executeWithoutResult(status -> callback.accept(this));
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Closed project store {}", projectKey);
        }
    }

    private static HikariDataSource createDataSource(String projectKey, String jdbcUrl, TaskStoreProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(properties.getMaxPoolSize());
        config.setPoolName("taskmgr-" + Integer.toHexString(projectKey.hashCode()));
        return new HikariDataSource(config);
    }

    private static SqlSessionFactory buildSqlSessionFactory(HikariDataSource dataSource) {
        MybatisConfiguration configuration = new MybatisConfiguration();
        configuration.setMapUnderscoreToCamelCase(true);
        configuration.setJdbcTypeForNull(JdbcType.NULL);

        MybatisSqlSessionFactoryBean factoryBean = new MybatisSqlSessionFactoryBean();
        factoryBean.setDataSource(dataSource);
        factoryBean.setConfiguration(configuration);
        factoryBean.setTypeHandlers(new Iso8601LocalDateTimeTypeHandler());
        factoryBean.setGlobalConfig(new GlobalConfig().setBanner(false));

        SqlSessionFactory factory;
        try {
            factory = factoryBean.getObject();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SqlSessionFactory for " + dataSource.getJdbcUrl(), e);
        }
        factory.getConfiguration().addMapper(TaskMapper.class);
        factory.getConfiguration().addMapper(MetadataMapper.class);
        return factory;
    }
}
