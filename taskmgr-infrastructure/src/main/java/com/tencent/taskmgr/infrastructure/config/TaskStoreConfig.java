package com.tencent.taskmgr.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * TaskStoreConfig - 项目存储配置
 * <p>
 * Mapper 不注册为全局 Bean：每个项目打开时构建自己的 SqlSessionFactory，见 ProjectStore。
 * </p>
 *
 * @author taskmgr
 */
@Configuration
@EnableConfigurationProperties(TaskStoreProperties.class)
public class TaskStoreConfig {
}
