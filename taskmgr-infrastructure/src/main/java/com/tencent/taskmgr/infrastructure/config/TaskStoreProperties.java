package com.tencent.taskmgr.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * TaskStoreProperties - 项目存储配置
 *
 * @author taskmgr
 */
@Data
@ConfigurationProperties(prefix = "taskmgr.store")
public class TaskStoreProperties {

    /**
     * 项目目录下的数据目录名
     */
    private String dataDirName = ".taskmgr";

    /**
     * 数据目录中的 H2 库文件名（不含扩展名）
     */
    private String databaseName = "taskmgr";

    /**
     * 存储方式，测试中使用 MEMORY
     */
    private StoreMode mode = StoreMode.FILE;

    private String username = "sa";

    private String password = "";

    /**
     * 每个项目的连接池大小
     */
    private int maxPoolSize = 2;

    public enum StoreMode {
        /** 落盘到项目目录 */
        FILE,
        /** 进程内内存库 */
        MEMORY
    }
}
