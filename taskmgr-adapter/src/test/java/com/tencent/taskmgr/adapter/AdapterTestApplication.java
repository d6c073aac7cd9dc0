package com.tencent.taskmgr.adapter;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web 切片测试的启动配置
 */
@SpringBootApplication
public class AdapterTestApplication {
}
