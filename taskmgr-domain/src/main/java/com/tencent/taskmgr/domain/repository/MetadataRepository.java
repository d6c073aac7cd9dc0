package com.tencent.taskmgr.domain.repository;

import java.util.Optional;

/**
 * MetadataRepository - 项目元数据仓储
 * <p>
 * 每个项目一张键值表，保存 schema 版本等项目级设置。
 * </p>
 *
 * @author taskmgr
 */
public interface MetadataRepository {

    Optional<String> get(String key);

    /**
     * 写入键值，已存在时覆盖
     */
    void put(String key, String value);
}
