package com.tencent.taskmgr.infrastructure.persistence.metadata.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * MetadataDO - 项目元数据数据对象
 *
 * @author taskmgr
 */
@Data
@TableName("metadata")
public class MetadataDO {

    /**
     * 键（KEY 是 H2 保留字，列名加前缀）
     */
    @TableId(value = "meta_key", type = IdType.INPUT)
    private String metaKey;

    private String metaValue;
}
