package com.tencent.taskmgr.infrastructure.persistence.metadata.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskmgr.infrastructure.persistence.metadata.entity.MetadataDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * MetadataMapper - 项目元数据Mapper
 *
 * @author taskmgr
 */
@Mapper
public interface MetadataMapper extends BaseMapper<MetadataDO> {
}
