package com.tencent.taskmgr.infrastructure.persistence.metadata;

import com.tencent.taskmgr.domain.repository.MetadataRepository;
import com.tencent.taskmgr.infrastructure.persistence.metadata.entity.MetadataDO;
import com.tencent.taskmgr.infrastructure.persistence.metadata.mapper.MetadataMapper;

import java.util.Optional;

/**
 * MetadataRepositoryImpl - 项目元数据仓储实现
 *
 * @author taskmgr
 */
public class MetadataRepositoryImpl implements MetadataRepository {

    private final MetadataMapper metadataMapper;

    public MetadataRepositoryImpl(MetadataMapper metadataMapper) {
        this.metadataMapper = metadataMapper;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(metadataMapper.selectById(key))
            .map(MetadataDO::getMetaValue);
    }

    @Override
    public void put(String key, String value) {
        MetadataDO dataObject = new MetadataDO();
        dataObject.setMetaKey(key);
        dataObject.setMetaValue(value);

        if (metadataMapper.selectById(key) == null) {
            metadataMapper.insert(dataObject);
        } else {
            metadataMapper.updateById(dataObject);
        }
    }
}
