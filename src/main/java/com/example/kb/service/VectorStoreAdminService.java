package com.example.kb.service;

import com.example.kb.dto.VectorStoreStatusDto;
import com.example.kb.service.vector.VectorStoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 向量库管理 - 连接状态、集合查询与手工清理
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorStoreAdminService {

    private final VectorStoreClient vectorStoreClient;

    public VectorStoreStatusDto status() {
        return new VectorStoreStatusDto(vectorStoreClient.isAvailable(),
                vectorStoreClient.getType(), vectorStoreClient.getEndpoint());
    }

    public List<VectorStoreClient.CollectionInfo> listCollections() {
        return vectorStoreClient.listCollections();
    }

    public void deleteCollection(String name) {
        vectorStoreClient.deleteCollection(name);
        log.info("集合已手工删除: {}", name);
    }

    /**
     * 删除单个知识点
     *
     * @param pointKey 知识点键, 形如 {documentId}-chunk-{index}
     */
    public void deletePoint(String collection, String pointKey) {
        vectorStoreClient.deletePoint(collection, pointKey);
        log.info("知识点已手工删除: collection={}, pointKey={}", collection, pointKey);
    }
}
