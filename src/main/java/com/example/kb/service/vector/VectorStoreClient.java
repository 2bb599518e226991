package com.example.kb.service.vector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 向量库客户端接口
 *
 * 不可达时抛出 STORE_UNAVAILABLE, 向量库拒绝写入时抛出 STORE_WRITE_ERROR
 * (均为 {@link com.example.kb.exception.IngestionException})。
 */
public interface VectorStoreClient {

    /**
     * 列出所有集合及其知识点数量
     */
    List<CollectionInfo> listCollections();

    boolean collectionExists(String name);

    /**
     * 创建集合, 已存在时视为成功
     */
    void createCollection(String name);

    /**
     * 写入知识点, 相同ID覆盖
     */
    void upsertPoint(String collection, KnowledgePoint point);

    void deletePoint(String collection, String pointId);

    /**
     * 删除某文档的全部知识点, 集合不存在时忽略
     */
    void deletePointsByDocument(String collection, String documentId);

    void deleteCollection(String name);

    boolean isAvailable();

    String getType();

    String getEndpoint();

    /**
     * 集合信息
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class CollectionInfo {
        private String name;
        private long pointsCount;
    }
}
