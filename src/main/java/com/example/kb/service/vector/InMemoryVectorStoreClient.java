package com.example.kb.service.vector;

import com.example.kb.exception.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存向量存储 - 用于开发测试
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.vector.type", havingValue = "memory")
public class InMemoryVectorStoreClient implements VectorStoreClient {

    private final Map<String, Map<String, KnowledgePoint>> collections = new ConcurrentHashMap<>();

    private volatile boolean available = true;

    @Override
    public List<CollectionInfo> listCollections() {
        checkAvailable();
        List<CollectionInfo> result = new ArrayList<>();
        collections.forEach((name, points) -> result.add(new CollectionInfo(name, points.size())));
        return result;
    }

    @Override
    public boolean collectionExists(String name) {
        checkAvailable();
        return collections.containsKey(name);
    }

    @Override
    public void createCollection(String name) {
        checkAvailable();
        if (collections.putIfAbsent(name, new ConcurrentHashMap<>()) == null) {
            log.info("内存集合已创建: {}", name);
        }
    }

    @Override
    public void upsertPoint(String collection, KnowledgePoint point) {
        checkAvailable();
        Map<String, KnowledgePoint> points = collections.get(collection);
        if (points == null) {
            throw new IngestionException(IngestionException.ErrorType.STORE_WRITE_ERROR,
                    "集合不存在: " + collection);
        }
        points.put(point.getId(), point);
    }

    @Override
    public void deletePoint(String collection, String pointId) {
        checkAvailable();
        Map<String, KnowledgePoint> points = collections.get(collection);
        if (points != null) {
            points.remove(pointId);
        }
    }

    @Override
    public void deletePointsByDocument(String collection, String documentId) {
        checkAvailable();
        Map<String, KnowledgePoint> points = collections.get(collection);
        if (points == null) {
            return;
        }
        int before = points.size();
        points.values().removeIf(p -> documentId.equals(p.getDocumentId()));
        log.info("内存向量存储: 删除文档{}的{}条知识点", documentId, before - points.size());
    }

    @Override
    public void deleteCollection(String name) {
        checkAvailable();
        collections.remove(name);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String getType() {
        return "memory";
    }

    @Override
    public String getEndpoint() {
        return "in-memory";
    }

    /**
     * 模拟向量库上下线
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    public List<String> pointIds(String collection) {
        Map<String, KnowledgePoint> points = collections.get(collection);
        return points == null ? List.of() : new ArrayList<>(points.keySet());
    }

    private void checkAvailable() {
        if (!available) {
            throw new IngestionException(IngestionException.ErrorType.STORE_UNAVAILABLE, "向量库不可达");
        }
    }
}
