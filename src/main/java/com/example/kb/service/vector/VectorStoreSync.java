package com.example.kb.service.vector;

import com.example.kb.entity.Document;
import com.example.kb.service.chunking.TextChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * 向量库同步 - 确保集合存在并按序写入文档切片
 *
 * 知识点ID由文档ID与切片序号确定, 重复执行只会覆盖。
 * 中途失败时已写入的知识点保留, 由下一次重试覆盖, 不做回滚。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorStoreSync {

    static final String CATEGORY = "document";

    private final VectorStoreClient vectorStoreClient;

    /**
     * 集合不存在时创建; 创建本身幂等, 不加客户端锁
     */
    public void ensureCollection(String name) {
        if (!vectorStoreClient.collectionExists(name)) {
            vectorStoreClient.createCollection(name);
        }
    }

    public void upsertPoint(String collection, KnowledgePoint point) {
        vectorStoreClient.upsertPoint(collection, point);
    }

    /**
     * 按切片序号顺序逐个写入
     *
     * @param onChunkWritten 每写入一个切片回调一次, 参数为已写入数量
     */
    public void syncChunks(Document document, List<TextChunk> chunks, IntConsumer onChunkWritten) {
        String collection = document.getCollectionName();
        ensureCollection(collection);

        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < chunks.size(); i++) {
            upsertPoint(collection, toKnowledgePoint(document, chunks.get(i), now));
            onChunkWritten.accept(i + 1);
        }
        log.info("向量库同步完成: documentId={}, collection={}, points={}",
                document.getId(), collection, chunks.size());
    }

    public void deleteDocumentPoints(String collection, String documentId) {
        vectorStoreClient.deletePointsByDocument(collection, documentId);
    }

    KnowledgePoint toKnowledgePoint(Document document, TextChunk chunk, LocalDateTime now) {
        return KnowledgePoint.builder()
                .id(chunk.getPointId())
                .documentId(document.getId())
                .chunkIndex(chunk.getIndex())
                .title(document.getFilename() + " - 片段 " + (chunk.getIndex() + 1))
                .content(chunk.getText())
                .category(CATEGORY)
                .tags(List.of(document.getFileType()))
                .source(document.getFilename())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
