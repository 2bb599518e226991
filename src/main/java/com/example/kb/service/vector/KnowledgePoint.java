package com.example.kb.service.vector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 知识点 - 写入向量库的单元 (切片 + 元数据)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgePoint {
    private String id;
    private String documentId;
    private int chunkIndex;
    private String title;
    private String content;
    private String category;
    private List<String> tags;
    private String source;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * 用于生成向量的文本
     */
    public String getVectorSourceText() {
        return title + " " + content;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("pointKey", id);
        payload.put("documentId", documentId);
        payload.put("chunkIndex", chunkIndex);
        payload.put("title", title);
        payload.put("content", content);
        payload.put("category", category);
        payload.put("tags", tags != null ? tags : List.of());
        payload.put("source", source != null ? source : "");
        payload.put("createdAt", createdAt != null ? createdAt.toString() : null);
        payload.put("updatedAt", updatedAt != null ? updatedAt.toString() : null);
        return payload;
    }
}
