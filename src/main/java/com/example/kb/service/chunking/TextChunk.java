package com.example.kb.service.chunking;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 文档切片
 */
@Data
@AllArgsConstructor
public class TextChunk {
    private String documentId;
    private int index;
    private String text;

    /**
     * 向量库中的知识点键, 由文档ID与序号确定, 重试时覆盖而非重复
     */
    public String getPointId() {
        return pointIdOf(documentId, index);
    }

    public static String pointIdOf(String documentId, int index) {
        return documentId + "-chunk-" + index;
    }
}
