package com.example.kb.dto;

import com.example.kb.entity.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 文档响应DTO, 也作为入库受理后返回的文档句柄
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentDto {
    private String id;
    private String filename;
    private String fileType;
    private Long fileSize;
    private String collectionName;
    private Document.DocumentStatus status;
    private Integer wordCount;
    private Integer chunkCount;
    private Integer entityCount;
    private Integer relationCount;
    private List<String> tags;
    private String error;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;
}
