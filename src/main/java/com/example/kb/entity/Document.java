package com.example.kb.entity;

import javax.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 文档实体
 */
@Data
@Entity
@Table(name = "documents")
public class Document {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String filename;

    @Column(name = "file_type", length = 20)
    private String fileType;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @Column(name = "file_path", length = 500)
    private String filePath;

    @Column(name = "collection_name", length = 100, nullable = false)
    private String collectionName;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DocumentStatus status = DocumentStatus.PENDING;

    // 解析后原文的句柄, 指向 document_texts 表
    @Column(name = "raw_text_ref", length = 36)
    private String rawTextRef;

    @Column(name = "word_count")
    private Integer wordCount;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(name = "entity_count")
    private Integer entityCount;

    @Column(name = "relation_count")
    private Integer relationCount;

    // 抽取出的实体, 按抽取顺序保存
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "document_tags", joinColumns = @JoinColumn(name = "document_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", length = 100)
    private List<String> tags = new ArrayList<>();

    @Column(length = 2000)
    private String error;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum DocumentStatus {
        PENDING, PROCESSING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
