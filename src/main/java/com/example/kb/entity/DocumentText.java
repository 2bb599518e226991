package com.example.kb.entity;

import javax.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * 文档解析后的纯文本, 由入库流水线独占, 失败时保留以便重试
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "document_texts")
public class DocumentText {

    @Id
    @Column(length = 36)
    private String id;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    public DocumentText(String id, String content) {
        this.id = id;
        this.content = content;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        createdAt = LocalDateTime.now();
    }
}
