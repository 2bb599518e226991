package com.example.kb.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import javax.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/**
 * 入库任务实体 - 记录单个文档在各阶段的处理进度
 */
@Data
@Entity
@Table(name = "ingestion_tasks", indexes = {
        @Index(name = "idx_task_document", columnList = "document_id")
})
public class IngestionTask {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "document_id", nullable = false, length = 36)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TaskStage stage = TaskStage.EXTRACT;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TaskStatus status = TaskStatus.PENDING;

    private int progress;

    @Column(length = 2000)
    private String message;

    // 重新处理时旧任务被新任务取代
    private boolean superseded;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

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

    /**
     * 处理阶段及其进度区间
     */
    public enum TaskStage {
        EXTRACT("extract", 0, 30),
        CHUNK("chunk", 30, 60),
        EMBED("embed", 60, 90),
        ENTITY("entity", 90, 100);

        private final String code;
        private final int startProgress;
        private final int endProgress;

        TaskStage(String code, int startProgress, int endProgress) {
            this.code = code;
            this.startProgress = startProgress;
            this.endProgress = endProgress;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        public int getStartProgress() {
            return startProgress;
        }

        public int getEndProgress() {
            return endProgress;
        }
    }

    public enum TaskStatus {
        PENDING("pending"),
        RUNNING("running"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String code;

        TaskStatus(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }
}
