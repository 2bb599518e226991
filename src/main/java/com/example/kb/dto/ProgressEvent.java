package com.example.kb.dto;

import com.example.kb.entity.IngestionTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 进度记录 - 观察方(UI)唯一可读取的入库状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {
    private String documentId;
    private String taskId;
    private IngestionTask.TaskStage stage;
    private IngestionTask.TaskStatus status;
    private int progress;
    private String message;
    private boolean superseded;
    private LocalDateTime timestamp;

    public static ProgressEvent of(IngestionTask task) {
        return ProgressEvent.builder()
                .documentId(task.getDocumentId())
                .taskId(task.getId())
                .stage(task.getStage())
                .status(task.getStatus())
                .progress(task.getProgress())
                .message(task.getMessage())
                .superseded(task.isSuperseded())
                .timestamp(task.getUpdatedAt() != null ? task.getUpdatedAt() : LocalDateTime.now())
                .build();
    }
}
