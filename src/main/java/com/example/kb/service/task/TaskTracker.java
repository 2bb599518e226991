package com.example.kb.service.task;

import com.example.kb.dto.ProgressEvent;
import com.example.kb.entity.Document;
import com.example.kb.entity.IngestionTask;
import com.example.kb.exception.IngestionException;
import com.example.kb.repository.DocumentRepository;
import com.example.kb.repository.IngestionTaskRepository;
import com.example.kb.service.entity.EntityExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 任务跟踪 - 文档与任务状态机的唯一写入口
 *
 * 状态流转: pending -> processing -> completed | failed, 失败或完成后可重新处理。
 * 每个文档只由持有它的工作线程写入, 不同文档互不影响, 因此不需要加锁。
 * 同一次运行内进度单调不减, 只有完成时才到 100。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskTracker {

    private static final List<Document.DocumentStatus> TERMINAL_STATUSES =
            List.of(Document.DocumentStatus.COMPLETED, Document.DocumentStatus.FAILED);

    private final DocumentRepository documentRepository;
    private final IngestionTaskRepository taskRepository;
    private final ProgressPublisher progressPublisher;

    /**
     * 登记新文档及其首个任务
     */
    public IngestionTask register(Document document) {
        LocalDateTime now = LocalDateTime.now();
        document.setStatus(Document.DocumentStatus.PENDING);
        document.setCreatedAt(now);
        document.setUpdatedAt(now);
        documentRepository.save(document);
        return createTask(document.getId(), "等待处理");
    }

    /**
     * 重新处理: 旧任务被取代, 文档回到 processing 并清空上次结果
     */
    public IngestionTask resubmit(Document document) {
        // 条件更新抢占文档, 并发的重复请求只有一个能成功
        if (!claim(document.getId())) {
            throw new IllegalStateException("文档正在处理中, 不能重新处理: " + document.getId());
        }

        findActiveTask(document.getId()).ifPresent(previous -> {
            previous.setSuperseded(true);
            previous.setUpdatedAt(LocalDateTime.now());
            taskRepository.save(previous);
        });

        document.setStatus(Document.DocumentStatus.PROCESSING);
        document.setChunkCount(null);
        document.setEntityCount(null);
        document.setRelationCount(null);
        document.setTags(new ArrayList<>());
        document.setError(null);
        document.setProcessedAt(null);
        document.setUpdatedAt(LocalDateTime.now());
        documentRepository.save(document);

        log.info("文档重新处理: documentId={}", document.getId());
        return createTask(document.getId(), "等待重新处理");
    }

    /**
     * 工作线程开始处理文档
     */
    public IngestionTask start(Document document) {
        IngestionTask task = findActiveTask(document.getId())
                .orElseGet(() -> createTask(document.getId(), "等待处理"));

        document.setStatus(Document.DocumentStatus.PROCESSING);
        document.setUpdatedAt(LocalDateTime.now());
        documentRepository.save(document);

        task.setStatus(IngestionTask.TaskStatus.RUNNING);
        task.setStage(IngestionTask.TaskStage.EXTRACT);
        task.setMessage("正在解析文档...");
        save(task);
        return task;
    }

    /**
     * 进入下一阶段, 进度取该阶段起点
     */
    public void advance(IngestionTask task, IngestionTask.TaskStage stage, String message) {
        if (stage.ordinal() < task.getStage().ordinal()) {
            throw new IllegalStateException("阶段不能回退: " + task.getStage() + " -> " + stage);
        }
        task.setStage(stage);
        updateProgress(task, stage.getStartProgress(), message);
    }

    /**
     * 更新进度; 小于当前值时保持不变, 运行中最多到 99
     */
    public void updateProgress(IngestionTask task, int progress, String message) {
        if (task.getStatus() != IngestionTask.TaskStatus.RUNNING) {
            throw new IllegalStateException("任务未在运行: " + task.getId() + ", status=" + task.getStatus());
        }
        int bounded = Math.min(progress, 99);
        task.setProgress(Math.max(task.getProgress(), bounded));
        task.setMessage(message);
        save(task);
    }

    public void complete(Document document, IngestionTask task, int chunkCount, EntityExtractionResult entities) {
        task.setStage(IngestionTask.TaskStage.ENTITY);
        task.setStatus(IngestionTask.TaskStatus.COMPLETED);
        task.setProgress(100);
        task.setMessage("处理完成: " + chunkCount + " 知识块, " + entities.getEntityCount() + " 实体, "
                + entities.getRelationCount() + " 关系");
        save(task);

        // 文档状态最后写入, 写入后才允许重新处理或删除
        LocalDateTime now = LocalDateTime.now();
        document.setStatus(Document.DocumentStatus.COMPLETED);
        document.setChunkCount(chunkCount);
        document.setEntityCount(entities.getEntityCount());
        document.setRelationCount(entities.getRelationCount());
        document.setTags(new ArrayList<>(entities.getEntities()));
        document.setError(null);
        document.setProcessedAt(now);
        document.setUpdatedAt(now);
        documentRepository.save(document);

        log.info("文档处理完成: documentId={}, filename={}, chunks={}, entities={}",
                document.getId(), document.getFilename(), chunkCount, entities.getEntityCount());
    }

    /**
     * 标记失败, 进度停留在失败时的位置
     */
    public void fail(Document document, IngestionTask task, IngestionException.ErrorType errorType, String message) {
        String error = "[" + errorType.name() + "] " + message;
        task.setStatus(IngestionTask.TaskStatus.FAILED);
        task.setMessage(truncate("处理失败: " + error));
        save(task);

        LocalDateTime now = LocalDateTime.now();
        document.setStatus(Document.DocumentStatus.FAILED);
        document.setError(truncate(error));
        document.setProcessedAt(now);
        document.setUpdatedAt(now);
        documentRepository.save(document);

        log.warn("文档处理失败: documentId={}, stage={}, error={}", document.getId(), task.getStage(), error);
    }

    /**
     * 删除前抢占文档, 与重新处理互斥
     *
     * @return 抢占前的状态
     */
    public Document.DocumentStatus claimForDelete(Document document) {
        if (!claim(document.getId())) {
            throw new IllegalStateException("文档正在处理中, 不能删除: " + document.getId());
        }
        return document.getStatus().isTerminal() ? document.getStatus() : Document.DocumentStatus.FAILED;
    }

    /**
     * 删除失败时恢复抢占前的状态
     */
    public void releaseDeleteClaim(Document document, Document.DocumentStatus previous) {
        documentRepository.transitionStatus(document.getId(),
                List.of(Document.DocumentStatus.PROCESSING), previous, LocalDateTime.now());
    }

    /**
     * 把上次运行遗留的 pending/processing 文档标记为失败, 之后可重新处理或删除
     *
     * @return 恢复的文档数
     */
    public int recoverInterrupted() {
        List<Document> orphans = documentRepository.findByStatusIn(
                List.of(Document.DocumentStatus.PENDING, Document.DocumentStatus.PROCESSING));
        for (Document document : orphans) {
            IngestionTask task = findActiveTask(document.getId())
                    .orElseGet(() -> createTask(document.getId(), "等待处理"));
            fail(document, task, IngestionException.ErrorType.UNKNOWN, "服务重启, 处理中断");
        }
        return orphans.size();
    }

    public Optional<IngestionTask> findActiveTask(String documentId) {
        return taskRepository.findFirstByDocumentIdAndSupersededFalseOrderByCreatedAtDesc(documentId);
    }

    public List<IngestionTask> history(String documentId) {
        return taskRepository.findByDocumentIdOrderByCreatedAtDesc(documentId);
    }

    public List<IngestionTask> inFlightTasks() {
        return taskRepository.findBySupersededFalseAndStatusIn(
                List.of(IngestionTask.TaskStatus.PENDING, IngestionTask.TaskStatus.RUNNING));
    }

    public void removeTasks(String documentId) {
        taskRepository.deleteByDocumentId(documentId);
    }

    private boolean claim(String documentId) {
        return documentRepository.transitionStatus(documentId, TERMINAL_STATUSES,
                Document.DocumentStatus.PROCESSING, LocalDateTime.now()) == 1;
    }

    private IngestionTask createTask(String documentId, String message) {
        LocalDateTime now = LocalDateTime.now();
        IngestionTask task = new IngestionTask();
        task.setId(UUID.randomUUID().toString());
        task.setDocumentId(documentId);
        task.setStage(IngestionTask.TaskStage.EXTRACT);
        task.setStatus(IngestionTask.TaskStatus.PENDING);
        task.setProgress(0);
        task.setMessage(message);
        task.setCreatedAt(now);
        save(task);
        return task;
    }

    private void save(IngestionTask task) {
        task.setUpdatedAt(LocalDateTime.now());
        taskRepository.save(task);
        progressPublisher.publish(ProgressEvent.of(task));
    }

    private String truncate(String value) {
        return value.length() > 2000 ? value.substring(0, 2000) : value;
    }
}
