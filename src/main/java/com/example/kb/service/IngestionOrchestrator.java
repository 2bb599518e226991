package com.example.kb.service;

import com.example.kb.config.AppProperties;
import com.example.kb.dto.BatchIngestResult;
import com.example.kb.dto.DocumentDto;
import com.example.kb.dto.UploadedFile;
import com.example.kb.entity.Document;
import com.example.kb.entity.DocumentText;
import com.example.kb.entity.IngestionTask;
import com.example.kb.exception.DocumentNotFoundException;
import com.example.kb.exception.IngestionException;
import com.example.kb.repository.DocumentRepository;
import com.example.kb.repository.DocumentTextRepository;
import com.example.kb.service.chunking.TextChunk;
import com.example.kb.service.chunking.TextChunker;
import com.example.kb.service.entity.EntityExtractionResult;
import com.example.kb.service.entity.EntityExtractor;
import com.example.kb.service.parser.DocumentParserClient;
import com.example.kb.service.parser.ParseResult;
import com.example.kb.service.storage.UploadStorage;
import com.example.kb.service.task.TaskTracker;
import com.example.kb.service.vector.VectorStoreSync;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 入库编排 - 驱动单个文档依次经过 解析 -> 切片 -> 向量化 -> 实体抽取
 *
 * 每个文档一个独立的处理单元, 提交到有界线程池; 文档内部各阶段严格串行。
 * 任何异常都在文档边界被捕获并转换为 failed, 不影响同批次的其他文档。
 */
@Slf4j
@Service
public class IngestionOrchestrator {

    private final FileTypePolicy fileTypePolicy;
    private final DocumentParserClient parserClient;
    private final TextChunker textChunker;
    private final EntityExtractor entityExtractor;
    private final VectorStoreSync vectorStoreSync;
    private final TaskTracker taskTracker;
    private final DocumentRepository documentRepository;
    private final DocumentTextRepository documentTextRepository;
    private final UploadStorage uploadStorage;
    private final AppProperties appProperties;
    private final Executor ingestionExecutor;

    public IngestionOrchestrator(FileTypePolicy fileTypePolicy,
                                 DocumentParserClient parserClient,
                                 TextChunker textChunker,
                                 EntityExtractor entityExtractor,
                                 VectorStoreSync vectorStoreSync,
                                 TaskTracker taskTracker,
                                 DocumentRepository documentRepository,
                                 DocumentTextRepository documentTextRepository,
                                 UploadStorage uploadStorage,
                                 AppProperties appProperties,
                                 @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
        this.fileTypePolicy = fileTypePolicy;
        this.parserClient = parserClient;
        this.textChunker = textChunker;
        this.entityExtractor = entityExtractor;
        this.vectorStoreSync = vectorStoreSync;
        this.taskTracker = taskTracker;
        this.documentRepository = documentRepository;
        this.documentTextRepository = documentTextRepository;
        this.uploadStorage = uploadStorage;
        this.appProperties = appProperties;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * 批量入库; 类型不支持的文件在这里被拒绝, 其余文件各自异步处理
     */
    public BatchIngestResult ingest(List<UploadedFile> files, String collection) {
        BatchIngestResult result = new BatchIngestResult();

        for (UploadedFile file : files) {
            DocumentDto handle;
            try {
                handle = register(file, collection);
            } catch (IngestionException e) {
                log.warn("文件被拒绝: filename={}, reason={}", file.getFilename(), e.getMessage());
                result.getRejected().add(new BatchIngestResult.RejectedFile(
                        file.getFilename(), e.getErrorType().name(), e.getMessage()));
                continue;
            } catch (RuntimeException e) {
                // 单个文件登记失败不影响同批次其他文件
                log.error("文件登记失败: filename={}", file.getFilename(), e);
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                result.getRejected().add(new BatchIngestResult.RejectedFile(
                        file.getFilename(), IngestionException.ErrorType.UNKNOWN.name(), reason));
                continue;
            }
            result.getAccepted().add(handle);
            // 登记成功立即提交, 不等待同批次其余文件
            submit(handle.getId());
        }

        log.info("批量入库受理: accepted={}, rejected={}", result.getAccepted().size(), result.getRejected().size());
        return result;
    }

    /**
     * 单文件入库, 立即返回文档句柄, 进度通过任务跟踪查询
     */
    public DocumentDto ingest(UploadedFile file, String collection) {
        DocumentDto handle = register(file, collection);
        submit(handle.getId());
        return handle;
    }

    /**
     * 重新处理, 总是从解析阶段重新开始
     */
    public DocumentDto reprocess(String documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        taskTracker.resubmit(document);
        submit(documentId);
        return DocumentService.toDto(document);
    }

    /**
     * 删除文档及其知识点、原文、上传文件和任务记录
     */
    public void delete(String documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        Document.DocumentStatus previous = taskTracker.claimForDelete(document);

        try {
            vectorStoreSync.deleteDocumentPoints(document.getCollectionName(), documentId);
        } catch (RuntimeException e) {
            // 知识点没删掉时保留文档, 允许稍后重试
            taskTracker.releaseDeleteClaim(document, previous);
            throw e;
        }
        if (document.getRawTextRef() != null && documentTextRepository.existsById(document.getRawTextRef())) {
            documentTextRepository.deleteById(document.getRawTextRef());
        }
        uploadStorage.delete(document.getFilePath());
        taskTracker.removeTasks(documentId);
        documentRepository.deleteById(documentId);
        log.info("文档已删除: id={}", documentId);
    }

    private DocumentDto register(UploadedFile file, String collection) {
        String fileType = fileTypePolicy.validate(file);

        String documentId = UUID.randomUUID().toString();
        String filePath = uploadStorage.save(documentId, file.getFilename(), file.getContent());

        Document document = new Document();
        document.setId(documentId);
        document.setFilename(file.getFilename());
        document.setFileType(fileType);
        document.setFileSize(file.getSize());
        document.setMimeType(file.getMimeType());
        document.setFilePath(filePath);
        document.setCollectionName(collection != null && !collection.isBlank()
                ? collection : appProperties.getVector().getDefaultCollection());
        taskTracker.register(document);

        log.info("文档已登记: id={}, filename={}, size={}", documentId, file.getFilename(), file.getSize());
        return DocumentService.toDto(document);
    }

    private void submit(String documentId) {
        try {
            ingestionExecutor.execute(() -> process(documentId));
        } catch (RejectedExecutionException e) {
            log.error("处理队列已满: documentId={}", documentId, e);
            documentRepository.findById(documentId).ifPresent(document -> {
                IngestionTask task = taskTracker.start(document);
                taskTracker.fail(document, task, IngestionException.ErrorType.UNKNOWN, "处理队列已满, 请稍后重试");
            });
        }
    }

    /**
     * 处理单个文档, 异常在此边界内转换为失败状态
     */
    void process(String documentId) {
        Document document = documentRepository.findById(documentId).orElse(null);
        if (document == null) {
            log.warn("文档记录不存在, 跳过处理: {}", documentId);
            return;
        }

        IngestionTask task = taskTracker.start(document);
        try {
            runStages(document, task);
        } catch (IngestionException e) {
            taskTracker.fail(document, task, e.getErrorType(), e.getMessage());
        } catch (Exception e) {
            log.error("文档处理失败: id={}", documentId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            taskTracker.fail(document, task, IngestionException.ErrorType.UNKNOWN, message);
        }
    }

    private void runStages(Document document, IngestionTask task) {
        // 1. 解析
        String text = parse(document);
        documentTextRepository.save(new DocumentText(document.getId(), text));
        document.setRawTextRef(document.getId());
        taskTracker.advance(task, IngestionTask.TaskStage.CHUNK, "正在切分文本...");

        // 2. 切片
        List<TextChunk> chunks = textChunker.chunk(document.getId(), text);
        if (chunks.isEmpty()) {
            throw new IngestionException(IngestionException.ErrorType.EMPTY_CONTENT, "文档没有可用的文本内容");
        }
        taskTracker.advance(task, IngestionTask.TaskStage.EMBED, "正在写入向量库: 0/" + chunks.size());

        // 3. 向量库同步, 切片按序串行写入
        IngestionTask.TaskStage embed = IngestionTask.TaskStage.EMBED;
        int span = embed.getEndProgress() - embed.getStartProgress();
        int total = chunks.size();
        vectorStoreSync.syncChunks(document, chunks, written -> taskTracker.updateProgress(task,
                embed.getStartProgress() + span * written / total,
                "正在写入向量库: " + written + "/" + total));
        taskTracker.advance(task, IngestionTask.TaskStage.ENTITY, "正在抽取实体...");

        // 4. 实体抽取
        EntityExtractionResult entities = entityExtractor.extract(text);
        taskTracker.complete(document, task, chunks.size(), entities);
    }

    private String parse(Document document) {
        byte[] content;
        try {
            content = uploadStorage.read(document.getFilePath());
        } catch (IOException e) {
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "上传文件读取失败: " + e.getMessage(), e);
        }

        ParseResult result;
        try {
            result = parserClient.parse(content, document.getFilename(), document.getMimeType());
        } catch (RuntimeException e) {
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "解析异常: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), e);
        }

        if (!result.isSuccess()) {
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    result.getError() != null ? result.getError() : "解析失败");
        }
        document.setWordCount(result.getWordCount());
        log.info("文档解析完成: documentId={}, 字数={}", document.getId(), result.getWordCount());
        return result.getContent() != null ? result.getContent() : "";
    }
}
