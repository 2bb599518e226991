package com.example.kb.service;

import com.example.kb.dto.DocumentDto;
import com.example.kb.dto.IngestionStatsDto;
import com.example.kb.dto.ProgressEvent;
import com.example.kb.entity.Document;
import com.example.kb.exception.DocumentNotFoundException;
import com.example.kb.exception.IngestionException;
import com.example.kb.repository.DocumentRepository;
import com.example.kb.service.task.TaskTracker;
import com.example.kb.service.vector.VectorStoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 文档查询服务 - 文档列表、进度与统计
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentRepository documentRepository;
    private final TaskTracker taskTracker;
    private final VectorStoreClient vectorStoreClient;

    public DocumentDto getDocument(String id) {
        return documentRepository.findById(id)
                .map(DocumentService::toDto)
                .orElseThrow(() -> new DocumentNotFoundException(id));
    }

    public List<DocumentDto> listDocuments(String collection, Document.DocumentStatus status) {
        List<Document> documents;
        if (collection != null && !collection.isEmpty()) {
            documents = documentRepository.findByCollectionNameOrderByCreatedAtDesc(collection);
        } else if (status != null) {
            documents = documentRepository.findByStatusOrderByCreatedAtDesc(status);
        } else {
            documents = documentRepository.findAllByOrderByCreatedAtDesc();
        }
        return documents.stream()
                .filter(d -> status == null || d.getStatus() == status)
                .map(DocumentService::toDto)
                .collect(Collectors.toList());
    }

    /**
     * 当前任务进度
     */
    public ProgressEvent getProgress(String documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        return taskTracker.findActiveTask(documentId)
                .map(ProgressEvent::of)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * 任务历史, 包括被重新处理取代的任务, 新的在前
     */
    public List<ProgressEvent> getTaskHistory(String documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        return taskTracker.history(documentId).stream()
                .map(ProgressEvent::of)
                .collect(Collectors.toList());
    }

    public List<ProgressEvent> getInFlightTasks() {
        return taskTracker.inFlightTasks().stream()
                .map(ProgressEvent::of)
                .collect(Collectors.toList());
    }

    /**
     * 统计数据全部由文档记录推导; 向量库离线时不返回知识点数量
     */
    public IngestionStatsDto getStats() {
        Map<String, Long> pointsByCollection = new LinkedHashMap<>();
        try {
            vectorStoreClient.listCollections()
                    .forEach(c -> pointsByCollection.put(c.getName(), c.getPointsCount()));
        } catch (IngestionException e) {
            log.warn("获取向量库集合失败: {}", e.getMessage());
        }

        return IngestionStatsDto.builder()
                .totalDocuments(documentRepository.count())
                .pending(documentRepository.countByStatus(Document.DocumentStatus.PENDING))
                .processing(documentRepository.countByStatus(Document.DocumentStatus.PROCESSING))
                .completed(documentRepository.countByStatus(Document.DocumentStatus.COMPLETED))
                .failed(documentRepository.countByStatus(Document.DocumentStatus.FAILED))
                .totalChunks(documentRepository.sumChunkCountByStatus(Document.DocumentStatus.COMPLETED))
                .totalEntities(documentRepository.sumEntityCountByStatus(Document.DocumentStatus.COMPLETED))
                .pointsByCollection(pointsByCollection)
                .build();
    }

    static DocumentDto toDto(Document entity) {
        return DocumentDto.builder()
                .id(entity.getId())
                .filename(entity.getFilename())
                .fileType(entity.getFileType())
                .fileSize(entity.getFileSize())
                .collectionName(entity.getCollectionName())
                .status(entity.getStatus())
                .wordCount(entity.getWordCount())
                .chunkCount(entity.getChunkCount())
                .entityCount(entity.getEntityCount())
                .relationCount(entity.getRelationCount())
                .tags(entity.getTags() != null ? new ArrayList<>(entity.getTags()) : new ArrayList<>())
                .error(entity.getError())
                .createdAt(entity.getCreatedAt())
                .processedAt(entity.getProcessedAt())
                .build();
    }
}
