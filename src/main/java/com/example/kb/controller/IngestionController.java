package com.example.kb.controller;

import com.example.kb.dto.BatchIngestResult;
import com.example.kb.dto.DocumentDto;
import com.example.kb.dto.IngestionStatsDto;
import com.example.kb.dto.ProgressEvent;
import com.example.kb.dto.UploadedFile;
import com.example.kb.entity.Document;
import com.example.kb.service.DocumentService;
import com.example.kb.service.IngestionOrchestrator;
import com.example.kb.service.task.ReactorProgressPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 知识入库控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class IngestionController {

    private final IngestionOrchestrator ingestionOrchestrator;
    private final DocumentService documentService;
    private final ReactorProgressPublisher progressPublisher;

    /**
     * 批量上传, 每个文件各自受理或拒绝
     */
    @PostMapping("/documents")
    public ResponseEntity<BatchIngestResult> upload(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "collection", required = false) String collection) {
        List<UploadedFile> uploads = new ArrayList<>();
        for (MultipartFile file : files) {
            uploads.add(toUploadedFile(file));
        }
        return ResponseEntity.ok(ingestionOrchestrator.ingest(uploads, collection));
    }

    @GetMapping("/documents")
    public ResponseEntity<List<DocumentDto>> list(
            @RequestParam(value = "collection", required = false) String collection,
            @RequestParam(value = "status", required = false) Document.DocumentStatus status) {
        return ResponseEntity.ok(documentService.listDocuments(collection, status));
    }

    @GetMapping("/documents/{id}")
    public ResponseEntity<DocumentDto> get(@PathVariable String id) {
        return ResponseEntity.ok(documentService.getDocument(id));
    }

    /**
     * 当前进度 (轮询)
     */
    @GetMapping("/documents/{id}/progress")
    public ResponseEntity<ProgressEvent> progress(@PathVariable String id) {
        return ResponseEntity.ok(documentService.getProgress(id));
    }

    @GetMapping("/documents/{id}/tasks")
    public ResponseEntity<List<ProgressEvent>> tasks(@PathVariable String id) {
        return ResponseEntity.ok(documentService.getTaskHistory(id));
    }

    /**
     * 重新处理
     */
    @PostMapping("/documents/{id}/reprocess")
    public ResponseEntity<DocumentDto> reprocess(@PathVariable String id) {
        return ResponseEntity.ok(ingestionOrchestrator.reprocess(id));
    }

    @DeleteMapping("/documents/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        ingestionOrchestrator.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 正在排队或处理中的任务
     */
    @GetMapping("/tasks")
    public ResponseEntity<List<ProgressEvent>> inFlight() {
        return ResponseEntity.ok(documentService.getInFlightTasks());
    }

    @GetMapping("/stats")
    public ResponseEntity<IngestionStatsDto> stats() {
        return ResponseEntity.ok(documentService.getStats());
    }

    /**
     * 进度推送 (Server-Sent Events)
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> events(
            @RequestParam(required = false) String documentId) {
        return progressPublisher.subscribe(documentId)
                .map(event -> ServerSentEvent.<ProgressEvent>builder()
                        .event("progress")
                        .data(event)
                        .build());
    }

    private UploadedFile toUploadedFile(MultipartFile file) {
        try {
            return new UploadedFile(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            log.error("读取上传文件失败: {}", file.getOriginalFilename(), e);
            throw new UncheckedIOException("读取上传文件失败: " + e.getMessage(), e);
        }
    }
}
