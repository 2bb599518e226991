package com.example.kb.service;

import com.example.kb.config.AppProperties;
import com.example.kb.dto.BatchIngestResult;
import com.example.kb.dto.DocumentDto;
import com.example.kb.dto.ProgressEvent;
import com.example.kb.dto.UploadedFile;
import com.example.kb.entity.Document;
import com.example.kb.entity.IngestionTask;
import com.example.kb.exception.DocumentNotFoundException;
import com.example.kb.exception.IngestionException;
import com.example.kb.repository.DocumentRepository;
import com.example.kb.repository.DocumentTextRepository;
import com.example.kb.service.chunking.TextChunker;
import com.example.kb.service.entity.EntityExtractor;
import com.example.kb.service.parser.DocumentParserClient;
import com.example.kb.service.storage.UploadStorage;
import com.example.kb.service.task.InterruptedTaskRecovery;
import com.example.kb.service.task.ReactorProgressPublisher;
import com.example.kb.service.task.TaskTracker;
import com.example.kb.service.vector.InMemoryVectorStoreClient;
import com.example.kb.service.vector.VectorStoreSync;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.core.Disposable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 入库编排集成测试 - 默认同步执行器, 内存向量库; 并发场景使用真实线程池
 */
@SpringBootTest
class IngestionOrchestratorTest {

    @Autowired
    private FileTypePolicy fileTypePolicy;
    @Autowired
    private DocumentParserClient parserClient;
    @Autowired
    private TextChunker textChunker;
    @Autowired
    private EntityExtractor entityExtractor;
    @Autowired
    private VectorStoreSync vectorStoreSync;
    @Autowired
    private TaskTracker taskTracker;
    @Autowired
    private DocumentRepository documentRepository;
    @Autowired
    private DocumentTextRepository documentTextRepository;
    @Autowired
    private UploadStorage uploadStorage;
    @Autowired
    private AppProperties appProperties;
    @Autowired
    private InMemoryVectorStoreClient vectorStore;
    @Autowired
    private ReactorProgressPublisher progressPublisher;
    @Autowired
    private InterruptedTaskRecovery interruptedTaskRecovery;
    @Autowired
    @Qualifier("ingestionExecutor")
    private Executor ingestionExecutor;

    private IngestionOrchestrator orchestrator;
    private String collection;
    private final List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());
    private Disposable subscription;

    @BeforeEach
    void setUp() {
        orchestrator = orchestratorWith(Runnable::run);
        collection = "test_" + UUID.randomUUID().toString().replace("-", "");
        vectorStore.setAvailable(true);
        subscription = progressPublisher.subscribe(null).subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
        vectorStore.setAvailable(true);
    }

    @Test
    void testSingleDocumentCompletes() {
        DocumentDto handle = orchestrator.ingest(
                file("manual.txt", "设备：PUMP-01，出现【轴承】异常。请检查润滑系统。"), collection);

        Document document = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.COMPLETED, document.getStatus());
        assertEquals(2, document.getChunkCount());
        assertEquals(2, document.getEntityCount());
        assertEquals(1, document.getRelationCount());
        assertEquals(List.of("轴承", "PUMP-01"), document.getTags());
        assertNull(document.getError());
        assertTrue(documentTextRepository.existsById(document.getRawTextRef()));

        assertEquals(2, vectorStore.pointIds(collection).size());
        IngestionTask task = taskTracker.findActiveTask(handle.getId()).orElseThrow();
        assertEquals(IngestionTask.TaskStatus.COMPLETED, task.getStatus());
        assertEquals(100, task.getProgress());
    }

    @Test
    void testFailureIsIsolatedWithinBatch() {
        BatchIngestResult result = orchestrator.ingest(List.of(
                file("first.txt", "第一份文档内容。"),
                file("blank.txt", "   \n\t  "),
                file("third.md", "# 标题\n\n第三份文档内容。")), collection);

        assertEquals(3, result.getAccepted().size());
        assertTrue(result.getRejected().isEmpty());

        Map<String, Document> byName = result.getAccepted().stream()
                .map(dto -> documentRepository.findById(dto.getId()).orElseThrow())
                .collect(Collectors.toMap(Document::getFilename, d -> d));
        assertEquals(Document.DocumentStatus.COMPLETED, byName.get("first.txt").getStatus());
        assertEquals(Document.DocumentStatus.COMPLETED, byName.get("third.md").getStatus());

        Document blank = byName.get("blank.txt");
        assertEquals(Document.DocumentStatus.FAILED, blank.getStatus());
        assertTrue(blank.getError().startsWith("[EMPTY_CONTENT]"));
        IngestionTask task = taskTracker.findActiveTask(blank.getId()).orElseThrow();
        assertEquals(IngestionTask.TaskStage.CHUNK, task.getStage());
    }

    @Test
    void testUnsupportedFileRejectedBeforeAnyTask() {
        long before = documentRepository.count();

        BatchIngestResult result = orchestrator.ingest(List.of(
                file("setup.exe", "MZ"),
                file("ok.txt", "可以处理的文档。")), collection);

        assertEquals(1, result.getAccepted().size());
        assertEquals(1, result.getRejected().size());
        BatchIngestResult.RejectedFile rejected = result.getRejected().get(0);
        assertEquals("setup.exe", rejected.getFilename());
        assertEquals("UNSUPPORTED_FILE_TYPE", rejected.getCode());
        assertEquals(before + 1, documentRepository.count());
    }

    @Test
    void testParserFailureIsParseError() {
        DocumentDto handle = orchestrator.ingest(file("report.docx", "PK-not-really"), collection);

        Document document = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.FAILED, document.getStatus());
        assertTrue(document.getError().startsWith("[PARSE_ERROR]"));
    }

    @Test
    void testStoreUnavailableFailsAtEmbedThenReprocessSucceeds() {
        vectorStore.setAvailable(false);
        DocumentDto handle = orchestrator.ingest(file("manual.txt", "轴承温度过高。需要更换润滑油。"), collection);

        Document failed = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.FAILED, failed.getStatus());
        assertTrue(failed.getError().startsWith("[STORE_UNAVAILABLE]"));
        IngestionTask failedTask = taskTracker.findActiveTask(handle.getId()).orElseThrow();
        assertEquals(IngestionTask.TaskStage.EMBED, failedTask.getStage());
        assertEquals(60, failedTask.getProgress());

        vectorStore.setAvailable(true);
        orchestrator.reprocess(handle.getId());

        Document document = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.COMPLETED, document.getStatus());
        assertNull(document.getError());
        assertEquals(2, taskTracker.history(handle.getId()).size());
    }

    @Test
    void testReprocessOverwritesPoints() {
        DocumentDto handle = orchestrator.ingest(file("manual.txt", "第一句话。第二句话。第三句话。"), collection);
        List<String> firstRun = vectorStore.pointIds(collection);

        orchestrator.reprocess(handle.getId());

        List<String> secondRun = vectorStore.pointIds(collection);
        assertEquals(3, secondRun.size());
        assertEquals(new HashSet<>(firstRun), new HashSet<>(secondRun));
    }

    @Test
    void testProgressIsMonotonicAndReachesHundredOnlyOnCompletion() {
        DocumentDto handle = orchestrator.ingest(file("manual.txt", "一。二三四。五六七八。九十。"), collection);

        List<ProgressEvent> mine = events.stream()
                .filter(e -> handle.getId().equals(e.getDocumentId()))
                .collect(Collectors.toList());
        assertFalse(mine.isEmpty());

        int last = -1;
        for (ProgressEvent event : mine) {
            assertTrue(event.getProgress() >= last, "进度回退: " + event);
            if (event.getProgress() == 100) {
                assertEquals(IngestionTask.TaskStatus.COMPLETED, event.getStatus());
            }
            last = event.getProgress();
        }
        assertEquals(100, last);
    }

    @Test
    void testDeleteRemovesEverything() {
        DocumentDto handle = orchestrator.ingest(file("manual.txt", "第一句话。第二句话。"), collection);
        Document document = documentRepository.findById(handle.getId()).orElseThrow();

        orchestrator.delete(handle.getId());

        assertFalse(documentRepository.existsById(handle.getId()));
        assertFalse(documentTextRepository.existsById(document.getRawTextRef()));
        assertTrue(vectorStore.pointIds(collection).isEmpty());
        assertTrue(taskTracker.history(handle.getId()).isEmpty());
        assertThrows(DocumentNotFoundException.class, () -> orchestrator.delete(handle.getId()));
    }

    @Test
    void testPendingDocumentCannotBeDeletedOrReprocessed() {
        IngestionOrchestrator idle = orchestratorWith(task -> { });
        DocumentDto handle = idle.ingest(file("manual.txt", "等待处理的文档。"), collection);

        assertEquals(Document.DocumentStatus.PENDING, handle.getStatus());
        assertThrows(IllegalStateException.class, () -> idle.delete(handle.getId()));
        assertThrows(IllegalStateException.class, () -> idle.reprocess(handle.getId()));
    }

    @Test
    void testQueueFullFailsDocument() {
        IngestionOrchestrator full = orchestratorWith(task -> {
            throw new RejectedExecutionException("queue full");
        });

        DocumentDto handle = full.ingest(file("manual.txt", "排队失败的文档。"), collection);

        Document document = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.FAILED, document.getStatus());
        assertTrue(document.getError().startsWith("[UNKNOWN]"));
    }

    @Test
    void testDefaultCollectionIsUsed() {
        IngestionOrchestrator idle = orchestratorWith(task -> { });

        DocumentDto handle = idle.ingest(file("manual.txt", "默认集合。"), null);

        assertEquals(appProperties.getVector().getDefaultCollection(), handle.getCollectionName());
    }

    @Test
    void testUnexpectedRegistrationErrorDoesNotStrandBatch() {
        BatchIngestResult result = orchestrator.ingest(List.of(
                file("good.txt", "正常的文档内容。"),
                file("bad\u0000.txt", "文件名非法的文档。"),
                file("after.txt", "排在后面的文档。")), collection);

        assertEquals(2, result.getAccepted().size());
        assertEquals(1, result.getRejected().size());
        assertEquals("UNKNOWN", result.getRejected().get(0).getCode());
        for (DocumentDto handle : result.getAccepted()) {
            Document document = documentRepository.findById(handle.getId()).orElseThrow();
            assertEquals(Document.DocumentStatus.COMPLETED, document.getStatus(), document.getFilename());
        }
    }

    @Test
    void testConcurrentReprocessSubmitsOnce() throws Exception {
        AtomicInteger submissions = new AtomicInteger();
        IngestionOrchestrator counting = orchestratorWith(task -> submissions.incrementAndGet());
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                DocumentDto handle = orchestrator.ingest(file("manual.txt", "并发重新处理。"), collection);
                submissions.set(0);
                CountDownLatch go = new CountDownLatch(1);

                List<Future<Boolean>> calls = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    calls.add(callers.submit(() -> {
                        go.await();
                        try {
                            counting.reprocess(handle.getId());
                            return true;
                        } catch (IllegalStateException e) {
                            return false;
                        }
                    }));
                }
                go.countDown();

                int succeeded = 0;
                for (Future<Boolean> call : calls) {
                    if (call.get(10, TimeUnit.SECONDS)) {
                        succeeded++;
                    }
                }
                assertEquals(1, succeeded, "round " + round);
                assertEquals(1, submissions.get(), "round " + round);
                assertEquals(1, taskTracker.inFlightTasks().stream()
                        .filter(t -> handle.getId().equals(t.getDocumentId())).count());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void testDeleteKeepsDocumentWhenStoreUnavailable() {
        DocumentDto handle = orchestrator.ingest(file("manual.txt", "第一句话。第二句话。"), collection);
        vectorStore.setAvailable(false);

        IngestionException e = assertThrows(IngestionException.class, () -> orchestrator.delete(handle.getId()));

        assertEquals(IngestionException.ErrorType.STORE_UNAVAILABLE, e.getErrorType());
        assertEquals(Document.DocumentStatus.COMPLETED,
                documentRepository.findById(handle.getId()).orElseThrow().getStatus());

        vectorStore.setAvailable(true);
        orchestrator.delete(handle.getId());
        assertFalse(documentRepository.existsById(handle.getId()));
    }

    @Test
    void testInterruptedDocumentIsRecoveredOnStartup() {
        IngestionOrchestrator idle = orchestratorWith(task -> { });
        DocumentDto handle = idle.ingest(file("manual.txt", "处理到一半进程退出。"), collection);
        taskTracker.start(documentRepository.findById(handle.getId()).orElseThrow());

        interruptedTaskRecovery.recoverOnStartup();

        Document recovered = documentRepository.findById(handle.getId()).orElseThrow();
        assertEquals(Document.DocumentStatus.FAILED, recovered.getStatus());
        assertTrue(recovered.getError().startsWith("[UNKNOWN]"));

        orchestrator.reprocess(handle.getId());
        assertEquals(Document.DocumentStatus.COMPLETED,
                documentRepository.findById(handle.getId()).orElseThrow().getStatus());
    }

    @Test
    void testBatchOnWorkerPool() throws Exception {
        IngestionOrchestrator pooled = orchestratorWith(ingestionExecutor);
        List<UploadedFile> files = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            files.add(file("doc" + i + ".txt", "第" + i + "份文档。设备：PUMP-0" + i + "，运行正常。请定期检查。"));
        }
        files.add(file("report.docx", "本地无法解析"));

        BatchIngestResult result = pooled.ingest(files, collection);
        assertEquals(8, result.getAccepted().size());

        List<String> ids = result.getAccepted().stream().map(DocumentDto::getId).collect(Collectors.toList());
        long deadline = System.currentTimeMillis() + 30_000;
        while (!allTerminal(ids)) {
            assertTrue(System.currentTimeMillis() < deadline, "文档未在限定时间内处理完");
            Thread.sleep(50);
        }

        Map<Document.DocumentStatus, Long> byStatus = ids.stream()
                .map(id -> documentRepository.findById(id).orElseThrow().getStatus())
                .collect(Collectors.groupingBy(status -> status, Collectors.counting()));
        assertEquals(7L, byStatus.get(Document.DocumentStatus.COMPLETED));
        assertEquals(1L, byStatus.get(Document.DocumentStatus.FAILED));
        Document failed = ids.stream()
                .map(id -> documentRepository.findById(id).orElseThrow())
                .filter(d -> d.getStatus() == Document.DocumentStatus.FAILED)
                .findFirst().orElseThrow();
        assertEquals("report.docx", failed.getFilename());
        assertTrue(failed.getError().startsWith("[PARSE_ERROR]"));
        assertFalse(vectorStore.pointIds(collection).isEmpty());
        assertTrue(taskTracker.inFlightTasks().stream().noneMatch(t -> ids.contains(t.getDocumentId())));

        List<ProgressEvent> snapshot;
        synchronized (events) {
            snapshot = new ArrayList<>(events);
        }
        for (String id : ids) {
            int last = -1;
            for (ProgressEvent event : snapshot) {
                if (id.equals(event.getDocumentId())) {
                    assertTrue(event.getProgress() >= last, "进度回退: " + event);
                    last = event.getProgress();
                }
            }
        }
    }

    private boolean allTerminal(List<String> ids) {
        return ids.stream().allMatch(id -> documentRepository.findById(id)
                .map(d -> d.getStatus().isTerminal())
                .orElse(false));
    }

    private IngestionOrchestrator orchestratorWith(Executor executor) {
        return new IngestionOrchestrator(fileTypePolicy, parserClient, textChunker, entityExtractor,
                vectorStoreSync, taskTracker, documentRepository, documentTextRepository, uploadStorage,
                appProperties, executor);
    }

    private UploadedFile file(String name, String content) {
        return new UploadedFile(name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }
}
