package com.example.kb.service.vector;

import com.example.kb.entity.Document;
import com.example.kb.exception.IngestionException;
import com.example.kb.service.chunking.TextChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class VectorStoreSyncTest {

    private InMemoryVectorStoreClient store;
    private VectorStoreSync sync;
    private Document document;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStoreClient();
        sync = new VectorStoreSync(store);

        document = new Document();
        document.setId("doc-1");
        document.setFilename("manual.txt");
        document.setFileType("txt");
        document.setCollectionName("manuals");
    }

    @Test
    void testSyncCreatesCollectionAndWritesInOrder() {
        List<Integer> progress = new ArrayList<>();

        sync.syncChunks(document, chunks(3), progress::add);

        assertTrue(store.collectionExists("manuals"));
        assertEquals(3, store.pointIds("manuals").size());
        assertEquals(List.of(1, 2, 3), progress);
    }

    @Test
    void testResyncOverwritesInsteadOfDuplicating() {
        sync.syncChunks(document, chunks(3), written -> { });
        sync.syncChunks(document, chunks(3), written -> { });

        assertEquals(3, store.pointIds("manuals").size());
    }

    @Test
    void testEnsureCollectionSkipsCreateWhenPresent() {
        VectorStoreClient client = mock(VectorStoreClient.class);
        when(client.collectionExists("manuals")).thenReturn(true);

        new VectorStoreSync(client).ensureCollection("manuals");

        verify(client, never()).createCollection(anyString());
    }

    @Test
    void testFailureStopsWritingRemainingChunks() {
        VectorStoreClient client = mock(VectorStoreClient.class);
        when(client.collectionExists("manuals")).thenReturn(true);
        doNothing().doThrow(new IngestionException(IngestionException.ErrorType.STORE_WRITE_ERROR, "rejected"))
                .when(client).upsertPoint(eq("manuals"), any(KnowledgePoint.class));

        assertThrows(IngestionException.class,
                () -> new VectorStoreSync(client).syncChunks(document, chunks(3), written -> { }));
        verify(client, times(2)).upsertPoint(eq("manuals"), any(KnowledgePoint.class));
    }

    @Test
    void testKnowledgePointPayload() {
        KnowledgePoint point = sync.toKnowledgePoint(document, new TextChunk("doc-1", 2, "轴承温度"), LocalDateTime.now());

        assertEquals("doc-1-chunk-2", point.getId());
        assertEquals("manual.txt - 片段 3", point.getTitle());
        assertEquals("document", point.getCategory());
        assertEquals(List.of("txt"), point.getTags());
        assertEquals("manual.txt", point.getSource());
        assertEquals(2, point.toPayload().get("chunkIndex"));
    }

    private List<TextChunk> chunks(int count) {
        List<TextChunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            chunks.add(new TextChunk("doc-1", i, "第" + i + "段内容"));
        }
        return chunks;
    }
}
