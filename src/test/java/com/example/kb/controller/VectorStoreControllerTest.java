package com.example.kb.controller;

import com.example.kb.dto.VectorStoreStatusDto;
import com.example.kb.exception.IngestionException;
import com.example.kb.service.VectorStoreAdminService;
import com.example.kb.service.vector.VectorStoreClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VectorStoreController.class)
class VectorStoreControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VectorStoreAdminService vectorStoreAdminService;

    @Test
    void testStatus() throws Exception {
        when(vectorStoreAdminService.status())
                .thenReturn(new VectorStoreStatusDto(true, "qdrant", "http://localhost:6333/"));

        mockMvc.perform(get("/api/vector/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.type").value("qdrant"));
    }

    @Test
    void testListCollections() throws Exception {
        when(vectorStoreAdminService.listCollections())
                .thenReturn(List.of(new VectorStoreClient.CollectionInfo("manuals", 12)));

        mockMvc.perform(get("/api/vector/collections"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("manuals"))
                .andExpect(jsonPath("$[0].pointsCount").value(12));
    }

    @Test
    void testDeleteCollection() throws Exception {
        mockMvc.perform(delete("/api/vector/collections/manuals"))
                .andExpect(status().isNoContent());

        verify(vectorStoreAdminService).deleteCollection("manuals");
    }

    @Test
    void testDeletePoint() throws Exception {
        mockMvc.perform(delete("/api/vector/collections/manuals/points/doc-1-chunk-0"))
                .andExpect(status().isNoContent());

        verify(vectorStoreAdminService).deletePoint("manuals", "doc-1-chunk-0");
    }

    @Test
    void testDeleteWhenStoreUnavailable() throws Exception {
        doThrow(new IngestionException(IngestionException.ErrorType.STORE_UNAVAILABLE, "向量库不可达"))
                .when(vectorStoreAdminService).deleteCollection("manuals");

        mockMvc.perform(delete("/api/vector/collections/manuals"))
                .andExpect(status().isServiceUnavailable());
    }
}
