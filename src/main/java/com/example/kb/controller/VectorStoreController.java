package com.example.kb.controller;

import com.example.kb.dto.VectorStoreStatusDto;
import com.example.kb.service.VectorStoreAdminService;
import com.example.kb.service.vector.VectorStoreClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 向量库状态控制器
 */
@RestController
@RequestMapping("/api/vector")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class VectorStoreController {

    private final VectorStoreAdminService vectorStoreAdminService;

    @GetMapping("/status")
    public ResponseEntity<VectorStoreStatusDto> status() {
        return ResponseEntity.ok(vectorStoreAdminService.status());
    }

    @GetMapping("/collections")
    public ResponseEntity<List<VectorStoreClient.CollectionInfo>> collections() {
        return ResponseEntity.ok(vectorStoreAdminService.listCollections());
    }

    /**
     * 删除集合及其全部知识点
     */
    @DeleteMapping("/collections/{name}")
    public ResponseEntity<Void> deleteCollection(@PathVariable String name) {
        vectorStoreAdminService.deleteCollection(name);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/collections/{name}/points/{pointKey}")
    public ResponseEntity<Void> deletePoint(@PathVariable String name, @PathVariable String pointKey) {
        vectorStoreAdminService.deletePoint(name, pointKey);
        return ResponseEntity.noContent().build();
    }
}
