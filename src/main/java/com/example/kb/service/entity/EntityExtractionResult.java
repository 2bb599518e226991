package com.example.kb.service.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Set;

/**
 * 实体抽取结果
 */
@Data
@AllArgsConstructor
public class EntityExtractionResult {
    private Set<String> entities;
    private int relationCount;

    public int getEntityCount() {
        return entities.size();
    }
}
