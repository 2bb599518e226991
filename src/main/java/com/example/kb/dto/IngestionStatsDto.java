package com.example.kb.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 入库统计, 全部由文档记录推导
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionStatsDto {
    private long totalDocuments;
    private long pending;
    private long processing;
    private long completed;
    private long failed;
    private long totalChunks;
    private long totalEntities;
    private Map<String, Long> pointsByCollection;
}
