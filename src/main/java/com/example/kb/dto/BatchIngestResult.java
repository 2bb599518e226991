package com.example.kb.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量上传结果: 已受理的文档句柄与入库前被拒绝的文件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResult {
    private List<DocumentDto> accepted = new ArrayList<>();
    private List<RejectedFile> rejected = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectedFile {
        private String filename;
        private String code;
        private String reason;
    }
}
