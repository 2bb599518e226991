package com.example.kb.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 待入库的上传文件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadedFile {
    private String filename;
    private String mimeType;
    private byte[] content;

    public long getSize() {
        return content != null ? content.length : 0L;
    }
}
