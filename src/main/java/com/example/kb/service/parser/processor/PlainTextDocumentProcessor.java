package com.example.kb.service.parser.processor;

import com.example.kb.exception.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * 纯文本处理器 (txt/json), 按 UTF-8 原样读取
 */
@Slf4j
@Component
public class PlainTextDocumentProcessor implements DocumentProcessor {

    @Override
    public boolean supports(String fileType) {
        return "txt".equalsIgnoreCase(fileType) || "json".equalsIgnoreCase(fileType);
    }

    @Override
    public String extractText(InputStream inputStream, String filename) {
        try {
            String text = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            // 去掉 BOM
            if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                text = text.substring(1);
            }
            log.debug("文本读取完成: {}, 字符数: {}", filename, text.length());
            return text;
        } catch (IOException e) {
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "文本文件读取失败: " + e.getMessage(), e);
        }
    }
}
