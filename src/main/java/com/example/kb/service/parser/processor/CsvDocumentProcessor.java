package com.example.kb.service.parser.processor;

import com.example.kb.exception.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CSV处理器 - 将表格转换为描述性文本, 仅展开前若干条记录
 */
@Slf4j
@Component
public class CsvDocumentProcessor implements DocumentProcessor {

    static final int MAX_RECORDS = 10;

    @Override
    public boolean supports(String fileType) {
        return "csv".equalsIgnoreCase(fileType);
    }

    @Override
    public String extractText(InputStream inputStream, String filename) {
        String raw;
        try {
            raw = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "CSV文件读取失败: " + e.getMessage(), e);
        }

        List<String> lines = new ArrayList<>();
        for (String line : raw.split("\\r?\\n")) {
            if (!line.trim().isEmpty()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return "";
        }

        String[] headers = splitRow(lines.get(0));
        List<String> rows = lines.subList(1, lines.size());

        StringBuilder text = new StringBuilder();
        text.append("表格数据包含 ").append(rows.size()).append(" 行记录，字段包括：")
                .append(String.join("、", headers)).append("。\n\n");

        for (int i = 0; i < Math.min(MAX_RECORDS, rows.size()); i++) {
            String[] values = splitRow(rows.get(i));
            List<String> fields = new ArrayList<>();
            for (int j = 0; j < headers.length; j++) {
                fields.add(headers[j] + ": " + (j < values.length ? values[j] : ""));
            }
            text.append("记录 ").append(i + 1).append(": ").append(String.join(", ", fields)).append("\n");
        }

        log.info("CSV解析完成: {}, 记录数: {}, 字段数: {}", filename, rows.size(), headers.length);
        return text.toString();
    }

    private String[] splitRow(String row) {
        return Arrays.stream(row.split(",", -1))
                .map(String::trim)
                .toArray(String[]::new);
    }
}
