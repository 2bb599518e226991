package com.example.kb.service.parser.processor;

import com.example.kb.exception.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;

/**
 * PDF文档处理器 - 使用PDFBox提取纯文本
 */
@Slf4j
@Component
public class PdfDocumentProcessor implements DocumentProcessor {

    // 纯页码行, 如 "1", " 45 ", "- 1 -"
    private static final Pattern PAGE_NUMBER_PATTERN = Pattern.compile("^-?\\s*\\d+\\s*-?$");

    @Override
    public boolean supports(String fileType) {
        return "pdf".equalsIgnoreCase(fileType);
    }

    @Override
    public String extractText(InputStream inputStream, String filename) {
        try (PDDocument document = PDDocument.load(inputStream)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            String rawText = stripper.getText(document);
            String text = normalize(rawText);

            log.info("PDF解析完成: {}, 页数: {}, 原始字符: {}, 整理后字符: {}",
                    filename, document.getNumberOfPages(), rawText.length(), text.length());
            return text;
        } catch (IOException e) {
            log.error("PDF解析失败: {}", filename, e);
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "PDF文件解析失败: " + e.getMessage(), e);
        }
    }

    /**
     * 去掉页码行并合并连续空行
     */
    private String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder result = new StringBuilder();
        boolean lastBlank = false;
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!lastBlank && result.length() > 0) {
                    result.append("\n");
                }
                lastBlank = true;
                continue;
            }
            if (PAGE_NUMBER_PATTERN.matcher(trimmed).matches()) {
                continue;
            }
            result.append(trimmed).append("\n");
            lastBlank = false;
        }
        return result.toString().trim();
    }
}
