package com.example.kb.service.parser;

import com.example.kb.service.parser.processor.CsvDocumentProcessor;
import com.example.kb.service.parser.processor.MarkdownDocumentProcessor;
import com.example.kb.service.parser.processor.PdfDocumentProcessor;
import com.example.kb.service.parser.processor.PlainTextDocumentProcessor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalDocumentParserClientTest {

    private final LocalDocumentParserClient client = new LocalDocumentParserClient(List.of(
            new PlainTextDocumentProcessor(),
            new MarkdownDocumentProcessor(),
            new CsvDocumentProcessor(),
            new PdfDocumentProcessor()));

    @Test
    void testPlainText() {
        ParseResult result = client.parse(bytes("\uFEFF轴承温度 normal range"), "note.txt", "text/plain");

        assertTrue(result.isSuccess());
        assertEquals("轴承温度 normal range", result.getContent());
        assertEquals(6, result.getWordCount());
    }

    @Test
    void testMarkdownFormattingIsRemoved() {
        ParseResult result = client.parse(bytes("# 标题\n\n一段**加粗**文字"), "guide.md", "text/markdown");

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().contains("标题"));
        assertTrue(result.getContent().contains("一段加粗文字"));
        assertFalse(result.getContent().contains("**"));
    }

    @Test
    void testOfficeFormatsNeedRemoteParser() {
        ParseResult result = client.parse(bytes("PK"), "report.docx", null);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("docx"));
    }

    @Test
    void testCorruptPdfIsFailure() {
        ParseResult result = client.parse(bytes("not a pdf"), "broken.pdf", "application/pdf");

        assertFalse(result.isSuccess());
        assertNotNull(result.getError());
    }

    private byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
