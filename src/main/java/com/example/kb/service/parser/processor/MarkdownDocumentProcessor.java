package com.example.kb.service.parser.processor;

import com.example.kb.exception.IngestionException;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Markdown文档处理器 - 使用Flexmark去除格式标记
 */
@Slf4j
@Component
public class MarkdownDocumentProcessor implements DocumentProcessor {

    private final Parser parser;

    public MarkdownDocumentProcessor() {
        this.parser = Parser.builder().build();
    }

    @Override
    public boolean supports(String fileType) {
        return "md".equalsIgnoreCase(fileType) || "markdown".equalsIgnoreCase(fileType);
    }

    @Override
    public String extractText(InputStream inputStream, String filename) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {

            String markdown = reader.lines().collect(Collectors.joining("\n"));

            Node document = parser.parse(markdown);
            StringBuilder sb = new StringBuilder();
            extractTextFromNode(document, sb);
            String text = sb.toString().trim();

            log.info("Markdown解析完成: {}, 字符数: {}", filename, text.length());
            return text;

        } catch (IOException e) {
            log.error("Markdown解析失败: {}", filename, e);
            throw new IngestionException(IngestionException.ErrorType.PARSE_ERROR,
                    "Markdown文件读取失败: " + e.getMessage(), e);
        }
    }

    /**
     * 遍历AST提取纯文本, 段落和标题各占一行
     */
    private void extractTextFromNode(Node node, StringBuilder sb) {
        Node child = node.getFirstChild();
        while (child != null) {
            if (child instanceof Text) {
                sb.append(child.getChars());
            } else if (child instanceof SoftLineBreak || child instanceof HardLineBreak) {
                sb.append("\n");
            } else if (child instanceof Paragraph || child instanceof Heading) {
                extractTextFromNode(child, sb);
                sb.append("\n");
            } else {
                extractTextFromNode(child, sb);
            }
            child = child.getNext();
        }
    }
}
