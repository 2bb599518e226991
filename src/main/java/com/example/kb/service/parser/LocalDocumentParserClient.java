package com.example.kb.service.parser;

import com.example.kb.exception.IngestionException;
import com.example.kb.service.parser.processor.DocumentProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Optional;

/**
 * 本地解析 - 按扩展名分派给进程内的文档处理器
 *
 * 仅覆盖文本类格式与 PDF/Markdown; Office 与图片需要配置远程解析服务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.parser.type", havingValue = "local", matchIfMissing = true)
public class LocalDocumentParserClient implements DocumentParserClient {

    private final List<DocumentProcessor> processors;

    @Override
    public ParseResult parse(byte[] content, String filename, String mimeType) {
        String fileType = FileTypes.extensionOf(filename);
        Optional<DocumentProcessor> processor = processors.stream()
                .filter(p -> p.supports(fileType))
                .findFirst();
        if (processor.isEmpty()) {
            return ParseResult.failure("没有找到支持该类型的解析器: " + fileType);
        }

        try {
            String text = processor.get().extractText(new ByteArrayInputStream(content), filename);
            return ParseResult.success(text, ParseResult.countWords(text));
        } catch (IngestionException e) {
            return ParseResult.failure(e.getMessage());
        }
    }
}
