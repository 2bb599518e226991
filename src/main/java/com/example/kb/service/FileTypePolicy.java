package com.example.kb.service;

import com.example.kb.config.AppProperties;
import com.example.kb.dto.UploadedFile;
import com.example.kb.exception.IngestionException;
import com.example.kb.service.parser.FileTypes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 入库前的文件校验: 扩展名白名单、空文件、大小上限
 */
@Component
@RequiredArgsConstructor
public class FileTypePolicy {

    private final AppProperties appProperties;

    public Set<String> allowedTypes() {
        AppProperties.DocumentConfig config = appProperties.getDocument();
        Set<String> types = new LinkedHashSet<>(parse(config.getAllowedTypes()));
        if (config.isOcrEnabled()) {
            types.addAll(parse(config.getImageTypes()));
        }
        return types;
    }

    /**
     * 校验上传文件, 不通过时抛出 UNSUPPORTED_FILE_TYPE, 此时不会创建任何任务
     */
    public String validate(UploadedFile file) {
        if (file == null || file.getFilename() == null || file.getFilename().isBlank()) {
            throw new IngestionException(IngestionException.ErrorType.UNSUPPORTED_FILE_TYPE, "文件名不能为空");
        }

        String fileType = FileTypes.extensionOf(file.getFilename());
        Set<String> allowed = allowedTypes();
        if (!allowed.contains(fileType)) {
            String shown = fileType.isEmpty() ? "(无扩展名)" : "." + fileType;
            throw new IngestionException(IngestionException.ErrorType.UNSUPPORTED_FILE_TYPE,
                    "不支持的文件类型: " + shown + ". 允许的类型: " + String.join(",", allowed));
        }

        if (file.getSize() == 0) {
            throw new IngestionException(IngestionException.ErrorType.UNSUPPORTED_FILE_TYPE,
                    "文件不能为空: " + file.getFilename());
        }

        long maxFileSize = appProperties.getDocument().getMaxFileSize();
        if (file.getSize() > maxFileSize) {
            throw new IngestionException(IngestionException.ErrorType.UNSUPPORTED_FILE_TYPE,
                    "文件大小超过限制. 当前: " + file.getSize() + ", 限制: " + maxFileSize);
        }
        return fileType;
    }

    private Set<String> parse(String types) {
        if (types == null) {
            return Set.of();
        }
        return Arrays.stream(types.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
