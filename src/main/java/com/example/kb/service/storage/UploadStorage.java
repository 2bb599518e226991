package com.example.kb.service.storage;

import com.example.kb.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 上传文件落盘, 重新处理时从这里重新读取原始字节
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadStorage {

    private final AppProperties appProperties;

    public String save(String documentId, String filename, byte[] content) {
        try {
            Path uploadDir = Paths.get(appProperties.getDocument().getStoragePath());
            if (!Files.exists(uploadDir)) {
                Files.createDirectories(uploadDir);
            }

            String storedName = documentId + "_" + sanitize(filename);
            Path filePath = uploadDir.resolve(storedName).toAbsolutePath();
            Files.write(filePath, content);
            return filePath.toString();
        } catch (IOException e) {
            log.error("文件保存失败: documentId={}, filename={}", documentId, filename, e);
            throw new UncheckedIOException("文件保存失败: " + e.getMessage(), e);
        }
    }

    public byte[] read(String filePath) throws IOException {
        return Files.readAllBytes(Paths.get(filePath));
    }

    public void delete(String filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(Paths.get(filePath));
        } catch (IOException e) {
            log.warn("上传文件删除失败: {}", filePath, e);
        }
    }

    // 去掉路径成分, 防止写出上传目录
    private String sanitize(String filename) {
        String name = Paths.get(filename).getFileName().toString();
        return name.replaceAll("[\\\\/:*?\"<>|]", "_");
    }
}
