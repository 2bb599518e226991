package com.example.kb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

/**
 * 应用配置属性
 */
@Data
@Configuration
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private DocumentConfig document = new DocumentConfig();
    @Valid
    private ChunkingConfig chunking = new ChunkingConfig();
    @Valid
    private VectorConfig vector = new VectorConfig();
    private ParserConfig parser = new ParserConfig();
    @Valid
    private IngestionConfig ingestion = new IngestionConfig();
    @Valid
    private EntityConfig entity = new EntityConfig();

    @Data
    public static class DocumentConfig {
        @NotBlank
        private String storagePath = "./uploads";
        @Min(1)
        private long maxFileSize = 52428800L;
        private String allowedTypes = "txt,md,json,csv,pdf,doc,docx,xls,xlsx";
        private String imageTypes = "png,jpg,jpeg,bmp,tiff,tif,webp,gif";
        // 解析服务具备 OCR 能力时才接收图片
        private boolean ocrEnabled = false;
    }

    @Data
    public static class ChunkingConfig {
        @Min(1)
        private int minChunkLength = 10;
        @Min(1)
        private int maxChunkLength = 1000;
    }

    @Data
    public static class VectorConfig {
        private String type = "qdrant";
        @NotBlank
        private String defaultCollection = "knowledge_documents";
        @Min(1)
        private int dimension = 384;
        private QdrantConfig qdrant = new QdrantConfig();

        @Data
        public static class QdrantConfig {
            private String url = "http://localhost:6333";
            private String apiKey;
            private int connectTimeout = 5000;
            private int readTimeout = 30000;
        }
    }

    @Data
    public static class ParserConfig {
        private String type = "local";
        private String endpoint;
        private int timeout = 60000;
    }

    @Data
    public static class IngestionConfig {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 100;
    }

    @Data
    public static class EntityConfig {
        @Min(1)
        private int maxEntityLength = 50;
        // 关系数量估算系数, 占位启发式, 待产品确认
        @DecimalMin("0.0")
        private double relationFactor = 0.5;
    }
}
