package com.example.kb.service.parser;

import com.example.kb.config.AppProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 远程解析服务客户端 (支持 Office/OCR 等格式)
 *
 * 请求: {filename, mimeType, content(base64)}
 * 响应: {success, content, error, metadata: {wordCount}}
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.parser.type", havingValue = "remote")
public class RemoteDocumentParserClient implements DocumentParserClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public RemoteDocumentParserClient(AppProperties appProperties) {
        AppProperties.ParserConfig config = appProperties.getParser();
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("app.parser.endpoint 未配置");
        }
        this.endpoint = config.getEndpoint();
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(config.getTimeout(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public ParseResult parse(byte[] content, String filename, String mimeType) {
        try {
            Map<String, Object> requestMap = new HashMap<>();
            requestMap.put("filename", filename);
            requestMap.put("mimeType", mimeType != null ? mimeType : "application/octet-stream");
            requestMap.put("content", Base64.getEncoder().encodeToString(content));

            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(objectMapper.writeValueAsString(requestMap), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                String responseBody = body != null ? body.string() : "";
                if (!response.isSuccessful()) {
                    log.warn("解析服务返回错误: filename={}, code={}", filename, response.code());
                    return ParseResult.failure("解析服务调用失败: " + response.code());
                }

                JsonNode root = objectMapper.readTree(responseBody);
                if (!root.path("success").asBoolean(false)) {
                    return ParseResult.failure(root.path("error").asText("解析服务未返回错误原因"));
                }

                String text = root.path("content").asText("");
                int wordCount = root.path("metadata").path("wordCount").asInt(ParseResult.countWords(text));
                log.info("远程解析完成: {}, 字符数: {}", filename, text.length());
                return ParseResult.success(text, wordCount);
            }
        } catch (IOException e) {
            log.error("解析服务不可用: filename={}", filename, e);
            return ParseResult.failure("解析服务不可用: " + e.getMessage());
        }
    }
}
