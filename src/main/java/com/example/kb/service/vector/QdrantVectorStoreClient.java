package com.example.kb.service.vector;

import com.example.kb.config.AppProperties;
import com.example.kb.exception.IngestionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Qdrant 向量库客户端 (REST API)
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.vector.type", havingValue = "qdrant", matchIfMissing = true)
public class QdrantVectorStoreClient implements VectorStoreClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TextVectorizer vectorizer;
    private final HttpUrl baseUrl;
    private final String apiKey;

    @Autowired
    public QdrantVectorStoreClient(AppProperties appProperties, TextVectorizer vectorizer) {
        this(appProperties.getVector().getQdrant(), vectorizer);
    }

    QdrantVectorStoreClient(AppProperties.VectorConfig.QdrantConfig config, TextVectorizer vectorizer) {
        this.baseUrl = HttpUrl.get(config.getUrl());
        this.apiKey = config.getApiKey();
        this.vectorizer = vectorizer;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeout(), TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * Qdrant 只接受无符号整数或 UUID 作为点ID, 这里把知识点键映射为基于名称的 UUID
     */
    static String toStoreId(String pointKey) {
        return UUID.nameUUIDFromBytes(pointKey.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public List<CollectionInfo> listCollections() {
        JsonNode root = execute(newRequest("collections").get().build(), false);
        List<CollectionInfo> collections = new ArrayList<>();
        for (JsonNode col : root.path("result").path("collections")) {
            String name = col.path("name").asText();
            long pointsCount = 0;
            try {
                JsonNode info = execute(newRequest("collections", name).get().build(), false);
                pointsCount = info.path("result").path("points_count").asLong(0);
            } catch (IngestionException e) {
                log.warn("获取集合信息失败: collection={}, error={}", name, e.getMessage());
            }
            collections.add(new CollectionInfo(name, pointsCount));
        }
        return collections;
    }

    @Override
    public boolean collectionExists(String name) {
        Request request = newRequest("collections", name).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return false;
            }
            if (!response.isSuccessful()) {
                throw new IngestionException(IngestionException.ErrorType.STORE_UNAVAILABLE,
                        "查询集合失败: " + name + ", code=" + response.code());
            }
            return true;
        } catch (IOException e) {
            throw unavailable(e);
        }
    }

    @Override
    public void createCollection(String name) {
        Map<String, Object> vectors = new HashMap<>();
        vectors.put("size", vectorizer.getDimension());
        vectors.put("distance", "Cosine");
        Request request = newRequest("collections", name)
                .put(jsonBody(Collections.singletonMap("vectors", vectors)))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = bodyOf(response);
            if (response.isSuccessful()) {
                log.info("Qdrant集合已创建: {}", name);
                return;
            }
            // 并发创建同名集合时, 后到者收到 "already exists", 视为成功
            if (response.code() == 409 || body.contains("already exists")) {
                log.debug("Qdrant集合已存在: {}", name);
                return;
            }
            throw new IngestionException(IngestionException.ErrorType.STORE_WRITE_ERROR,
                    "创建集合失败: " + name + ", code=" + response.code());
        } catch (IOException e) {
            throw unavailable(e);
        }
    }

    @Override
    public void upsertPoint(String collection, KnowledgePoint point) {
        Map<String, Object> qdrantPoint = new HashMap<>();
        qdrantPoint.put("id", toStoreId(point.getId()));
        qdrantPoint.put("vector", vectorizer.vectorize(point.getVectorSourceText()));
        qdrantPoint.put("payload", point.toPayload());

        Request request = newRequest("collections", collection, "points")
                .put(jsonBody(Collections.singletonMap("points", List.of(qdrantPoint))))
                .build();
        execute(request, true);
    }

    @Override
    public void deletePoint(String collection, String pointId) {
        Request request = newRequest("collections", collection, "points", "delete")
                .post(jsonBody(Collections.singletonMap("points", List.of(toStoreId(pointId)))))
                .build();
        execute(request, true);
    }

    @Override
    public void deletePointsByDocument(String collection, String documentId) {
        if (!collectionExists(collection)) {
            return;
        }
        Map<String, Object> match = Collections.singletonMap("value", documentId);
        Map<String, Object> condition = new HashMap<>();
        condition.put("key", "documentId");
        condition.put("match", match);
        Map<String, Object> filter = Collections.singletonMap("must", List.of(condition));

        Request request = newRequest("collections", collection, "points", "delete")
                .post(jsonBody(Collections.singletonMap("filter", filter)))
                .build();
        execute(request, true);
        log.info("Qdrant删除文档知识点: collection={}, documentId={}", collection, documentId);
    }

    @Override
    public void deleteCollection(String name) {
        execute(newRequest("collections", name).delete().build(), true);
        log.info("Qdrant集合已删除: {}", name);
    }

    @Override
    public boolean isAvailable() {
        Request request = newRequest("collections").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.warn("Qdrant 连接检查失败: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getType() {
        return "qdrant";
    }

    @Override
    public String getEndpoint() {
        return baseUrl.toString();
    }

    private Request.Builder newRequest(String... segments) {
        HttpUrl.Builder url = baseUrl.newBuilder();
        for (String segment : segments) {
            url.addPathSegment(segment);
        }
        if (segments.length > 2 && "points".equals(segments[2])) {
            url.addQueryParameter("wait", "true");
        }
        Request.Builder builder = new Request.Builder()
                .url(url.build())
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private RequestBody jsonBody(Object body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (IOException e) {
            throw new IngestionException(IngestionException.ErrorType.STORE_WRITE_ERROR,
                    "请求序列化失败: " + e.getMessage(), e);
        }
    }

    private JsonNode execute(Request request, boolean write) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = bodyOf(response);
            if (!response.isSuccessful()) {
                log.error("Qdrant 响应错误: {} {}, code={}, body={}",
                        request.method(), request.url().encodedPath(), response.code(), body);
                IngestionException.ErrorType type = write || response.code() < 500
                        ? IngestionException.ErrorType.STORE_WRITE_ERROR
                        : IngestionException.ErrorType.STORE_UNAVAILABLE;
                throw new IngestionException(type, "Qdrant调用失败: " + response.code());
            }
            return body.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw unavailable(e);
        }
    }

    private String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private IngestionException unavailable(IOException e) {
        return new IngestionException(IngestionException.ErrorType.STORE_UNAVAILABLE,
                "向量库不可达: " + e.getMessage(), e);
    }
}
