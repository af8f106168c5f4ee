package com.ryuqq.docstore.adapter.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.DocumentFormatException;
import com.ryuqq.docstore.core.exception.NetworkException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.exception.RemoteStoreException;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * GitHub contents REST API 위의 {@link ObjectStore} 구현체.
 *
 * <p><strong>요청:</strong></p>
 * <ul>
 *   <li>GET {@code /repos/{owner}/{repo}/contents/{path}?ref={branch}} (+ {@code If-None-Match})</li>
 *   <li>PUT {@code /repos/{owner}/{repo}/contents/{path}} with {@code {message, content, branch, sha?}}</li>
 * </ul>
 *
 * <p><strong>상태 코드 매핑:</strong></p>
 * <ul>
 *   <li>200 / 201: 성공</li>
 *   <li>304: {@link FetchResult#notModified()}</li>
 *   <li>404: {@link NotFoundException}</li>
 *   <li>409, 또는 sha를 언급하는 422: {@link ConflictException}</li>
 *   <li>그 외: {@link RemoteStoreException}</li>
 * </ul>
 *
 * <p>전송 실패와 인터럽트는 {@link NetworkException}으로 변환됩니다.
 * 1MB를 넘어 본문이 인라인되지 않는 파일은 지원하지 않습니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class GitHubObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(GitHubObjectStore.class);

    static final String ACCEPT = "application/vnd.github+json";
    static final String USER_AGENT = "docstore-client";
    private static final int MAX_DETAIL_LENGTH = 200;

    private final GitHubStoreConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public GitHubObjectStore(GitHubStoreConfig config) {
        this(config, defaultClient(config), new ObjectMapper());
    }

    /**
     * HttpClient, ObjectMapper 주입 생성자.
     *
     * @param config     저장소 좌표
     * @param httpClient HTTP 클라이언트
     * @param mapper     API 본문용 ObjectMapper
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public GitHubObjectStore(GitHubStoreConfig config, HttpClient httpClient, ObjectMapper mapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    @Override
    public FetchResult get(String path, String ifNoneMatch) {
        HttpRequest.Builder builder = request(contentsUri(path, true)).GET();
        if (ifNoneMatch != null) {
            builder.header("If-None-Match", ifNoneMatch);
        }
        HttpResponse<String> response = send(builder.build(), path);
        int status = response.statusCode();
        log.debug("GET {} -> {}", path, status);

        switch (status) {
            case 200:
                return FetchResult.fetched(toStoredObject(path, response));
            case 304:
                return FetchResult.notModified();
            case 404:
                throw NotFoundException.forPath(path);
            default:
                throw new RemoteStoreException(path, status, detailOf(response.body()));
        }
    }

    @Override
    public String put(String path, String content, String sha, String message) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("message", message == null ? "Update " + path : message);
        body.put("content", ContentEncoding.encode(content));
        body.put("branch", config.branch());
        if (sha != null) {
            body.put("sha", sha);
        }

        HttpRequest request = request(contentsUri(path, false))
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(write(body), StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = send(request, path);
        int status = response.statusCode();
        log.debug("PUT {} (sha {}) -> {}", path, sha, status);

        switch (status) {
            case 200:
            case 201:
                return newShaOf(path, response);
            case 409:
                throw new ConflictException(path, sha);
            case 422:
                if (mentionsSha(response.body())) {
                    throw new ConflictException(path, sha);
                }
                throw new RemoteStoreException(path, status, detailOf(response.body()));
            case 404:
                throw NotFoundException.forPath(path);
            default:
                throw new RemoteStoreException(path, status, detailOf(response.body()));
        }
    }

    public GitHubStoreConfig getConfig() {
        return config;
    }

    // ========================================
    // HTTP
    // ========================================

    private HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Authorization", "Bearer " + config.token())
            .header("Accept", ACCEPT)
            .header("User-Agent", USER_AGENT);
    }

    private HttpResponse<String> send(HttpRequest request, String path) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NetworkException(request.method() + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(request.method() + " " + path + " interrupted", e);
        }
    }

    URI contentsUri(String path, boolean withRef) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        StringBuilder uri = new StringBuilder(config.apiBaseUrl())
            .append("/repos/").append(encodeSegment(config.owner()))
            .append('/').append(encodeSegment(config.repo()))
            .append("/contents");
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                uri.append('/').append(encodeSegment(segment));
            }
        }
        if (withRef) {
            uri.append("?ref=").append(encodeSegment(config.branch()));
        }
        return URI.create(uri.toString());
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static HttpClient defaultClient(GitHubStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    // ========================================
    // Body
    // ========================================

    private StoredObject toStoredObject(String path, HttpResponse<String> response) {
        JsonNode node = read(path, response.body());
        JsonNode content = node.get("content");
        JsonNode sha = node.get("sha");
        if (sha == null || !sha.isTextual()) {
            throw new RemoteStoreException(path, response.statusCode(), "response has no sha");
        }
        String encoding = node.path("encoding").asText("base64");
        if (content == null || !content.isTextual() || !"base64".equals(encoding)) {
            throw new RemoteStoreException(path, response.statusCode(),
                "content is not inlined (encoding: " + encoding + ")");
        }
        String etag = response.headers().firstValue("ETag").orElse(null);
        return new StoredObject(path, ContentEncoding.decode(content.asText()), sha.asText(), etag);
    }

    private String newShaOf(String path, HttpResponse<String> response) {
        JsonNode sha = read(path, response.body()).path("content").get("sha");
        if (sha == null || !sha.isTextual()) {
            throw new RemoteStoreException(path, response.statusCode(), "response has no content.sha");
        }
        return sha.asText();
    }

    private JsonNode read(String path, String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Invalid GitHub response for " + path, e);
        }
    }

    private String write(ObjectNode body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Failed to encode request body", e);
        }
    }

    private boolean mentionsSha(String body) {
        return detailOf(body).toLowerCase(Locale.ROOT).contains("sha");
    }

    private String detailOf(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode message = mapper.readTree(body).get("message");
            if (message != null && message.isTextual()) {
                return message.asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > MAX_DETAIL_LENGTH ? body.substring(0, MAX_DETAIL_LENGTH) : body;
    }
}
