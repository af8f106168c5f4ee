package com.ryuqq.docstore.application.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.docstore.core.exception.DocumentFormatException;
import com.ryuqq.docstore.core.schema.FieldKind;
import com.ryuqq.docstore.core.schema.Schema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 스키마 카탈로그 로더.
 *
 * <p>카탈로그 형식:</p>
 * <pre>
 * {
 *   "users": {
 *     "required": ["email"],
 *     "types": {"email": "string", "is_active": "boolean"},
 *     "defaults": {"is_active": true}
 *   }
 * }
 * </pre>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class SchemaCatalogReader {

    /**
     * 플랫폼 기본 컬렉션 스키마 리소스 경로.
     */
    public static final String PLATFORM_CATALOG = "docstore/platform-schemas.json";

    private final ObjectMapper mapper;

    public SchemaCatalogReader() {
        this(new ObjectMapper());
    }

    public SchemaCatalogReader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 플랫폼 기본 카탈로그 로드.
     *
     * @return 컬렉션 이름별 스키마 (선언 순서 유지)
     */
    public Map<String, Schema> readPlatformCatalog() {
        return readResource(PLATFORM_CATALOG);
    }

    /**
     * 클래스패스 리소스에서 카탈로그 로드.
     *
     * @param resource 리소스 경로
     * @return 컬렉션 이름별 스키마
     * @throws IllegalArgumentException 리소스가 없는 경우
     */
    public Map<String, Schema> readResource(String resource) {
        ClassLoader loader = SchemaCatalogReader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema catalog not found on classpath: " + resource);
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema catalog: " + resource, e);
        }
    }

    public Map<String, Schema> read(InputStream in) throws IOException {
        return toCatalog(mapper.readTree(in));
    }

    public Map<String, Schema> read(String json) {
        try {
            return toCatalog(mapper.readTree(json));
        } catch (IOException e) {
            throw new DocumentFormatException("Schema catalog is not valid JSON", e);
        }
    }

    private Map<String, Schema> toCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DocumentFormatException("Schema catalog must be a JSON object");
        }
        Map<String, Schema> catalog = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> collections = root.fields();
        while (collections.hasNext()) {
            Map.Entry<String, JsonNode> entry = collections.next();
            catalog.put(entry.getKey(), toSchema(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableMap(catalog);
    }

    private Schema toSchema(String collection, JsonNode node) {
        if (!node.isObject()) {
            throw new DocumentFormatException("Schema for " + collection + " must be a JSON object");
        }
        Schema.Builder builder = Schema.builder();
        for (JsonNode field : node.path("required")) {
            builder.required(field.asText());
        }
        Iterator<Map.Entry<String, JsonNode>> types = node.path("types").fields();
        while (types.hasNext()) {
            Map.Entry<String, JsonNode> type = types.next();
            builder.type(type.getKey(), FieldKind.parse(type.getValue().asText()));
        }
        Iterator<Map.Entry<String, JsonNode>> defaults = node.path("defaults").fields();
        while (defaults.hasNext()) {
            Map.Entry<String, JsonNode> value = defaults.next();
            builder.defaultValue(value.getKey(), mapper.convertValue(value.getValue(), Object.class));
        }
        return builder.build();
    }
}
