package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.application.audit.AuditLog;
import com.ryuqq.docstore.application.codec.SchemaCatalogReader;
import com.ryuqq.docstore.core.schema.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DocumentStore 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>basePath: "db"</li>
 *   <li>schemas: 없음</li>
 *   <li>enforceTypes: false (타입 선언은 힌트로만 사용)</li>
 *   <li>auditCapacity: 100</li>
 * </ul>
 *
 * @param basePath      컬렉션 파일이 위치한 원격 디렉터리
 * @param schemas       컬렉션 이름별 스키마
 * @param enforceTypes  스키마 타입 검사 여부
 * @param auditCapacity 컬렉션별 감사 로그 보관 개수
 * @author DocStore Team
 * @since 1.0.0
 */
public record DocumentStoreConfig(
    String basePath,
    Map<String, Schema> schemas,
    boolean enforceTypes,
    int auditCapacity
) {

    public static final String DEFAULT_BASE_PATH = "db";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException basePath가 null이거나 auditCapacity가 1 미만인 경우
     */
    public DocumentStoreConfig {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        schemas = schemas == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        if (auditCapacity < 1) {
            throw new IllegalArgumentException("auditCapacity must be positive (current: " + auditCapacity + ")");
        }
    }

    public static DocumentStoreConfig defaultConfig() {
        return new DocumentStoreConfig(DEFAULT_BASE_PATH, Map.of(), false, AuditLog.DEFAULT_CAPACITY);
    }

    /**
     * 플랫폼 기본 스키마 카탈로그를 포함한 설정.
     *
     * @return 기본값 + {@link SchemaCatalogReader#PLATFORM_CATALOG}
     */
    public static DocumentStoreConfig platformConfig() {
        return defaultConfig().withSchemas(new SchemaCatalogReader().readPlatformCatalog());
    }

    public DocumentStoreConfig withBasePath(String basePath) {
        return new DocumentStoreConfig(basePath, schemas, enforceTypes, auditCapacity);
    }

    public DocumentStoreConfig withSchemas(Map<String, Schema> schemas) {
        return new DocumentStoreConfig(basePath, schemas, enforceTypes, auditCapacity);
    }

    public DocumentStoreConfig withEnforceTypes(boolean enforceTypes) {
        return new DocumentStoreConfig(basePath, schemas, enforceTypes, auditCapacity);
    }

    public DocumentStoreConfig withAuditCapacity(int auditCapacity) {
        return new DocumentStoreConfig(basePath, schemas, enforceTypes, auditCapacity);
    }
}
