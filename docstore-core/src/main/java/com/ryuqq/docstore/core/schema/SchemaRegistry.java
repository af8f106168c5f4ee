package com.ryuqq.docstore.core.schema;

import com.ryuqq.docstore.core.exception.SchemaValidationException;
import com.ryuqq.docstore.core.model.CollectionName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 컬렉션 이름별 {@link Schema} 조회, 기본값 적용, 검증.
 *
 * <p>스키마가 등록되지 않은 컬렉션은 모든 레코드를 허용합니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 등록과 조회는 동시에 실행될 수 있습니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class SchemaRegistry {

    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();
    private final boolean enforceTypes;

    /**
     * @param enforceTypes true면 validate 시 선언된 필드 종류도 검사
     */
    public SchemaRegistry(boolean enforceTypes) {
        this.enforceTypes = enforceTypes;
    }

    public SchemaRegistry() {
        this(false);
    }

    public void register(String collection, Schema schema) {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        schemas.put(collection, schema);
    }

    public void registerAll(Map<String, Schema> catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        catalog.forEach(this::register);
    }

    public Optional<Schema> find(CollectionName collection) {
        return Optional.ofNullable(schemas.get(collection.getValue()));
    }

    public boolean isEnforcingTypes() {
        return enforceTypes;
    }

    /**
     * 호출자가 넘기지 않은 필드에 스키마 기본값 적용.
     *
     * @param collection 대상 컬렉션
     * @param fields     호출자 필드
     * @return 기본값이 적용된 새 Map (호출자 값 우선)
     */
    public Map<String, Object> applyDefaults(CollectionName collection, Map<String, ?> fields) {
        Map<String, Object> result = new LinkedHashMap<>();
        Schema schema = schemas.get(collection.getValue());
        if (schema != null) {
            result.putAll(schema.defaults());
        }
        if (fields != null) {
            result.putAll(fields);
        }
        return result;
    }

    /**
     * 레코드를 컬렉션 스키마로 검증.
     *
     * <p>모든 위반을 모은 뒤 한 번에 예외로 던집니다.</p>
     *
     * @param collection 대상 컬렉션
     * @param fields     레코드 필드
     * @throws SchemaValidationException 필수 필드가 없거나, 타입 검사 활성화 시 종류가 다른 경우
     */
    public void validate(CollectionName collection, Map<String, ?> fields) {
        Schema schema = schemas.get(collection.getValue());
        if (schema == null) {
            return;
        }
        List<String> violations = new ArrayList<>();
        for (String field : schema.required()) {
            if (fields == null || !fields.containsKey(field)) {
                violations.add("Missing required field: " + field);
            }
        }
        if (enforceTypes && fields != null) {
            for (Map.Entry<String, FieldKind> entry : schema.types().entrySet()) {
                String field = entry.getKey();
                if (fields.containsKey(field) && !entry.getValue().accepts(fields.get(field))) {
                    violations.add("Field " + field + " must be " + entry.getValue().name().toLowerCase(Locale.ROOT)
                        + " (current: " + typeName(fields.get(field)) + ")");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new SchemaValidationException(collection, violations);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
