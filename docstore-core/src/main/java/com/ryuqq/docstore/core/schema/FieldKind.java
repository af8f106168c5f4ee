package com.ryuqq.docstore.core.schema;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 스키마 필드에 선언하는 JSON 값 종류.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public enum FieldKind {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    /**
     * {@code "string"}, {@code "NUMBER"} 같은 종류 이름 파싱.
     *
     * @param name 종류 이름 (대소문자 무시)
     * @return 일치하는 종류
     * @throws IllegalArgumentException null이거나 알 수 없는 이름인 경우
     */
    public static FieldKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("FieldKind name cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown field kind: " + name, e);
        }
    }

    /**
     * {@code value}가 이 종류인지 여부. null은 모든 종류에서 허용됩니다.
     *
     * @param value 디코딩된 필드 값
     * @return 일치하면 true
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case STRING:
                return value instanceof CharSequence;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case ARRAY:
                return value instanceof List<?> || value.getClass().isArray();
            case OBJECT:
                return value instanceof Map<?, ?>;
            default:
                return false;
        }
    }
}
