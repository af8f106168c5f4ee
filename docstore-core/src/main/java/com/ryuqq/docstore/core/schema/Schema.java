package com.ryuqq.docstore.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 컬렉션별 스키마: 필수 필드, 필드 종류 선언, 기본값.
 *
 * <p>{@link #required()}는 필드 존재 여부만 검사합니다. 명시적으로 {@code null}을 넣은 필수 필드는 존재하는 것으로 봅니다.
 * {@link #types()}는 registry가 타입 검사를 켠 경우에만 강제됩니다.</p>
 *
 * @param required 모든 레코드가 가져야 하는 필드
 * @param types    필드별 선언 종류
 * @param defaults insert 시 호출자가 생략한 필드에 채울 값
 * @author DocStore Team
 * @since 1.0.0
 */
public record Schema(Set<String> required, Map<String, FieldKind> types, Map<String, Object> defaults) {

    public Schema {
        required = required == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(required));
        types = types == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(types));
        defaults = defaults == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public static Schema empty() {
        return new Schema(Set.of(), Map.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 선언 순서를 유지하는 Builder.
     */
    public static final class Builder {

        private final Set<String> required = new LinkedHashSet<>();
        private final Map<String, FieldKind> types = new LinkedHashMap<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String... fields) {
            for (String field : fields) {
                required.add(field);
            }
            return this;
        }

        public Builder type(String field, FieldKind kind) {
            types.put(field, kind);
            return this;
        }

        public Builder defaultValue(String field, Object value) {
            defaults.put(field, value);
            return this;
        }

        public Schema build() {
            return new Schema(required, types, defaults);
        }
    }
}
