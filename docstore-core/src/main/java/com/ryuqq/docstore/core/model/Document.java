package com.ryuqq.docstore.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 컬렉션에 저장되는 불변 JSON 객체.
 *
 * <p>필드 순서를 유지합니다. 중첩 Map과 List는 생성 시 깊은 복사되므로 원본 Map의 이후 변경이 보이지 않습니다.
 * null 필드 값을 허용하며 JSON {@code null}로 인코딩됩니다.</p>
 *
 * <p>저장된 문서는 두 키를 가집니다: 컬렉션별 순번 {@link #ID}와 무작위 {@link #UID}. 조회는 둘 다 허용합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class Document {

    public static final String ID = "id";
    public static final String UID = "uid";

    private final Map<String, Object> fields;

    private Document(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * 필드 Map으로 Document 생성.
     *
     * @param fields 필드 값 (null 불가)
     * @return {@code fields}의 깊은 복사본을 가진 Document
     * @throws IllegalArgumentException fields가 null인 경우
     */
    public static Document of(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return new Document(copyMap(fields));
    }

    public static Document empty() {
        return new Document(new LinkedHashMap<>());
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object getId() {
        return fields.get(ID);
    }

    public String getUid() {
        Object uid = fields.get(UID);
        return uid == null ? null : uid.toString();
    }

    /**
     * {@code key}가 이 문서의 id 또는 uid와 같으면 true.
     *
     * <p>숫자 id는 값으로 비교합니다 ({@code 3}, {@code 3L}, {@code "3"} 모두 id 3과 일치).</p>
     *
     * @param key id 또는 uid
     * @return 이 문서를 가리키는지 여부
     */
    public boolean matchesKey(Object key) {
        if (key == null) {
            return false;
        }
        String keyText = normalizeKey(key);
        Object id = fields.get(ID);
        if (id != null && normalizeKey(id).equals(keyText)) {
            return true;
        }
        Object uid = fields.get(UID);
        return uid != null && uid.toString().equals(keyText);
    }

    /**
     * 얕은 병합: {@code updates}의 필드가 기존 필드를 대체합니다.
     *
     * @param updates 덮어쓰거나 추가할 필드
     * @return 병합된 새 Document
     */
    public Document merge(Map<String, ?> updates) {
        Map<String, Object> merged = copyMap(fields);
        if (updates != null) {
            merged.putAll(copyMap(updates));
        }
        return new Document(merged);
    }

    public Document with(String field, Object value) {
        Map<String, Object> copy = copyMap(fields);
        copy.put(field, copyValue(value));
        return new Document(copy);
    }

    /**
     * 필드의 변경 가능한 깊은 복사본.
     *
     * @return 호출자가 수정해도 되는 필드 Map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k, mutableCopy(v)));
        return copy;
    }

    public int size() {
        return fields.size();
    }

    static String normalizeKey(Object key) {
        if (key instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return number.toString();
        }
        return key.toString();
    }

    private static Map<String, Object> copyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Document document) {
            return copyValue(document.fields);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object mutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), mutableCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(mutableCopy(item));
            }
            return copy;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Document document = (Document) o;
        return fields.equals(document.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Document" + fields;
    }
}
