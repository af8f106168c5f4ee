package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.core.model.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 컬렉션 하나에 대한 선형 조회 Builder.
 *
 * <p>필터는 AND로 결합됩니다. 레코드는 {@link #exec()} 시점에 읽으며,
 * 로드되지 않은 컬렉션이 아니면 캐시에서 읽습니다.</p>
 *
 * <pre>
 * List&lt;Document&gt; cheapest = store.query("products")
 *     .whereEquals("category", "vitamins")
 *     .sort("price")
 *     .project("id", "name", "price")
 *     .limit(5)
 *     .exec();
 * </pre>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class Query {

    private final Supplier<List<Document>> source;
    private final List<Predicate<Document>> filters = new ArrayList<>();
    private Comparator<Document> order;
    private List<String> projection;
    private int limit = -1;

    Query(Supplier<List<Document>> source) {
        this.source = source;
    }

    public Query where(Predicate<Document> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        filters.add(predicate);
        return this;
    }

    public Query whereEquals(String field, Object value) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        filters.add(document -> document.has(field) && FieldValues.equal(document.get(field), value));
        return this;
    }

    public Query sort(String field) {
        return sort(field, SortDirection.ASC);
    }

    /**
     * 정렬 키 추가. 나중에 추가한 키는 앞선 키가 같을 때 적용됩니다.
     *
     * @param field     정렬 필드
     * @param direction 오름차순 또는 내림차순 (값이 없으면 항상 마지막)
     * @return this
     */
    public Query sort(String field, SortDirection direction) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        Comparator<Document> byField = (a, b) -> {
            Object left = a.get(field);
            Object right = b.get(field);
            if (left == null || right == null) {
                return FieldValues.compare(left, right);
            }
            int result = FieldValues.compare(left, right);
            return direction == SortDirection.DESC ? -result : result;
        };
        order = order == null ? byField : order.thenComparing(byField);
        return this;
    }

    public Query project(String... fields) {
        projection = List.of(fields);
        return this;
    }

    public Query limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        this.limit = limit;
        return this;
    }

    public List<Document> exec() {
        List<Document> result = new ArrayList<>();
        for (Document document : source.get()) {
            if (matches(document)) {
                result.add(document);
            }
        }
        if (order != null) {
            result.sort(order);
        }
        if (limit >= 0 && result.size() > limit) {
            result = new ArrayList<>(result.subList(0, limit));
        }
        if (projection != null) {
            List<Document> projected = new ArrayList<>(result.size());
            for (Document document : result) {
                projected.add(project(document));
            }
            result = projected;
        }
        return List.copyOf(result);
    }

    private boolean matches(Document document) {
        for (Predicate<Document> filter : filters) {
            if (!filter.test(document)) {
                return false;
            }
        }
        return true;
    }

    private Document project(Document document) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String field : projection) {
            if (document.has(field)) {
                fields.put(field, document.get(field));
            }
        }
        return Document.of(fields);
    }
}
