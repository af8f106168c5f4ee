package com.ryuqq.docstore.core.exception;

import com.ryuqq.docstore.core.model.CollectionName;

import java.util.List;

/**
 * 레코드가 컬렉션 스키마를 만족하지 않을 때 발생. 아무것도 기록되지 않습니다.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class SchemaValidationException extends DocStoreException {

    private final CollectionName collection;
    private final List<String> violations;

    public SchemaValidationException(CollectionName collection, List<String> violations) {
        super("Schema validation failed for " + collection + ": " + String.join(", ", violations));
        this.collection = collection;
        this.violations = List.copyOf(violations);
    }

    public CollectionName getCollection() {
        return collection;
    }

    public List<String> getViolations() {
        return violations;
    }
}
