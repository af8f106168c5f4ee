package com.ryuqq.docstore.application.cache;

import com.ryuqq.docstore.core.model.CollectionName;

/**
 * 컬렉션을 원격 객체 경로 {@code <basePath>/<name>.json}으로 변환.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class CollectionPaths {

    private final String basePath;

    public CollectionPaths(String basePath) {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        String trimmed = basePath.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        this.basePath = trimmed;
    }

    public String pathOf(CollectionName collection) {
        String file = collection.getValue() + ".json";
        return basePath.isEmpty() ? file : basePath + "/" + file;
    }

    public String getBasePath() {
        return basePath;
    }
}
