package com.ryuqq.docstore.core.spi;

/**
 * 원격 객체 하나의 현재 리비전.
 *
 * @param path    객체 경로 (예: {@code db/users.json})
 * @param content 디코딩된 UTF-8 텍스트
 * @param sha     다음 조건부 쓰기에 넘길 리비전 id
 * @param etag    조건부 조회용 ETag (null 가능)
 * @author DocStore Team
 * @since 1.0.0
 */
public record StoredObject(String path, String content, String sha, String etag) {

    public StoredObject {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (sha == null || sha.isBlank()) {
            throw new IllegalArgumentException("sha cannot be null or blank");
        }
    }
}
