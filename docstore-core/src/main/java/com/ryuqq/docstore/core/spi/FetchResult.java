package com.ryuqq.docstore.core.spi;

/**
 * 조건부 조회 결과.
 *
 * <ul>
 *   <li>{@link Fetched}: 객체가 변경됨 (또는 ETag 없이 조회). 새 리비전 포함</li>
 *   <li>{@link NotModified}: 전달한 ETag가 여전히 일치</li>
 * </ul>
 *
 * <p>객체가 없는 경우는 결과가 아니라 {@link ObjectStore#get}이
 * {@link com.ryuqq.docstore.core.exception.NotFoundException}을 던집니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public sealed interface FetchResult permits FetchResult.Fetched, FetchResult.NotModified {

    static FetchResult fetched(StoredObject object) {
        return new Fetched(object);
    }

    static FetchResult notModified() {
        return NotModified.INSTANCE;
    }

    default boolean isNotModified() {
        return this instanceof NotModified;
    }

    /**
     * 객체 내용과 리비전.
     *
     * @param object 현재 리비전
     */
    record Fetched(StoredObject object) implements FetchResult {

        public Fetched {
            if (object == null) {
                throw new IllegalArgumentException("object cannot be null");
            }
        }
    }

    /**
     * 캐시된 사본이 여전히 최신.
     */
    final class NotModified implements FetchResult {

        private static final NotModified INSTANCE = new NotModified();

        private NotModified() {
        }

        @Override
        public String toString() {
            return "NotModified";
        }
    }
}
