package com.ryuqq.docstore.core.model;

/**
 * 컬렉션 이름.
 *
 * <p>컬렉션은 원격 저장소의 {@code <basePath>/<name>.json} 파일 하나에 대응하며,
 * 이름은 파일 경로 세그먼트로 그대로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class CollectionName {

    private static final int MAX_LENGTH = 100;

    private final String value;

    private CollectionName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CollectionName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("CollectionName length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "CollectionName contains invalid characters: " + value
                    + ". Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CollectionName 생성.
     *
     * @param value 컬렉션 이름
     * @return CollectionName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CollectionName of(String value) {
        return new CollectionName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollectionName that = (CollectionName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
