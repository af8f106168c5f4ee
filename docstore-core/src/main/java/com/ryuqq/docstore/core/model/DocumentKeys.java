package com.ryuqq.docstore.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.UUID;

/**
 * 새 문서의 키 생성.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class DocumentKeys {

    private static final BigDecimal MIN_ID = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_ID = BigDecimal.valueOf(Long.MAX_VALUE);

    private DocumentKeys() {
    }

    /**
     * 다음 순번 id: {@code documents}의 가장 큰 숫자 id + 1.
     *
     * <p>id가 없거나 숫자가 아니면 0으로 간주하므로, 빈 컬렉션이나 문자 id만 있는 컬렉션은 1부터 시작합니다.</p>
     *
     * @param documents 컬렉션의 현재 레코드
     * @return 다음 id (1 이상)
     * @throws IllegalStateException 가장 큰 id가 {@link Long#MAX_VALUE}인 경우
     */
    public static long nextId(Collection<Document> documents) {
        long max = 0;
        if (documents != null) {
            for (Document document : documents) {
                max = Math.max(max, numericId(document.getId()));
            }
        }
        if (max == Long.MAX_VALUE) {
            throw new IllegalStateException("Sequential id space exhausted (current max: " + max + ")");
        }
        return max + 1;
    }

    /**
     * id를 정수로 읽습니다. 소수는 내림합니다.
     *
     * <p>숫자가 아니거나 NaN, 무한대, long 범위를 벗어난 값(예: {@code "1e30"})은 0입니다.</p>
     *
     * @param id 원본 id 값
     * @return 정수 id 또는 0
     */
    public static long numericId(Object id) {
        if (id instanceof Number number) {
            return toLong(number.toString());
        }
        if (id instanceof String text && !text.isBlank()) {
            return toLong(text.trim());
        }
        return 0;
    }

    private static long toLong(String text) {
        try {
            BigDecimal value = new BigDecimal(text).setScale(0, RoundingMode.FLOOR);
            if (value.compareTo(MIN_ID) < 0 || value.compareTo(MAX_ID) > 0) {
                return 0;
            }
            return value.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return 0;
        }
    }

    /**
     * 새 uid (UUID v4).
     *
     * @return uid 문자열
     */
    public static String newUid() {
        return UUID.randomUUID().toString();
    }
}
