package com.ryuqq.docstore.application.store;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 디코딩된 JSON 필드 값의 동등 비교와 정렬.
 *
 * <p>숫자는 Java 타입과 무관하게 값으로 비교합니다 (같은 JSON 숫자가 Integer, Long, Double로 디코딩될 수 있음).
 * NaN과 무한대는 {@link Double#compare}를 따르므로 NaN은 NaN하고만 같고 모든 유한 값보다 큽니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
final class FieldValues {

    private FieldValues() {
    }

    static boolean equal(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * null은 마지막. 숫자, 문자열, boolean은 자연 순서, 서로 다른 종류는 문자열로 비교.
     */
    static int compare(Object left, Object right) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            return 1;
        }
        if (right == null) {
            return -1;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return a.compareTo(b);
        }
        return left.toString().compareTo(right.toString());
    }

    private static int compareNumbers(Number a, Number b) {
        if (isNonFinite(a) || isNonFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toDecimal(a).compareTo(toDecimal(b));
    }

    private static boolean isNonFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            return Double.isNaN(value) || Double.isInfinite(value);
        }
        return false;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
