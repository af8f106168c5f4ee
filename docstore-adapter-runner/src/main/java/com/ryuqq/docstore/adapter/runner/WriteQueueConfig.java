package com.ryuqq.docstore.adapter.runner;

import com.ryuqq.docstore.application.write.ConflictPolicy;

/**
 * {@link SerialWriteQueue} 설정 (불변 record).
 *
 * <ul>
 *   <li>maxAttempts: 쓰기 하나당 PUT 시도 총 횟수 (기본 5)</li>
 *   <li>baseDelayMs / maxDelayMs / jitterFactor: 충돌 후 백오프 (기본 250ms / 5000ms / 0.0)</li>
 *   <li>writeDeadlineMs: enqueue 시점부터의 전체 제한 시간, 큐 대기 포함 (기본 30000ms)</li>
 *   <li>conflictPolicy: 재시도 시 payload 계산 방식 (기본 REBASE)</li>
 * </ul>
 *
 * @param maxAttempts     PUT 시도 횟수 상한 (1 이상)
 * @param baseDelayMs     첫 백오프 (양수)
 * @param maxDelayMs      백오프 상한 (baseDelayMs 이상)
 * @param jitterFactor    0.0 ~ 1.0
 * @param writeDeadlineMs 쓰기 제한 시간 (양수)
 * @param conflictPolicy  충돌 처리 정책
 * @author DocStore Team
 * @since 1.0.0
 */
public record WriteQueueConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    long writeDeadlineMs,
    ConflictPolicy conflictPolicy
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_DELAY_MS = 250;
    public static final long DEFAULT_MAX_DELAY_MS = 5000;
    public static final long DEFAULT_WRITE_DEADLINE_MS = 30000;

    /**
     * 기본 설정 생성자.
     */
    public WriteQueueConfig() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, 0.0,
            DEFAULT_WRITE_DEADLINE_MS, ConflictPolicy.REBASE);
    }

    public WriteQueueConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (writeDeadlineMs <= 0) {
            throw new IllegalArgumentException(
                "writeDeadlineMs must be positive (current: " + writeDeadlineMs + ")"
            );
        }
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy cannot be null");
        }
    }

    public WriteQueueConfig withMaxAttempts(int maxAttempts) {
        return new WriteQueueConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, writeDeadlineMs, conflictPolicy);
    }

    /**
     * 백오프 값 일괄 변경.
     *
     * @param baseDelayMs  첫 백오프
     * @param maxDelayMs   백오프 상한
     * @param jitterFactor jitter 비율
     * @return 새 설정
     */
    public WriteQueueConfig withBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return new WriteQueueConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, writeDeadlineMs, conflictPolicy);
    }

    public WriteQueueConfig withWriteDeadlineMs(long writeDeadlineMs) {
        return new WriteQueueConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, writeDeadlineMs, conflictPolicy);
    }

    public WriteQueueConfig withConflictPolicy(ConflictPolicy conflictPolicy) {
        return new WriteQueueConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, writeDeadlineMs, conflictPolicy);
    }
}
