package com.ryuqq.docstore.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 충돌 재시도 간격 계산기.
 *
 * <p>n번째 충돌 이후의 대기 시간:</p>
 * <pre>
 * delay = min(baseDelay * 2^(n-1) + jitter, maxDelay)
 * jitter = random[0, 1) * exponential * jitterFactor
 * </pre>
 *
 * <p>기본값(250ms, 5000ms, jitter 없음)에서 대기 시간은 250, 500, 1000, 2000, 4000, 5000ms 순입니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정(250ms / 5000ms / jitter 0.0)으로 생성.
     */
    public BackoffCalculator() {
        this(WriteQueueConfig.DEFAULT_BASE_DELAY_MS, WriteQueueConfig.DEFAULT_MAX_DELAY_MS, 0.0);
    }

    /**
     * 큐 설정의 백오프 값으로 생성.
     *
     * @param config 큐 설정
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(WriteQueueConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor());
    }

    /**
     * @param baseDelayMs  첫 재시도 대기 시간 (양수)
     * @param maxDelayMs   대기 시간 상한 (baseDelayMs 이상)
     * @param jitterFactor 0.0 ~ 1.0
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급원을 주입하는 생성자 (테스트용).
     *
     * @param baseDelayMs  첫 재시도 대기 시간 (양수)
     * @param maxDelayMs   대기 시간 상한 (baseDelayMs 이상)
     * @param jitterFactor 0.0 ~ 1.0
     * @param random       [0, 1) 범위 값을 돌려주는 공급원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
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
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * n번째 충돌 이후 대기 시간.
     *
     * @param conflictCount 지금까지 발생한 충돌 수 (1부터)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException conflictCount가 양수가 아닌 경우
     */
    public long delayAfter(int conflictCount) {
        if (conflictCount <= 0) {
            throw new IllegalArgumentException(
                "conflictCount must be positive (current: " + conflictCount + ")"
            );
        }
        // shift beyond 62 bits overflows; the cap applies long before that
        int shift = Math.min(conflictCount - 1, 62);
        long doubled = baseDelayMs << shift;
        long exponential = (doubled >> shift) != baseDelayMs ? maxDelayMs : Math.min(doubled, maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
