package com.ryuqq.docstore.core.exception;

/**
 * 큐에 등록된 쓰기가 최대 시도 횟수 또는 제한 시간을 다 쓸 때까지 충돌한 경우 발생.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class QueueExhaustedException extends DocStoreException {

    private final String path;
    private final int attempts;
    private final boolean deadlineExceeded;

    public QueueExhaustedException(String path, int attempts, boolean deadlineExceeded, Throwable cause) {
        super((deadlineExceeded ? "Write deadline exceeded for " : "Write retries exhausted for ")
            + path + " after " + attempts + " attempt(s)", cause);
        this.path = path;
        this.attempts = attempts;
        this.deadlineExceeded = deadlineExceeded;
    }

    public String getPath() {
        return path;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
