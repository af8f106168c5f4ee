package com.ryuqq.docstore.adapter.runner;

import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;

import java.util.concurrent.CompletableFuture;

/**
 * 워커 큐에 들어간 쓰기 요청과 호출자 future.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
final class QueuedWrite {

    static final QueuedWrite STOP = new QueuedWrite();

    private final WriteRequest request;
    private final CompletableFuture<WriteResult> future;
    private final long deadlineNanos;

    QueuedWrite(WriteRequest request, long deadlineNanos) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        this.request = request;
        this.future = new CompletableFuture<>();
        this.deadlineNanos = deadlineNanos;
    }

    private QueuedWrite() {
        this.request = null;
        this.future = null;
        this.deadlineNanos = 0;
    }

    WriteRequest request() {
        return request;
    }

    CompletableFuture<WriteResult> future() {
        return future;
    }

    /**
     * @param nowNanos {@link System#nanoTime()} 기준 현재 시각
     * @return 제한 시간까지 남은 나노초 (지났으면 0 이하)
     */
    long remainingNanos(long nowNanos) {
        return deadlineNanos - nowNanos;
    }
}
