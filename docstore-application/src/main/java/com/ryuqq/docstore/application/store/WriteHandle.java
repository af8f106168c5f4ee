package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.core.exception.DocStoreException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 변경 요청 핸들.
 *
 * <p>변경은 큐에 수락되는 즉시 반환되며, 원격 반영 결과는 {@link #getCompletion()}으로 확인합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WriteHandle&lt;Document&gt; handle = store.insert("orders", fields);
 * Document accepted = handle.getAccepted();   // id, uid 포함
 * Document persisted = handle.await();       // 원격 반영까지 대기
 * </pre>
 *
 * @param <T> 결과 타입
 * @author DocStore Team
 * @since 1.0.0
 */
public final class WriteHandle<T> {

    private final T accepted;
    private final CompletableFuture<T> completion;

    WriteHandle(T accepted, CompletableFuture<T> completion) {
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        this.accepted = accepted;
        this.completion = completion;
    }

    /**
     * 수락 시점의 결과 (insert: 생성된 키를 포함한 레코드).
     *
     * @return 수락된 값
     */
    public T getAccepted() {
        return accepted;
    }

    /**
     * 원격 반영 완료 Future.
     *
     * @return 완료 시 저장된 값, 실패 시 쓰기 오류로 예외 완료
     */
    public CompletableFuture<T> getCompletion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * 원격 반영까지 대기.
     *
     * @return 저장된 값
     * @throws DocStoreException 쓰기가 실패한 경우 원래 예외
     */
    public T await() {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocStoreException("Interrupted while waiting for write", e);
        }
    }

    /**
     * 제한 시간 내 원격 반영 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 저장된 값
     * @throws TimeoutException 시간 내 완료되지 않은 경우
     */
    public T await(Duration timeout) throws TimeoutException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocStoreException("Interrupted while waiting for write", e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new DocStoreException("Write failed", cause);
    }
}
