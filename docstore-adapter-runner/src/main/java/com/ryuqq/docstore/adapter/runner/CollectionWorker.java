package com.ryuqq.docstore.adapter.runner;

import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.write.ConflictPolicy;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.exception.QueueExhaustedException;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 원격 경로 하나를 전담하는 쓰기 워커.
 *
 * <p>FIFO 큐에서 요청을 하나씩 꺼내 처리하므로 같은 경로에 대해 PUT은 항상 하나만 진행됩니다.</p>
 *
 * <p><strong>시도 한 번의 흐름:</strong></p>
 * <pre>
 * GET path (없으면 sha=null로 생성)
 *   ↓
 * payload 계산 (createOnly: 빈 배열 / REBASE: mutation(현재 배열) / SNAPSHOT: 호출 시점 배열)
 *   ↓
 * PUT path (조건부, sha)
 *   ├─ 성공 → future 완료
 *   └─ Conflict → backoff 후 재시도 (maxAttempts, writeDeadline 한도)
 * </pre>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
final class CollectionWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CollectionWorker.class);

    private final String path;
    private final ObjectStore objectStore;
    private final DocumentCodec codec;
    private final WriteQueueConfig config;
    private final BackoffCalculator backoffCalculator;
    private final BlockingQueue<QueuedWrite> queue = new LinkedBlockingQueue<>();

    CollectionWorker(String path, ObjectStore objectStore, DocumentCodec codec,
                     WriteQueueConfig config, BackoffCalculator backoffCalculator) {
        this.path = path;
        this.objectStore = objectStore;
        this.codec = codec;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    void submit(QueuedWrite write) {
        queue.add(write);
    }

    void stop() {
        queue.add(QueuedWrite.STOP);
    }

    int backlog() {
        return queue.size();
    }

    @Override
    public void run() {
        log.debug("Writer started for {}", path);
        QueuedWrite current = null;
        try {
            while (true) {
                current = queue.take();
                if (current == QueuedWrite.STOP) {
                    current = null;
                    break;
                }
                process(current);
                current = null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Writer for {} interrupted, failing {} pending write(s)", path, queue.size());
        } finally {
            if (current != null) {
                current.future().completeExceptionally(
                    new IllegalStateException("Write queue shut down while writing " + path));
            }
            failRemaining();
        }
        log.debug("Writer stopped for {}", path);
    }

    private void process(QueuedWrite write) throws InterruptedException {
        if (write.future().isDone()) {
            return;
        }
        WriteRequest request = write.request();
        int attempts = 0;
        ConflictException lastConflict = null;

        while (true) {
            if (write.remainingNanos(System.nanoTime()) <= 0) {
                fail(write, new QueueExhaustedException(path, attempts, true, lastConflict));
                return;
            }
            attempts++;
            try {
                write.future().complete(attempt(request, attempts));
                return;
            } catch (ConflictException e) {
                lastConflict = e;
                log.warn("Conflict writing {} (attempt {}/{})", path, attempts, config.maxAttempts());
            } catch (RuntimeException e) {
                log.warn("Write to {} failed on attempt {}: {}", path, attempts, e.getMessage());
                write.future().completeExceptionally(e);
                return;
            }

            if (attempts >= config.maxAttempts()) {
                fail(write, new QueueExhaustedException(path, attempts, false, lastConflict));
                return;
            }
            long delayMs = backoffCalculator.delayAfter(attempts);
            if (TimeUnit.MILLISECONDS.toNanos(delayMs) >= write.remainingNanos(System.nanoTime())) {
                fail(write, new QueueExhaustedException(path, attempts, true, lastConflict));
                return;
            }
            Thread.sleep(delayMs);
        }
    }

    private WriteResult attempt(WriteRequest request, int attempt) {
        StoredObject current = fetchCurrent();
        if (request.createOnly() && current != null) {
            log.debug("{} already exists, skipping initialization", path);
            return new WriteResult(request.collection(), codec.decode(current.content()), current.sha(), 0, false);
        }

        List<Document> payload;
        if (request.createOnly()) {
            payload = List.of();
        } else if (config.conflictPolicy() == ConflictPolicy.SNAPSHOT) {
            payload = request.snapshot();
        } else {
            List<Document> base = current == null ? List.of() : codec.decode(current.content());
            payload = request.mutation().apply(base);
        }

        String sha = current == null ? null : current.sha();
        log.debug("PUT {} (attempt {}, sha {})", path, attempt, sha);
        String newSha = objectStore.put(path, codec.encode(payload), sha, request.message());
        return new WriteResult(request.collection(), payload, newSha, attempt, true);
    }

    private StoredObject fetchCurrent() {
        try {
            FetchResult result = objectStore.get(path, null);
            if (result instanceof FetchResult.Fetched fetched) {
                return fetched.object();
            }
            throw new IllegalStateException("Unconditional read of " + path + " returned " + result);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private void fail(QueuedWrite write, QueueExhaustedException e) {
        log.error(e.getMessage(), e);
        write.future().completeExceptionally(e);
    }

    private void failRemaining() {
        List<QueuedWrite> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        for (QueuedWrite write : remaining) {
            if (write != QueuedWrite.STOP) {
                write.future().completeExceptionally(
                    new IllegalStateException("Write queue shut down before write to " + path + " started"));
            }
        }
    }
}
