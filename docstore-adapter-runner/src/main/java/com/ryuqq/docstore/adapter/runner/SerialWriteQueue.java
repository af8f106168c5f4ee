package com.ryuqq.docstore.adapter.runner;

import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.write.WriteQueue;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 경로별 전용 워커 스레드로 쓰기를 직렬화하는 {@link WriteQueue} 구현체.
 *
 * <p><strong>동시성 보장:</strong></p>
 * <ul>
 *   <li>경로마다 워커 스레드 하나 ({@code docstore-writer-<collection>}), FIFO 처리</li>
 *   <li>같은 경로의 PUT은 동시에 하나만 진행</li>
 *   <li>서로 다른 경로는 병렬 진행</li>
 * </ul>
 *
 * <p>워커는 첫 요청 시점에 생성되어 {@link #shutdown()}까지 유지됩니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class SerialWriteQueue implements WriteQueue {

    private static final Logger log = LoggerFactory.getLogger(SerialWriteQueue.class);

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

    private final ObjectStore objectStore;
    private final DocumentCodec codec;
    private final WriteQueueConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Map<String, CollectionWorker> workers = new ConcurrentHashMap<>();
    private final Map<String, Thread> threads = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private boolean accepting = true;

    /**
     * 기본 설정으로 생성.
     *
     * @param objectStore 원격 저장소
     */
    public SerialWriteQueue(ObjectStore objectStore) {
        this(objectStore, new DocumentCodec(), new WriteQueueConfig());
    }

    /**
     * 설정의 백오프 값으로 {@link BackoffCalculator}를 만들어 생성.
     *
     * @param objectStore 원격 저장소
     * @param codec       컬렉션 파일 코덱
     * @param config      큐 설정
     */
    public SerialWriteQueue(ObjectStore objectStore, DocumentCodec codec, WriteQueueConfig config) {
        this(objectStore, codec, config, BackoffCalculator.from(config));
    }

    /**
     * 커스텀 BackoffCalculator 주입.
     *
     * @param objectStore       원격 저장소
     * @param codec             컬렉션 파일 코덱
     * @param config            큐 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerialWriteQueue(ObjectStore objectStore, DocumentCodec codec, WriteQueueConfig config,
                            BackoffCalculator backoffCalculator) {
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.objectStore = objectStore;
        this.codec = codec;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    @Override
    public CompletableFuture<WriteResult> enqueue(WriteRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.writeDeadlineMs());
        QueuedWrite write = new QueuedWrite(request, deadline);
        synchronized (lifecycleLock) {
            if (!accepting) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Write queue is shut down"));
            }
            workers.computeIfAbsent(request.path(), path -> startWorker(request, path)).submit(write);
        }
        return write.future();
    }

    /**
     * 새 쓰기를 거부하고, 쌓인 쓰기를 최대 60초 동안 처리한 뒤 남은 워커를 인터럽트합니다.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    @Override
    public void shutdown() throws InterruptedException {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * 제한 시간을 지정한 종료.
     *
     * <p>제한 시간 안에 끝나지 않은 워커는 인터럽트되며, 시작하지 못한 쓰기는
     * {@link IllegalStateException}으로 실패합니다.</p>
     *
     * @param timeout 전체 대기 한도
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        List<Thread> running;
        synchronized (lifecycleLock) {
            if (accepting) {
                accepting = false;
                workers.values().forEach(CollectionWorker::stop);
            }
            running = new ArrayList<>(threads.values());
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread thread : running) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs > 0) {
                thread.join(remainingMs);
            }
        }
        for (Thread thread : running) {
            if (thread.isAlive()) {
                log.warn("Writer {} did not drain within {}, interrupting", thread.getName(), timeout);
                thread.interrupt();
            }
        }
        log.info("Write queue shut down ({} writer(s))", running.size());
    }

    /**
     * @return 지금까지 생성된 경로별 워커 수
     */
    public int workerCount() {
        return workers.size();
    }

    /**
     * @param path 원격 경로
     * @return 해당 경로 워커에 대기 중인 쓰기 수 (진행 중인 쓰기는 제외)
     */
    public int backlog(String path) {
        CollectionWorker worker = workers.get(path);
        return worker == null ? 0 : worker.backlog();
    }

    public boolean isAccepting() {
        synchronized (lifecycleLock) {
            return accepting;
        }
    }

    public WriteQueueConfig getConfig() {
        return config;
    }

    private CollectionWorker startWorker(WriteRequest request, String path) {
        CollectionWorker worker = new CollectionWorker(path, objectStore, codec, config, backoffCalculator);
        Thread thread = new Thread(worker, "docstore-writer-" + request.collection().getValue());
        thread.setDaemon(true);
        threads.put(path, thread);
        thread.start();
        return worker;
    }
}
