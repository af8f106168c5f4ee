package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.application.audit.AuditLog;
import com.ryuqq.docstore.application.cache.CollectionCache;
import com.ryuqq.docstore.application.cache.CollectionPaths;
import com.ryuqq.docstore.application.cache.PendingWrite;
import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.notify.ChangeBus;
import com.ryuqq.docstore.application.write.Mutation;
import com.ryuqq.docstore.application.write.Mutations;
import com.ryuqq.docstore.application.write.WriteQueue;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.event.ChangeListener;
import com.ryuqq.docstore.core.event.Subscription;
import com.ryuqq.docstore.core.exception.DocStoreException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.model.AuditAction;
import com.ryuqq.docstore.core.model.AuditEntry;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.model.DocumentKeys;
import com.ryuqq.docstore.core.schema.Schema;
import com.ryuqq.docstore.core.schema.SchemaRegistry;
import com.ryuqq.docstore.core.spi.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * 문서 저장소 진입점.
 *
 * <p>원격 버전 저장소 위에 컬렉션 단위 CRUD, 캐시, 변경 알림, 감사 로그를 제공합니다.
 * 인스턴스 하나가 캐시와 쓰기 큐를 소유하며 애플리케이션 전체에서 공유됩니다.</p>
 *
 * <p><strong>변경 흐름:</strong></p>
 * <ol>
 *   <li>기본값 적용 및 스키마 검증 (실패 시 네트워크 호출 없이 즉시 예외)</li>
 *   <li>캐시 view 위에서 변경 계획 (insert: 다음 id, 새 uid 할당)</li>
 *   <li>캐시에 낙관적 반영 후 {@link WriteQueue}에 등록</li>
 *   <li>감사 로그 기록, 구독자 알림, {@link WriteHandle} 반환</li>
 *   <li>원격 반영 성공 시 캐시 확정 및 재조회, 실패 시 낙관적 변경 롤백</li>
 * </ol>
 *
 * <p><strong>Thread Safety:</strong> 모든 메서드는 여러 스레드에서 동시에 호출할 수 있습니다.
 * 같은 컬렉션에 대한 변경 계획은 컬렉션별 락으로 직렬화되므로 동시 insert도 서로 다른 id를 받습니다.</p>
 *
 * <p>원격 반영 이후의 캐시 확정, 재조회, 구독자 알림은 쓰기 스레드가 아닌 저장소 소유의
 * {@code docstore-callback-N} 스레드에서 실행됩니다. 구독자가 알림 안에서 다시 쓰고
 * {@link WriteHandle#await()}로 기다려도 쓰기 큐는 멈추지 않습니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class DocumentStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);
    private static final long CALLBACK_SHUTDOWN_SECONDS = 30;

    private final DocumentStoreConfig config;
    private final SchemaRegistry schemas;
    private final CollectionCache cache;
    private final WriteQueue writeQueue;
    private final ChangeBus changeBus;
    private final AuditLog auditLog;
    private final Clock clock;
    private final ConcurrentHashMap<CollectionName, Object> planLocks = new ConcurrentHashMap<>();
    private final ExecutorService callbackExecutor = Executors.newCachedThreadPool(new CallbackThreadFactory());
    private volatile boolean closed;

    public DocumentStore(DocumentStoreConfig config, ObjectStore objectStore, WriteQueue writeQueue) {
        this(config, objectStore, writeQueue, new DocumentCodec(), Clock.systemUTC());
    }

    /**
     * DocumentStore 생성.
     *
     * @param config      저장소 설정
     * @param objectStore 원격 저장소 어댑터
     * @param writeQueue  쓰기 직렬화 큐 (같은 objectStore를 사용해야 함)
     * @param codec       컬렉션 JSON 코덱
     * @param clock       updated_at, 감사 로그 시각
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DocumentStore(DocumentStoreConfig config, ObjectStore objectStore, WriteQueue writeQueue,
                         DocumentCodec codec, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (writeQueue == null) {
            throw new IllegalArgumentException("writeQueue cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.schemas = new SchemaRegistry(config.enforceTypes());
        this.schemas.registerAll(config.schemas());
        this.writeQueue = writeQueue;
        this.changeBus = new ChangeBus();
        this.auditLog = new AuditLog(config.auditCapacity());
        this.clock = clock;
        this.cache = new CollectionCache(objectStore, codec, new CollectionPaths(config.basePath()),
            writeQueue, changeBus);
    }

    // ========================================
    // Read
    // ========================================

    public List<Document> load(String collection) {
        return load(collection, false);
    }

    /**
     * 컬렉션 전체 조회. 원격에 파일이 없으면 빈 컬렉션을 생성합니다.
     *
     * @param collection 컬렉션 이름
     * @param force      true면 캐시를 무시하고 원격 조회
     * @return 레코드 목록 (변경 불가)
     */
    public List<Document> load(String collection, boolean force) {
        return cache.load(CollectionName.of(collection), force);
    }

    /**
     * 필드 완전 일치 조회. 숫자는 값으로 비교합니다.
     *
     * @param collection 컬렉션 이름
     * @param filters    필드별 기대 값 (비어 있으면 전체)
     * @return 일치 레코드
     */
    public List<Document> find(String collection, Map<String, ?> filters) {
        Query query = query(collection);
        if (filters != null) {
            filters.forEach(query::whereEquals);
        }
        return query.exec();
    }

    public List<Document> find(String collection, Predicate<Document> predicate) {
        return query(collection).where(predicate).exec();
    }

    /**
     * id 또는 uid로 단건 조회.
     *
     * @param collection 컬렉션 이름
     * @param key        숫자 id 또는 uid
     * @return 레코드, 없으면 empty
     */
    public Optional<Document> findById(String collection, Object key) {
        if (key == null) {
            return Optional.empty();
        }
        for (Document document : load(collection)) {
            if (document.matchesKey(key)) {
                return Optional.of(document);
            }
        }
        return Optional.empty();
    }

    public Query query(String collection) {
        CollectionName name = CollectionName.of(collection);
        return new Query(() -> cache.load(name, false));
    }

    // ========================================
    // Write
    // ========================================

    /**
     * 레코드 추가.
     *
     * <p>스키마 기본값을 채우고 검증한 뒤, 다음 순번 {@code id}와 새 {@code uid}를 부여합니다.
     * 호출자가 넘긴 id, uid는 생성된 값으로 대체됩니다.</p>
     *
     * @param collection 컬렉션 이름
     * @param fields     레코드 필드
     * @return 수락 값 = 키가 부여된 레코드, 완료 값 = 원격에 저장된 레코드
     * @throws com.ryuqq.docstore.core.exception.SchemaValidationException 필수 필드가 없는 경우
     */
    public WriteHandle<Document> insert(String collection, Map<String, ?> fields) {
        CollectionName name = CollectionName.of(collection);
        Map<String, Object> prepared = schemas.applyDefaults(name, fields);
        schemas.validate(name, prepared);
        ensureOpen();
        cache.load(name, false);

        Document record;
        CompletableFuture<WriteResult> completion;
        synchronized (planLock(name)) {
            List<Document> view = cache.view(name);
            Map<String, Object> keyed = new LinkedHashMap<>();
            keyed.put(Document.ID, String.valueOf(DocumentKeys.nextId(view)));
            keyed.put(Document.UID, DocumentKeys.newUid());
            prepared.forEach((field, value) -> {
                if (!Document.ID.equals(field) && !Document.UID.equals(field)) {
                    keyed.put(field, value);
                }
            });
            record = Document.of(keyed);
            completion = stage(name, Mutations.insert(record));
        }
        auditLog.record(name, AuditAction.INSERT, record, clock.instant());
        changeBus.publish(name, cache.view(name));

        String uid = record.getUid();
        Document accepted = record;
        return new WriteHandle<>(record, completion.thenApply(result ->
            locate(result.documents(), uid).orElse(accepted)));
    }

    /**
     * 레코드 수정 (얕은 병합).
     *
     * <p>{@code id}, {@code uid}는 변경되지 않으며 {@code updated_at}이 ISO-8601(UTC)로 기록됩니다.</p>
     *
     * @param collection 컬렉션 이름
     * @param key        id 또는 uid
     * @param updates    변경 필드
     * @return 수락 값 = 병합된 레코드, 완료 값 = 원격에 저장된 레코드
     * @throws NotFoundException 레코드가 없는 경우
     * @throws com.ryuqq.docstore.core.exception.SchemaValidationException 병합 결과가 스키마를 위반하는 경우
     */
    public WriteHandle<Document> update(String collection, Object key, Map<String, ?> updates) {
        CollectionName name = CollectionName.of(collection);
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        ensureOpen();
        cache.load(name, false);

        Document updated;
        CompletableFuture<WriteResult> completion;
        synchronized (planLock(name)) {
            List<Document> view = cache.view(name);
            Mutation mutation = Mutations.update(name, key, updates, clock.instant().toString(),
                merged -> schemas.validate(name, merged.toMap()));
            List<Document> planned = mutation.apply(view);
            updated = locateByKey(planned, key)
                .orElseThrow(() -> NotFoundException.forKey(name.getValue(), key));
            completion = stage(name, mutation);
        }
        auditLog.record(name, AuditAction.UPDATE, updated, clock.instant());
        changeBus.publish(name, cache.view(name));

        Document accepted = updated;
        return new WriteHandle<>(updated, completion.thenApply(result ->
            locateByKey(result.documents(), key).orElse(accepted)));
    }

    /**
     * id 또는 uid가 일치하는 레코드 삭제.
     *
     * @param collection 컬렉션 이름
     * @param key        id 또는 uid
     * @return 수락 값 = 삭제된 레코드 목록, 완료 값 = 동일 목록
     * @throws NotFoundException 일치하는 레코드가 없는 경우
     */
    public WriteHandle<List<Document>> delete(String collection, Object key) {
        CollectionName name = CollectionName.of(collection);
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        ensureOpen();
        cache.load(name, false);

        List<Document> removed = new ArrayList<>();
        CompletableFuture<WriteResult> completion;
        synchronized (planLock(name)) {
            for (Document document : cache.view(name)) {
                if (document.matchesKey(key)) {
                    removed.add(document);
                }
            }
            if (removed.isEmpty()) {
                throw NotFoundException.forKey(name.getValue(), key);
            }
            completion = stage(name, Mutations.delete(key));
        }
        Instant now = clock.instant();
        for (Document document : removed) {
            auditLog.record(name, AuditAction.DELETE, document, now);
        }
        changeBus.publish(name, cache.view(name));

        List<Document> accepted = List.copyOf(removed);
        return new WriteHandle<>(accepted, completion.thenApply(result -> accepted));
    }

    // ========================================
    // Schema, Subscription, Audit
    // ========================================

    public void registerSchema(String collection, Schema schema) {
        schemas.register(CollectionName.of(collection).getValue(), schema);
    }

    public Optional<Schema> schemaOf(String collection) {
        return schemas.find(CollectionName.of(collection));
    }

    /**
     * 컬렉션 변경 구독. 리스너는 변경마다 전체 view를 받습니다.
     *
     * @param collection 컬렉션 이름
     * @param listener   콜백
     * @return 구독 해제 핸들
     */
    public Subscription subscribe(String collection, ChangeListener listener) {
        return changeBus.subscribe(CollectionName.of(collection), listener);
    }

    public List<AuditEntry> auditTrail(String collection) {
        return auditLog.entries(CollectionName.of(collection));
    }

    /**
     * 스키마가 등록된 모든 컬렉션을 로드합니다 (없으면 생성).
     *
     * <p>실패한 컬렉션은 경고 로그를 남기고 건너뜁니다.</p>
     *
     * @return 로드에 성공한 컬렉션
     */
    public List<CollectionName> initializeAll() {
        List<String> collections = new ArrayList<>(config.schemas().keySet());
        log.info("Initializing collections: {}", collections);
        List<CollectionName> initialized = new ArrayList<>();
        for (String collection : collections) {
            try {
                CollectionName name = CollectionName.of(collection);
                cache.load(name, false);
                initialized.add(name);
            } catch (DocStoreException | IllegalArgumentException e) {
                log.warn("Failed to initialize collection {}: {}", collection, e.getMessage());
            }
        }
        log.info("Initialization completed ({}/{} collections)", initialized.size(), collections.size());
        return List.copyOf(initialized);
    }

    public DocumentStoreConfig getConfig() {
        return config;
    }

    /**
     * 쓰기 큐를 종료합니다. 이미 수락된 쓰기와 그 완료 처리(캐시 확정, 알림)가 끝날 때까지 대기합니다.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writeQueue.shutdown();
            callbackExecutor.shutdown();
            if (!callbackExecutor.awaitTermination(CALLBACK_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Write callbacks did not finish within {}s, interrupting", CALLBACK_SHUTDOWN_SECONDS);
                callbackExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callbackExecutor.shutdownNow();
            log.warn("Interrupted while shutting down write queue");
        }
    }

    // ========================================
    // Internal
    // ========================================

    /**
     * 변경을 캐시에 반영하고 큐에 등록합니다. planLock 안에서 호출해야 합니다.
     */
    private CompletableFuture<WriteResult> stage(CollectionName name, Mutation mutation) {
        PendingWrite pending = cache.stage(name, mutation);
        WriteRequest request = WriteRequest.of(name, cache.pathOf(name), mutation,
            cache.view(name), clock.instant());
        CompletableFuture<WriteResult> future;
        try {
            future = writeQueue.enqueue(request);
        } catch (RuntimeException e) {
            cache.discard(name, pending);
            throw e;
        }
        return future.whenCompleteAsync((result, error) -> {
            if (error == null) {
                cache.completeWrite(name, pending, result);
            } else {
                log.warn("Write to collection {} failed, rolling back: {}", name, rootCause(error).getMessage());
                cache.discard(name, pending);
            }
        }, callbackExecutor);
    }

    private Object planLock(CollectionName name) {
        return planLocks.computeIfAbsent(name, key -> new Object());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("DocumentStore is closed");
        }
    }

    private static Optional<Document> locate(List<Document> documents, String uid) {
        return documents.stream().filter(d -> uid.equals(d.getUid())).findFirst();
    }

    private static Optional<Document> locateByKey(List<Document> documents, Object key) {
        return documents.stream().filter(d -> d.matchesKey(key)).findFirst();
    }

    private static Throwable rootCause(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * 완료 처리용 daemon 스레드 팩토리.
     */
    private static final class CallbackThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "docstore-callback-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
