package com.ryuqq.docstore.application.cache;

import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.notify.ChangeBus;
import com.ryuqq.docstore.application.write.Mutation;
import com.ryuqq.docstore.application.write.WriteQueue;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.exception.DocStoreException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 컬렉션 캐시.
 *
 * <p>컬렉션마다 마지막으로 확인된 원격 리비전 {@link CacheEntry}와, 수락되었지만 아직
 * 원격에 반영되지 않은 변경 목록을 보관합니다. 읽기는 둘을 합친 view를 반환하므로
 * 호출자는 항상 자신이 수락시킨 변경을 볼 수 있습니다.</p>
 *
 * <p><strong>로드 규칙:</strong></p>
 * <ul>
 *   <li>캐시된 컬렉션의 비강제 로드: 네트워크 호출 없음, 락 없음</li>
 *   <li>미로드 또는 강제 로드: fetchLock 아래에서 조건부 GET (ETag)</li>
 *   <li>원격에 파일이 없음: 빈 컬렉션 생성 요청을 {@link WriteQueue}에 넣고 완료까지 대기</li>
 * </ul>
 *
 * <p>생성 요청도 큐를 거치므로 원격 상태를 바꾸는 주체는 큐 하나뿐입니다.
 * 동시에 두 로더가 생성을 요청해도 두 번째 요청은 이미 존재하는 파일을 보고 쓰지 않습니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class CollectionCache {

    private static final Logger log = LoggerFactory.getLogger(CollectionCache.class);

    private final ObjectStore objectStore;
    private final DocumentCodec codec;
    private final CollectionPaths paths;
    private final WriteQueue writeQueue;
    private final ChangeBus changeBus;
    private final ConcurrentHashMap<CollectionName, CollectionState> states = new ConcurrentHashMap<>();

    public CollectionCache(ObjectStore objectStore, DocumentCodec codec, CollectionPaths paths,
                           WriteQueue writeQueue, ChangeBus changeBus) {
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        if (writeQueue == null) {
            throw new IllegalArgumentException("writeQueue cannot be null");
        }
        if (changeBus == null) {
            throw new IllegalArgumentException("changeBus cannot be null");
        }
        this.objectStore = objectStore;
        this.codec = codec;
        this.paths = paths;
        this.writeQueue = writeQueue;
        this.changeBus = changeBus;
    }

    /**
     * 컬렉션 로드.
     *
     * @param collection 대상 컬렉션
     * @param force      true면 캐시를 무시하고 원격 조회
     * @return 현재 view (변경 불가)
     */
    public List<Document> load(CollectionName collection, boolean force) {
        CollectionState state = stateOf(collection);
        if (!force && state.isLoaded()) {
            return state.view();
        }
        boolean found;
        synchronized (state.fetchLock) {
            if (!force && state.isLoaded()) {
                return state.view();
            }
            found = fetch(collection, state);
        }
        // publish는 fetchLock 밖에서 호출
        if (found) {
            changeBus.publish(collection, state.view());
            return state.view();
        }
        WriteResult created = initialize(collection);
        synchronized (state.fetchLock) {
            if (created.written() || !state.isLoaded()) {
                state.confirm(new CacheEntry(created.documents(), null, created.sha()));
            }
        }
        changeBus.publish(collection, state.view());
        return state.view();
    }

    /**
     * 로드 없이 현재 view 조회.
     *
     * @param collection 대상 컬렉션
     * @return view, 미로드 컬렉션이면 빈 목록
     */
    public List<Document> view(CollectionName collection) {
        return stateOf(collection).view();
    }

    public boolean isLoaded(CollectionName collection) {
        return stateOf(collection).isLoaded();
    }

    public CacheEntry confirmedEntry(CollectionName collection) {
        return stateOf(collection).confirmed();
    }

    public int pendingCount(CollectionName collection) {
        return stateOf(collection).pendingCount();
    }

    public String pathOf(CollectionName collection) {
        return paths.pathOf(collection);
    }

    /**
     * 수락된 변경을 view에 낙관적으로 반영.
     *
     * @param collection 대상 컬렉션
     * @param mutation   변경
     * @return 토큰 (완료 시 {@link #completeWrite}, 실패 시 {@link #discard})
     */
    public PendingWrite stage(CollectionName collection, Mutation mutation) {
        PendingWrite write = new PendingWrite(mutation);
        stateOf(collection).stage(write);
        return write;
    }

    /**
     * 원격 쓰기 성공 처리.
     *
     * <p>쓰여진 배열을 확정 리비전으로 삼은 뒤 강제 재조회를 시도합니다.
     * 재조회 실패는 경고 로그만 남기고 쓰기 결과에 영향을 주지 않습니다.</p>
     *
     * @param collection 대상 컬렉션
     * @param write      stage 토큰
     * @param result     큐 결과
     */
    public void completeWrite(CollectionName collection, PendingWrite write, WriteResult result) {
        CollectionState state = stateOf(collection);
        synchronized (state.fetchLock) {
            state.confirmWrite(write, new CacheEntry(result.documents(), null, result.sha()));
            try {
                if (!fetch(collection, state)) {
                    log.warn("Collection {} was not found when refreshing after write", collection);
                }
            } catch (DocStoreException e) {
                log.warn("Refresh after write failed for collection {}: {}", collection, e.getMessage());
            }
        }
        changeBus.publish(collection, state.view());
    }

    /**
     * 원격 쓰기 실패 처리: 낙관적 변경을 되돌립니다.
     *
     * @param collection 대상 컬렉션
     * @param write      stage 토큰
     */
    public void discard(CollectionName collection, PendingWrite write) {
        stateOf(collection).discard(write);
        changeBus.publish(collection, stateOf(collection).view());
    }

    /**
     * fetchLock을 잡은 상태에서 호출. 원격에 파일이 없으면 false.
     */
    private boolean fetch(CollectionName collection, CollectionState state) {
        String path = paths.pathOf(collection);
        FetchResult result;
        try {
            result = objectStore.get(path, state.isLoaded() ? state.etag() : null);
        } catch (NotFoundException e) {
            return false;
        }
        if (result instanceof FetchResult.Fetched fetched) {
            StoredObject object = fetched.object();
            state.confirm(new CacheEntry(codec.decode(object.content()), object.etag(), object.sha()));
            log.debug("Fetched collection {} (sha: {})", collection, object.sha());
        }
        return true;
    }

    private WriteResult initialize(CollectionName collection) {
        log.info("Collection {} not found, initializing", collection);
        try {
            WriteResult result = writeQueue.enqueue(WriteRequest.initialize(collection, paths.pathOf(collection))).join();
            if (result.written()) {
                log.info("Initialized collection {}", collection);
            }
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DocStoreException("Failed to initialize collection " + collection, cause);
        }
    }

    private CollectionState stateOf(CollectionName collection) {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        return states.computeIfAbsent(collection, key -> new CollectionState());
    }
}
