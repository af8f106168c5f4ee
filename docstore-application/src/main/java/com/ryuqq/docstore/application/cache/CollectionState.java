package com.ryuqq.docstore.application.cache;

import com.ryuqq.docstore.application.write.Mutation;
import com.ryuqq.docstore.core.exception.DocStoreException;
import com.ryuqq.docstore.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 단일 컬렉션의 캐시 상태.
 *
 * <p>view = pending mutation들을 confirmed 레코드 위에 순서대로 적용한 결과.
 * 더 이상 적용할 수 없는 mutation(대상 레코드가 사라진 update 등)은 view 계산에서 건너뜁니다.</p>
 *
 * <p>{@code fetchLock}은 원격 조회와 확정(confirm)을 직렬화하며, 상태 필드는 객체 모니터로 보호됩니다.</p>
 */
final class CollectionState {

    private static final Logger log = LoggerFactory.getLogger(CollectionState.class);

    final Object fetchLock = new Object();

    private CacheEntry confirmed;
    private final List<PendingWrite> pending = new ArrayList<>();
    private List<Document> view = List.of();

    synchronized boolean isLoaded() {
        return confirmed != null;
    }

    synchronized List<Document> view() {
        return view;
    }

    synchronized String etag() {
        return confirmed == null ? null : confirmed.etag();
    }

    synchronized CacheEntry confirmed() {
        return confirmed;
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    synchronized void confirm(CacheEntry entry) {
        confirmed = entry;
        recompute();
    }

    synchronized List<Document> stage(PendingWrite write) {
        pending.add(write);
        recompute();
        return view;
    }

    synchronized void confirmWrite(PendingWrite write, CacheEntry entry) {
        pending.remove(write);
        confirmed = entry;
        recompute();
    }

    synchronized void discard(PendingWrite write) {
        pending.remove(write);
        recompute();
    }

    private void recompute() {
        List<Document> current = confirmed == null ? List.of() : confirmed.records();
        for (PendingWrite write : pending) {
            Mutation mutation = write.mutation();
            try {
                current = mutation.apply(current);
            } catch (DocStoreException e) {
                log.debug("Skipping pending change that no longer applies: {}", e.getMessage());
            }
        }
        view = List.copyOf(current);
    }
}
