package com.ryuqq.docstore.application.audit;

import com.ryuqq.docstore.core.model.AuditAction;
import com.ryuqq.docstore.core.model.AuditEntry;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 컬렉션별 감사 로그.
 *
 * <p>메모리 전용 링 버퍼로, 컬렉션마다 최근 {@code capacity}개 항목만 유지합니다.
 * 디버깅 용도이며 영속성을 보장하지 않습니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class AuditLog {

    /**
     * 기본 보관 개수.
     */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ConcurrentHashMap<CollectionName, ArrayDeque<AuditEntry>> entries = new ConcurrentHashMap<>();

    public AuditLog() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity 컬렉션별 최대 항목 수
     * @throws IllegalArgumentException capacity가 1 미만인 경우
     */
    public AuditLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
    }

    /**
     * 항목 추가. 용량을 초과하면 가장 오래된 항목이 제거됩니다.
     *
     * @param collection 대상 컬렉션
     * @param action     변경 종류
     * @param snapshot   레코드 스냅샷
     * @param timestamp  기록 시각
     */
    public void record(CollectionName collection, AuditAction action, Document snapshot, Instant timestamp) {
        AuditEntry entry = new AuditEntry(action, snapshot, timestamp);
        ArrayDeque<AuditEntry> log = entries.computeIfAbsent(collection, key -> new ArrayDeque<>());
        synchronized (log) {
            log.addLast(entry);
            while (log.size() > capacity) {
                log.removeFirst();
            }
        }
    }

    /**
     * 컬렉션의 감사 항목 조회 (오래된 순).
     *
     * @param collection 대상 컬렉션
     * @return 변경 불가 목록
     */
    public List<AuditEntry> entries(CollectionName collection) {
        ArrayDeque<AuditEntry> log = entries.get(collection);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
