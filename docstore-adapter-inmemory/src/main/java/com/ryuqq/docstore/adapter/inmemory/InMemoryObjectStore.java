package com.ryuqq.docstore.adapter.inmemory;

import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트 및 참조 구현용 {@link ObjectStore} SPI 인메모리 구현체.
 *
 * <p>버전 관리 contents API의 리비전 의미를 흉내냅니다: 쓰기마다 새 sha가 생기고,
 * 쓰기는 현재 sha를 지정해야 하며 (생성은 null), 조회는 sha에서 만든 ETag를 노출합니다.</p>
 *
 * <p><strong>자료구조:</strong></p>
 * <ul>
 *   <li><strong>objects:</strong> ConcurrentHashMap&lt;String, StoredObject&gt; - 경로별 현재 리비전</li>
 *   <li><strong>revision:</strong> AtomicLong - 모든 sha에 섞이는 전역 쓰기 카운터</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> {@link ConcurrentHashMap#compute}로 경로별 compare-and-swap.
 * 한 경로에 대한 동시 쓰기 중 정확히 하나만 성공합니다.</p>
 *
 * <p><strong>제약사항:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 데이터 손실</li>
 *   <li>운영 환경 사용 불가</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentHashMap<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final AtomicLong revision = new AtomicLong();

    @Override
    public FetchResult get(String path, String ifNoneMatch) {
        requirePath(path);
        StoredObject object = objects.get(path);
        if (object == null) {
            throw NotFoundException.forPath(path);
        }
        if (ifNoneMatch != null && ifNoneMatch.equals(object.etag())) {
            return FetchResult.notModified();
        }
        return FetchResult.fetched(object);
    }

    @Override
    public String put(String path, String content, String sha, String message) {
        requirePath(path);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        StoredObject written = objects.compute(path, (key, current) -> {
            if (current == null && sha != null) {
                throw new ConflictException(path, sha);
            }
            if (current != null && !current.sha().equals(sha)) {
                throw new ConflictException(path, sha);
            }
            String newSha = digest(revision.incrementAndGet() + ":" + path + ":" + content);
            return new StoredObject(path, content, newSha, "\"" + newSha + "\"");
        });
        return written.sha();
    }

    // ========================================
    // Test helpers
    // ========================================

    /**
     * 경로의 현재 내용.
     *
     * @param path 객체 경로
     * @return 내용, 없으면 empty
     */
    public Optional<String> contentOf(String path) {
        StoredObject object = objects.get(path);
        return object == null ? Optional.empty() : Optional.of(object.content());
    }

    public Optional<String> shaOf(String path) {
        StoredObject object = objects.get(path);
        return object == null ? Optional.empty() : Optional.of(object.sha());
    }

    public Set<String> paths() {
        return new TreeSet<>(objects.keySet());
    }

    public void clear() {
        objects.clear();
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
    }

    private static String digest(String text) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(sha1.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
