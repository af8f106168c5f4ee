package com.ryuqq.docstore.application.write;

import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;

import java.time.Instant;
import java.util.List;

/**
 * 컬렉션 파일에 대한 큐 쓰기 요청.
 *
 * @param collection 대상 컬렉션
 * @param path       원격 객체 경로
 * @param mutation   논리적 변경 ({@link ConflictPolicy#REBASE}에서 시도마다 재적용)
 * @param snapshot   호출 시점 전체 배열 ({@link ConflictPolicy#SNAPSHOT}에서 그대로 기록)
 * @param message    커밋 메시지
 * @param createOnly true면 이미 존재하지 않을 때만 빈 컬렉션 생성
 * @author DocStore Team
 * @since 1.0.0
 */
public record WriteRequest(
    CollectionName collection,
    String path,
    Mutation mutation,
    List<Document> snapshot,
    String message,
    boolean createOnly
) {

    public WriteRequest {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        snapshot = snapshot == null ? List.of() : List.copyOf(snapshot);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 일반 쓰기 요청 생성. 커밋 메시지는 {@code Update <collection> - <ISO 시각>}.
     *
     * @param collection 대상 컬렉션
     * @param path       원격 경로
     * @param mutation   논리적 변경
     * @param snapshot   호출 시점 전체 배열
     * @param now        메시지 시각
     * @return WriteRequest
     */
    public static WriteRequest of(CollectionName collection, String path, Mutation mutation,
                                  List<Document> snapshot, Instant now) {
        return new WriteRequest(collection, path, mutation, snapshot,
            "Update " + collection.getValue() + " - " + now, false);
    }

    /**
     * 빈 컬렉션 생성 요청. 이미 존재하면 쓰지 않습니다.
     *
     * @param collection 대상 컬렉션
     * @param path       원격 경로
     * @return create-only WriteRequest
     */
    public static WriteRequest initialize(CollectionName collection, String path) {
        return new WriteRequest(collection, path, Mutations.none(), List.of(),
            "Initialize " + collection.getValue() + " collection", true);
    }
}
