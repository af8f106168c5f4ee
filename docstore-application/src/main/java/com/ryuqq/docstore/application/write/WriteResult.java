package com.ryuqq.docstore.application.write;

import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;

import java.util.List;

/**
 * 완료된 큐 쓰기의 결과.
 *
 * @param collection 기록한 컬렉션
 * @param documents  쓰기 후 원격에 저장된 레코드
 * @param sha        쓰기 후 원격 리비전
 * @param attempts   사용한 PUT 시도 횟수 (쓸 필요가 없었으면 0)
 * @param written    create-only 요청이 이미 존재하는 객체를 만나면 false
 * @author DocStore Team
 * @since 1.0.0
 */
public record WriteResult(
    CollectionName collection,
    List<Document> documents,
    String sha,
    int attempts,
    boolean written
) {

    public WriteResult {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        documents = documents == null ? List.of() : List.copyOf(documents);
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }
}
