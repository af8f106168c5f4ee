package com.ryuqq.docstore.application.cache;

import com.ryuqq.docstore.core.model.Document;

import java.util.List;

/**
 * 컬렉션의 마지막 확정 원격 리비전.
 *
 * @param records 해당 리비전의 레코드
 * @param etag    다음 조건부 조회용 ETag (모르면 null)
 * @param sha     리비전 id (모르면 null)
 * @author DocStore Team
 * @since 1.0.0
 */
public record CacheEntry(List<Document> records, String etag, String sha) {

    public CacheEntry {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
