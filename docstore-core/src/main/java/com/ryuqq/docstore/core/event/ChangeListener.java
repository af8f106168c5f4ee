package com.ryuqq.docstore.core.event;

import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;

import java.util.List;

/**
 * 변경이 수락될 때마다 컬렉션의 현재 view를 받는 리스너.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * @param collection 변경된 컬렉션
     * @param records    현재 전체 view (변경 불가)
     */
    void onChange(CollectionName collection, List<Document> records);
}
