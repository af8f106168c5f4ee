package com.ryuqq.docstore.application.write;

import com.ryuqq.docstore.core.model.Document;

import java.util.List;

/**
 * 컬렉션의 어떤 리비전에도 적용할 수 있는 논리적 변경.
 *
 * <p>시도마다, 그리고 캐시가 재조회한 사본 위에 pending 변경을 다시 얹을 때마다 여러 번 적용될 수 있습니다.
 * 구현은 순수 함수여야 하며 같은 입력에 같은 결과를 내야 합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Mutation {

    /**
     * @param current 한 리비전의 레코드 (수정하지 않음)
     * @return 변경 후 레코드
     */
    List<Document> apply(List<Document> current);
}
