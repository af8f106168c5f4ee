package com.ryuqq.docstore.application.cache;

import com.ryuqq.docstore.application.write.Mutation;

/**
 * 캐시에 수락되었지만 아직 원격에서 확정되지 않은 변경의 토큰.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class PendingWrite {

    private final Mutation mutation;

    PendingWrite(Mutation mutation) {
        this.mutation = mutation;
    }

    Mutation mutation() {
        return mutation;
    }
}
