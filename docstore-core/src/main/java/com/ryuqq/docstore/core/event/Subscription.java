package com.ryuqq.docstore.core.event;

/**
 * subscribe가 반환하는 구독 핸들. 중복 해제는 무해합니다.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
