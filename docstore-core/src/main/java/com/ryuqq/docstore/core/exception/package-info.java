/**
 * 문서 저장소 예외.
 *
 * <p>모든 타입은 {@link com.ryuqq.docstore.core.exception.DocStoreException}을 상속하므로 한 번에 잡을 수 있습니다.
 * 쓰기 큐가 재시도하는 것은 {@link com.ryuqq.docstore.core.exception.ConflictException}뿐입니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.core.exception;
