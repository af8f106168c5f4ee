/**
 * 문서 저장소의 공개 CRUD API.
 *
 * <p>진입점은 {@link com.ryuqq.docstore.application.store.DocumentStore} 하나입니다.
 * 읽기는 {@link com.ryuqq.docstore.application.cache.CollectionCache}에서 제공하고,
 * 쓰기는 큐에 등록되는 즉시 {@link com.ryuqq.docstore.application.store.WriteHandle}을 반환합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.store;
