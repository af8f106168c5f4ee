/**
 * 문서 저장소의 쓰기 포트.
 *
 * <p>파사드는 각 변경을 {@link com.ryuqq.docstore.application.write.Mutation}과 캐시 view 위에서 계산한
 * snapshot으로 만들어 {@link com.ryuqq.docstore.application.write.WriteQueue}에 넘깁니다.
 * 어느 쪽이 원격에 기록될지는 큐가 {@link com.ryuqq.docstore.application.write.ConflictPolicy}에 따라 정합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.write;
