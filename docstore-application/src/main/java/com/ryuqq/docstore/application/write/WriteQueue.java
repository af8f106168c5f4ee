package com.ryuqq.docstore.application.write;

import java.util.concurrent.CompletableFuture;

/**
 * 원격 쓰기 직렬화 포트.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>원격 경로당 진행 중인 쓰기는 최대 하나</li>
 *   <li>충돌은 정해진 한도 안에서 재시도</li>
 *   <li>수락한 Future는 정확히 한 번 완료</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public interface WriteQueue {

    /**
     * 쓰기를 비동기 실행 대기열에 등록.
     *
     * @param request 수행할 쓰기
     * @return 저장 결과로 완료되는 Future. 충돌이 반복되면
     *         {@link com.ryuqq.docstore.core.exception.QueueExhaustedException}, 재시도 불가 오류면 그 예외로 실패
     */
    CompletableFuture<WriteResult> enqueue(WriteRequest request);

    /**
     * 새 쓰기 수락을 멈추고 대기 중인 쓰기가 끝날 때까지 기다립니다.
     *
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void shutdown() throws InterruptedException;
}
