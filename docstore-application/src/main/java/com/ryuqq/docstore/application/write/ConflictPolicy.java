package com.ryuqq.docstore.application.write;

/**
 * 계획 시점보다 새로운 원격 리비전을 만났을 때 큐 쓰기의 해소 방식.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public enum ConflictPolicy {

    /**
     * 매 시도마다 새로 조회한 레코드에 논리적 변경을 다시 적용.
     * 동시 작성자의 변경이 서로 지워지지 않습니다.
     */
    REBASE,

    /**
     * 호출 시점에 계산한 전체 배열로 원격 내용을 교체.
     * 마지막 작성자가 이기며 다른 곳의 동시 변경은 유실될 수 있습니다.
     */
    SNAPSHOT
}
