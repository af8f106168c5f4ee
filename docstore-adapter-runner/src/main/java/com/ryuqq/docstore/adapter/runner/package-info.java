/**
 * 스레드 기반 쓰기 직렬화.
 *
 * <p>{@link com.ryuqq.docstore.adapter.runner.SerialWriteQueue}는 원격 경로마다 워커 스레드 하나를 둡니다.
 * 워커는 조건부 PUT 전마다 현재 리비전을 다시 읽고, 충돌 사이에는 backoff합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.adapter.runner;
