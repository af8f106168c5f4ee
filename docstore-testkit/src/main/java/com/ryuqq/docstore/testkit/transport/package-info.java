/**
 * 동시성, 재시도 테스트용 계측 전송 계층.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.testkit.transport;
