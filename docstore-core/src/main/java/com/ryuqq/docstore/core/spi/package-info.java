/**
 * 원격 객체 저장소 SPI.
 *
 * <p>어댑터가 {@link com.ryuqq.docstore.core.spi.ObjectStore}를 구현합니다:
 * 운영은 GitHub contents API 어댑터, 테스트는 인메모리 어댑터.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.core.spi;
