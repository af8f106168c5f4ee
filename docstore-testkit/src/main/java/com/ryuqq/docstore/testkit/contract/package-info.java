/**
 * {@link com.ryuqq.docstore.core.spi.ObjectStore} 어댑터용 재사용 계약 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.testkit.contract;
