/**
 * 낙관적 pending 변경을 포함한 컬렉션별 읽기 캐시.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.cache;
