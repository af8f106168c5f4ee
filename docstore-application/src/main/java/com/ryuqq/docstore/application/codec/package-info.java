/**
 * 컬렉션과 스키마 카탈로그의 JSON 인코딩 (Jackson).
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.codec;
