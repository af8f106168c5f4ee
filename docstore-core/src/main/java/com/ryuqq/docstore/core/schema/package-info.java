/**
 * 스키마 선언과 검증.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.core.schema;
