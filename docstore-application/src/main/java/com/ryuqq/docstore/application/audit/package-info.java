/**
 * 인메모리 감사 로그.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.audit;
