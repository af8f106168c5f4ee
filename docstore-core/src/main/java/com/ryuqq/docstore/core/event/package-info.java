/**
 * 변경 알림 계약.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.core.event;
