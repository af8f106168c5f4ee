/**
 * 변경 알림 버스.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.application.notify;
