package com.ryuqq.docstore.core.model;

/**
 * 감사 로그에 기록되는 변경 종류.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public enum AuditAction {
    INSERT,
    UPDATE,
    DELETE
}
