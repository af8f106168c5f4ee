package com.ryuqq.docstore.core.model;

import java.time.Instant;

/**
 * 감사 로그 항목: 어떤 변경이 어느 레코드에 언제 일어났는지.
 *
 * @param action    변경 종류
 * @param snapshot  insert/update 후 레코드, delete면 삭제된 레코드
 * @param timestamp 변경이 수락된 시각
 * @author DocStore Team
 * @since 1.0.0
 */
public record AuditEntry(AuditAction action, Document snapshot, Instant timestamp) {

    public AuditEntry {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
