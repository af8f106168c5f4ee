/**
 * 문서 저장소의 핵심 Value Object 패키지.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docstore.core.model.CollectionName} - 컬렉션 식별자 (원격 파일 하나에 대응)</li>
 *   <li>{@link com.ryuqq.docstore.core.model.Document} - id/uid 키를 가진 불변 JSON 객체</li>
 *   <li>{@link com.ryuqq.docstore.core.model.AuditEntry} - 감사 로그 항목</li>
 * </ul>
 *
 * <h2>Helpers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docstore.core.model.DocumentKeys} - 순번 id, 무작위 uid 생성</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.core.model;
