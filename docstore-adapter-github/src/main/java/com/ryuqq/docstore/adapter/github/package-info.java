/**
 * GitHub contents API 어댑터.
 *
 * <p>컬렉션 하나는 저장소 브랜치의 JSON 파일 하나입니다. 파일의 blob sha를 조건부 쓰기 리비전으로,
 * 응답 ETag를 조건부 조회에 사용합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.adapter.github;
