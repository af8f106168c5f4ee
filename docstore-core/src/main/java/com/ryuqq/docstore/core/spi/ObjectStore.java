package com.ryuqq.docstore.core.spi;

/**
 * 원격 버전 저장소 SPI.
 *
 * <p>각 객체는 경로로 식별되는 UTF-8 텍스트 파일이며 리비전 id(sha)를 가집니다.
 * 쓰기는 compare-and-swap입니다: 대체할 리비전을 지정하고, 그 리비전이 최신이 아니면 충돌로 실패합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 쓰기 스레드에서 동시에 호출될 수 있음</li>
 *   <li>{@code get}: 객체가 없으면 {@link com.ryuqq.docstore.core.exception.NotFoundException}</li>
 *   <li>{@code put}: 리비전이 오래됐거나 없으면 {@link com.ryuqq.docstore.core.exception.ConflictException}</li>
 *   <li>전송 실패는 {@link com.ryuqq.docstore.core.exception.NetworkException}</li>
 *   <li>그 외 실패 응답은 {@link com.ryuqq.docstore.core.exception.RemoteStoreException}</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public interface ObjectStore {

    /**
     * 객체 조회. ETag를 넘기면 조건부 조회.
     *
     * @param path        객체 경로
     * @param ifNoneMatch 이전 조회의 ETag (null이면 무조건 조회)
     * @return {@link FetchResult.Fetched} or {@link FetchResult.NotModified}
     */
    FetchResult get(String path, String ifNoneMatch);

    /**
     * 객체 생성 또는 교체.
     *
     * @param path    객체 경로
     * @param content 저장할 UTF-8 텍스트
     * @param sha     대체할 리비전 (null이면 신규 생성)
     * @param message 리비전에 기록되는 커밋 메시지
     * @return 새 리비전 id
     */
    String put(String path, String content, String sha, String message);
}
