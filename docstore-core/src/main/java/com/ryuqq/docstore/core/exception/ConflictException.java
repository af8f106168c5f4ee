package com.ryuqq.docstore.core.exception;

/**
 * 조건부 쓰기가 지정한 리비전이 더 이상 최신이 아닐 때 발생.
 *
 * <p>쓰기 큐는 이 예외만 재시도하며, 그 외 예외는 즉시 쓰기를 실패시킵니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class ConflictException extends DocStoreException {

    private final String path;
    private final String sha;

    public ConflictException(String path, String sha) {
        super("Revision conflict on " + path + " (expected sha: " + sha + ")");
        this.path = path;
        this.sha = sha;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return 실패한 쓰기가 기준으로 삼은 리비전 (생성이면 null)
     */
    public String getSha() {
        return sha;
    }
}
