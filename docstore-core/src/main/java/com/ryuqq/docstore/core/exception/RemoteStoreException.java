package com.ryuqq.docstore.core.exception;

/**
 * 성공, not-found, 충돌 어느 것도 아닌 원격 저장소 응답에 대해 발생.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class RemoteStoreException extends DocStoreException {

    private final String path;
    private final int status;

    public RemoteStoreException(String path, int status, String detail) {
        super("Remote store error for " + path + " (status: " + status + ")"
            + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.path = path;
        this.status = status;
    }

    public String getPath() {
        return path;
    }

    public int getStatus() {
        return status;
    }
}
