package com.ryuqq.docstore.core.exception;

/**
 * 문서 저장소가 던지는 모든 예외의 상위 타입.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class DocStoreException extends RuntimeException {

    public DocStoreException(String message) {
        super(message);
    }

    public DocStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
