package com.ryuqq.docstore.core.exception;

/**
 * 원격 저장소에 연결할 수 없거나 호출이 인터럽트된 경우 발생.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class NetworkException extends DocStoreException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
