package com.ryuqq.docstore.core.exception;

/**
 * 원격 내용이 JSON 객체 배열이 아닐 때 발생.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class DocumentFormatException extends DocStoreException {

    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
