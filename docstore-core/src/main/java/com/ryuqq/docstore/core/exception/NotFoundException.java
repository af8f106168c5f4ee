package com.ryuqq.docstore.core.exception;

/**
 * 원격 객체 또는 id/uid로 지정한 레코드가 없을 때 발생.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class NotFoundException extends DocStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException forPath(String path) {
        return new NotFoundException("Object not found: " + path);
    }

    public static NotFoundException forKey(String collection, Object key) {
        return new NotFoundException("Record not found in " + collection + ": " + key);
    }
}
