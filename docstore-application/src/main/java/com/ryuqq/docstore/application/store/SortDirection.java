package com.ryuqq.docstore.application.store;

/**
 * {@link Query#sort(String, SortDirection)} 정렬 방향.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public enum SortDirection {
    ASC,
    DESC
}
