/**
 * 객체 저장소 SPI의 인메모리 참조 어댑터.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
package com.ryuqq.docstore.adapter.inmemory;
