package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.DocStoreException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WriteHandle 유닛 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
class WriteHandleTest {

    @Test
    void await_완료_값_반환() {
        WriteHandle<String> handle = new WriteHandle<>("accepted", CompletableFuture.completedFuture("stored"));

        assertThat(handle.getAccepted()).isEqualTo("accepted");
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.await()).isEqualTo("stored");
    }

    @Test
    void await_런타임_예외는_그대로_전파() {
        CompletableFuture<String> future = new CompletableFuture<>();
        future.completeExceptionally(new ConflictException("db/a.json", "s1"));

        assertThatThrownBy(() -> new WriteHandle<>("x", future).await())
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void await_체크_예외는_DocStoreException으로_감쌈() {
        CompletableFuture<String> future = new CompletableFuture<>();
        future.completeExceptionally(new IOException("disk"));

        assertThatThrownBy(() -> new WriteHandle<>("x", future).await())
            .isInstanceOf(DocStoreException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void await_제한_시간_초과() {
        WriteHandle<String> handle = new WriteHandle<>("x", new CompletableFuture<>());

        assertThatThrownBy(() -> handle.await(Duration.ofMillis(20)))
            .isInstanceOf(TimeoutException.class);
    }
}
