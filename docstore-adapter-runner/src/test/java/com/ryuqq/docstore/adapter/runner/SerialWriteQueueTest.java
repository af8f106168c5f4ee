package com.ryuqq.docstore.adapter.runner;

import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.write.ConflictPolicy;
import com.ryuqq.docstore.application.write.Mutations;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.NetworkException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.exception.QueueExhaustedException;
import com.ryuqq.docstore.core.exception.RemoteStoreException;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SerialWriteQueue 유닛 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SerialWriteQueueTest {

    private static final CollectionName USERS = CollectionName.of("users");
    private static final String PATH = "db/users.json";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ObjectStore objectStore;

    private final DocumentCodec codec = new DocumentCodec();
    private final WriteQueueConfig fastConfig = new WriteQueueConfig().withBackoff(1, 5, 0.0);
    private SerialWriteQueue queue;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (queue != null) {
            queue.shutdown(Duration.ofSeconds(5));
        }
    }

    // ============================================================
    // 1. 정상 쓰기
    // ============================================================

    @Test
    void 파일이_없으면_sha_null로_생성한다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        when(objectStore.get(PATH, null)).thenThrow(NotFoundException.forPath(PATH));
        when(objectStore.put(eq(PATH), anyString(), isNull(), anyString())).thenReturn("sha-1");

        // when
        WriteResult result = queue.enqueue(insertOf("1", "alice")).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.sha()).isEqualTo("sha-1");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.written()).isTrue();
        assertThat(result.documents()).extracting(document -> document.get("name")).containsExactly("alice");
    }

    @Test
    void REBASE는_최신_원격_배열에_mutation을_다시_적용한다() throws Exception {
        // given: 원격에는 다른 클라이언트가 쓴 bob이 이미 있음
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        stubRemote(List.of(record("1", "bob")), "sha-0");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString())).thenReturn("sha-1");

        // when: 호출 시점 snapshot에는 alice만 있음
        WriteRequest request = WriteRequest.of(USERS, PATH, Mutations.insert(record("2", "alice")),
            List.of(record("2", "alice")), NOW);
        WriteResult result = queue.enqueue(request).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.documents()).extracting(document -> document.get("name"))
            .containsExactly("bob", "alice");
    }

    @Test
    void SNAPSHOT은_호출_시점_배열을_그대로_쓴다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig.withConflictPolicy(ConflictPolicy.SNAPSHOT));
        stubRemote(List.of(record("1", "bob")), "sha-0");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString())).thenReturn("sha-1");

        // when
        WriteRequest request = WriteRequest.of(USERS, PATH, Mutations.insert(record("2", "alice")),
            List.of(record("2", "alice")), NOW);
        WriteResult result = queue.enqueue(request).get(5, TimeUnit.SECONDS);

        // then: bob이 사라짐 (last writer wins)
        assertThat(result.documents()).extracting(document -> document.get("name")).containsExactly("alice");
    }

    @Test
    void 초기화_요청은_파일이_이미_있으면_쓰지_않는다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        stubRemote(List.of(record("1", "bob")), "sha-0");

        // when
        WriteResult result = queue.enqueue(WriteRequest.initialize(USERS, PATH)).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.written()).isFalse();
        assertThat(result.attempts()).isZero();
        assertThat(result.sha()).isEqualTo("sha-0");
        assertThat(result.documents()).hasSize(1);
        verify(objectStore, never()).put(any(), any(), any(), any());
    }

    @Test
    void 초기화_요청은_빈_배열을_쓴다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        when(objectStore.get(PATH, null)).thenThrow(NotFoundException.forPath(PATH));
        when(objectStore.put(PATH, codec.encode(List.of()), null, "Initialize users collection")).thenReturn("sha-1");

        // when
        WriteResult result = queue.enqueue(WriteRequest.initialize(USERS, PATH)).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.written()).isTrue();
        assertThat(result.documents()).isEmpty();
    }

    @Test
    void 워커_스레드_이름에_컬렉션이_들어간다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        AtomicReference<String> threadName = new AtomicReference<>();
        when(objectStore.get(PATH, null)).thenAnswer(invocation -> {
            threadName.set(Thread.currentThread().getName());
            throw NotFoundException.forPath(PATH);
        });
        when(objectStore.put(eq(PATH), anyString(), isNull(), anyString())).thenReturn("sha-1");

        // when
        queue.enqueue(insertOf("1", "alice")).get(5, TimeUnit.SECONDS);

        // then
        assertThat(threadName.get()).isEqualTo("docstore-writer-users");
        assertThat(queue.workerCount()).isEqualTo(1);
    }

    // ============================================================
    // 2. 충돌 재시도
    // ============================================================

    @Test
    void 충돌_후_재조회한_sha로_재시도해_성공한다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        String content = codec.encode(List.of());
        when(objectStore.get(PATH, null))
            .thenReturn(FetchResult.fetched(new StoredObject(PATH, content, "sha-0", null)))
            .thenReturn(FetchResult.fetched(new StoredObject(PATH, content, "sha-1", null)));
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString()))
            .thenThrow(new ConflictException(PATH, "sha-0"));
        when(objectStore.put(eq(PATH), anyString(), eq("sha-1"), anyString())).thenReturn("sha-2");

        // when
        WriteResult result = queue.enqueue(insertOf("1", "alice")).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.sha()).isEqualTo("sha-2");
    }

    @Test
    void 계속_충돌하면_maxAttempts번_시도_후_QueueExhaustedException() {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        stubRemote(List.of(), "sha-0");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString()))
            .thenThrow(new ConflictException(PATH, "sha-0"));

        // when
        CompletableFuture<WriteResult> future = queue.enqueue(insertOf("1", "alice"));

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .cause()
            .isInstanceOfSatisfying(QueueExhaustedException.class, e -> {
                assertThat(e.getAttempts()).isEqualTo(5);
                assertThat(e.isDeadlineExceeded()).isFalse();
                assertThat(e.getCause()).isInstanceOf(ConflictException.class);
            });
        verify(objectStore, times(5)).put(eq(PATH), anyString(), eq("sha-0"), anyString());
    }

    @Test
    void 다음_백오프가_제한_시간을_넘으면_즉시_실패한다() {
        // given: 백오프 250ms, 제한 시간 100ms
        queue = new SerialWriteQueue(objectStore, codec, new WriteQueueConfig().withWriteDeadlineMs(100));
        stubRemote(List.of(), "sha-0");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString()))
            .thenThrow(new ConflictException(PATH, "sha-0"));

        // when
        CompletableFuture<WriteResult> future = queue.enqueue(insertOf("1", "alice"));

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .cause()
            .isInstanceOfSatisfying(QueueExhaustedException.class, e -> {
                assertThat(e.isDeadlineExceeded()).isTrue();
                assertThat(e.getAttempts()).isEqualTo(1);
            });
    }

    @Test
    void 충돌_외_오류는_재시도하지_않는다() {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        stubRemote(List.of(), "sha-0");
        RemoteStoreException failure = new RemoteStoreException(PATH, 500, "boom");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString())).thenThrow(failure);

        // when
        CompletableFuture<WriteResult> future = queue.enqueue(insertOf("1", "alice"));

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).cause().isSameAs(failure);
        verify(objectStore, times(1)).put(eq(PATH), anyString(), eq("sha-0"), anyString());
    }

    @Test
    void 원격에서_삭제된_레코드의_수정은_PUT_없이_실패한다() {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        stubRemote(List.of(record("1", "bob")), "sha-0");
        WriteRequest request = WriteRequest.of(USERS, PATH,
            Mutations.update(USERS, "99", Map.of("name", "x"), NOW.toString(), null), List.of(), NOW);

        // when
        CompletableFuture<WriteResult> future = queue.enqueue(request);

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).cause().isInstanceOf(NotFoundException.class);
        verify(objectStore, never()).put(any(), any(), any(), any());
    }

    @Test
    void 실패한_쓰기_뒤의_쓰기도_처리된다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig.withMaxAttempts(1));
        stubRemote(List.of(), "sha-0");
        when(objectStore.put(eq(PATH), anyString(), eq("sha-0"), anyString()))
            .thenThrow(new ConflictException(PATH, "sha-0"))
            .thenReturn("sha-1");

        // when
        CompletableFuture<WriteResult> first = queue.enqueue(insertOf("1", "alice"));
        CompletableFuture<WriteResult> second = queue.enqueue(insertOf("2", "bob"));

        // then
        assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS)).cause().isInstanceOf(QueueExhaustedException.class);
        assertThat(second.get(5, TimeUnit.SECONDS).sha()).isEqualTo("sha-1");
    }

    // ============================================================
    // 3. 종료
    // ============================================================

    @Test
    void 종료_후_enqueue는_실패한_future를_돌려준다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        queue.shutdown();

        // when
        CompletableFuture<WriteResult> future = queue.enqueue(insertOf("1", "alice"));

        // then
        assertThat(queue.isAccepting()).isFalse();
        assertThatThrownBy(future::join).cause().isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 종료는_대기_중인_쓰기를_모두_처리한_뒤_끝난다() throws Exception {
        // given
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        when(objectStore.get(PATH, null)).thenThrow(NotFoundException.forPath(PATH));
        when(objectStore.put(eq(PATH), anyString(), isNull(), anyString())).thenReturn("sha-1");
        CompletableFuture<WriteResult> first = queue.enqueue(insertOf("1", "alice"));
        CompletableFuture<WriteResult> second = queue.enqueue(insertOf("2", "bob"));

        // when
        queue.shutdown();

        // then
        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
    }

    @Test
    void 제한_시간_안에_끝나지_않으면_시작하지_않은_쓰기는_IllegalStateException() throws Exception {
        // given: 첫 쓰기의 GET이 풀려나지 않음
        queue = new SerialWriteQueue(objectStore, codec, fastConfig);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(objectStore.get(PATH, null)).thenAnswer(invocation -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("interrupted", e);
            }
            throw NotFoundException.forPath(PATH);
        });
        CompletableFuture<WriteResult> blocked = queue.enqueue(insertOf("1", "alice"));
        CompletableFuture<WriteResult> waiting = queue.enqueue(insertOf("2", "bob"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        queue.shutdown(Duration.ofMillis(100));

        // then
        assertThatThrownBy(() -> blocked.get(5, TimeUnit.SECONDS)).cause().isInstanceOf(NetworkException.class);
        assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS)).cause().isInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // Helpers
    // ============================================================

    private void stubRemote(List<Document> documents, String sha) {
        when(objectStore.get(PATH, null))
            .thenReturn(FetchResult.fetched(new StoredObject(PATH, codec.encode(documents), sha, null)));
    }

    private static Document record(String id, String name) {
        return Document.of(Map.of(Document.ID, id, Document.UID, "uid-" + id, "name", name));
    }

    private static WriteRequest insertOf(String id, String name) {
        Document record = record(id, name);
        return WriteRequest.of(USERS, PATH, Mutations.insert(record), List.of(record), NOW);
    }
}
