package com.ryuqq.docstore.application.store;

import com.ryuqq.docstore.application.codec.DocumentCodec;
import com.ryuqq.docstore.application.write.Mutations;
import com.ryuqq.docstore.application.write.WriteQueue;
import com.ryuqq.docstore.application.write.WriteRequest;
import com.ryuqq.docstore.application.write.WriteResult;
import com.ryuqq.docstore.core.event.Subscription;
import com.ryuqq.docstore.core.exception.NetworkException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.exception.QueueExhaustedException;
import com.ryuqq.docstore.core.exception.SchemaValidationException;
import com.ryuqq.docstore.core.model.AuditAction;
import com.ryuqq.docstore.core.model.AuditEntry;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.schema.FieldKind;
import com.ryuqq.docstore.core.schema.Schema;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;
import com.ryuqq.docstore.core.spi.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * DocumentStore 유닛 테스트.
 *
 * <p>원격 저장소는 문자열 하나로, 쓰기 큐는 테스트가 직접 완료시키는 Future 목록으로 대체합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DocumentStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String WIDGETS = "widgets";

    @Mock
    private ObjectStore objectStore;

    @Mock
    private WriteQueue writeQueue;

    private final DocumentCodec codec = new DocumentCodec();
    private final AtomicReference<String> remote = new AtomicReference<>("[]");
    private final AtomicInteger revision = new AtomicInteger();
    private final List<WriteRequest> requests = new ArrayList<>();
    private final List<CompletableFuture<WriteResult>> futures = new ArrayList<>();

    private DocumentStore store;

    @BeforeEach
    void setUp() {
        lenient().when(objectStore.get(anyString(), nullable(String.class))).thenAnswer(invocation ->
            FetchResult.fetched(new StoredObject(invocation.getArgument(0), remote.get(),
                "sha-" + revision.get(), null)));
        lenient().when(writeQueue.enqueue(any())).thenAnswer(invocation -> {
            requests.add(invocation.getArgument(0));
            CompletableFuture<WriteResult> future = new CompletableFuture<>();
            futures.add(future);
            return future;
        });
        store = newStore(DocumentStoreConfig.defaultConfig());
    }

    private DocumentStore newStore(DocumentStoreConfig config) {
        return new DocumentStore(config, objectStore, writeQueue, codec, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * i번째 쓰기를 원격에 반영하고 Future를 완료합니다.
     */
    private void completeWrite(int index) {
        WriteRequest request = requests.get(index);
        List<Document> written = request.mutation().apply(codec.decode(remote.get()));
        remote.set(codec.encode(written));
        revision.incrementAndGet();
        futures.get(index).complete(new WriteResult(request.collection(), written,
            "sha-" + revision.get(), 1, true));
    }

    private void seed(List<Map<String, Object>> records) {
        List<Document> documents = new ArrayList<>();
        records.forEach(record -> documents.add(Document.of(record)));
        remote.set(codec.encode(documents));
    }

    private static Map<String, Object> widget(String id, String uid, String name, Object price) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", id);
        fields.put("uid", uid);
        fields.put("name", name);
        fields.put("price", price);
        return fields;
    }

    // ========================================
    // 1. insert
    // ========================================

    @Test
    void insert_필수_필드_누락_시_네트워크_호출_없이_실패() {
        // given
        store.registerSchema(WIDGETS, Schema.builder().required("name", "price").build());

        // when & then
        assertThatThrownBy(() -> store.insert(WIDGETS, Map.of("name", "bolt")))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("Missing required field: price");
        verifyNoInteractions(objectStore, writeQueue);
    }

    @Test
    void insert_연속_호출_시_순차_id_부여() {
        // when
        Document first = store.insert(WIDGETS, Map.of("name", "a")).getAccepted();
        Document second = store.insert(WIDGETS, Map.of("name", "b")).getAccepted();
        Document third = store.insert(WIDGETS, Map.of("name", "c")).getAccepted();

        // then
        assertThat(List.of(first, second, third)).extracting(Document::getId).containsExactly("1", "2", "3");
        assertThat(List.of(first.getUid(), second.getUid(), third.getUid())).doesNotHaveDuplicates();
        assertThat(store.load(WIDGETS)).hasSize(3);
        assertThat(requests).hasSize(3);
    }

    @Test
    void insert_호출자가_준_id_uid는_생성값으로_대체() {
        Document accepted = store.insert(WIDGETS, Map.of("id", "77", "uid", "mine", "name", "a")).getAccepted();

        assertThat(accepted.getId()).isEqualTo("1");
        assertThat(accepted.getUid()).isNotEqualTo("mine");
    }

    @Test
    void insert_스키마_기본값_적용_호출자_값_우선() {
        // given
        store.registerSchema(WIDGETS, Schema.builder()
            .defaultValue("stock", 0)
            .defaultValue("active", true)
            .build());

        // when
        Document accepted = store.insert(WIDGETS, Map.of("name", "a", "stock", 5)).getAccepted();

        // then
        assertThat(accepted.get("stock")).isEqualTo(5);
        assertThat(accepted.get("active")).isEqualTo(true);
    }

    @Test
    void insert_완료_후_저장된_레코드_반환_및_캐시_반영() {
        // given
        WriteHandle<Document> handle = store.insert(WIDGETS, Map.of("name", "a"));
        assertThat(handle.isDone()).isFalse();

        // when
        completeWrite(0);

        // then
        Document persisted = handle.await();
        assertThat(persisted).isEqualTo(handle.getAccepted());
        assertThat(store.load(WIDGETS)).containsExactly(persisted);
    }

    @Test
    void insert_쓰기_실패_시_예외_전파_및_롤백() {
        // given
        WriteHandle<Document> handle = store.insert(WIDGETS, Map.of("name", "a"));
        assertThat(store.load(WIDGETS)).hasSize(1);

        // when
        futures.get(0).completeExceptionally(new QueueExhaustedException("db/widgets.json", 5, false, null));

        // then
        assertThatThrownBy(handle::await).isInstanceOf(QueueExhaustedException.class);
        assertThat(store.load(WIDGETS)).isEmpty();
    }

    @Test
    void insert_감사_로그_기록() {
        Document accepted = store.insert(WIDGETS, Map.of("name", "a")).getAccepted();

        List<AuditEntry> trail = store.auditTrail(WIDGETS);
        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).action()).isEqualTo(AuditAction.INSERT);
        assertThat(trail.get(0).snapshot()).isEqualTo(accepted);
        assertThat(trail.get(0).timestamp()).isEqualTo(NOW);
    }

    @Test
    void insert_큐_요청_내용() {
        store.insert(WIDGETS, Map.of("name", "a"));

        WriteRequest request = requests.get(0);
        assertThat(request.collection()).isEqualTo(CollectionName.of(WIDGETS));
        assertThat(request.path()).isEqualTo("db/widgets.json");
        assertThat(request.createOnly()).isFalse();
        assertThat(request.message()).isEqualTo("Update widgets - 2024-05-01T10:00:00Z");
        assertThat(request.snapshot()).hasSize(1);
    }

    // ========================================
    // 2. update / delete
    // ========================================

    @Test
    void update_병합_키_보존_updated_at_기록() {
        // given
        seed(List.of(widget("1", "u1", "a", 10), widget("2", "u2", "b", 20)));

        // when
        WriteHandle<Document> handle = store.update(WIDGETS, "u2", Map.of("price", 25, "id", "9"));

        // then
        Document accepted = handle.getAccepted();
        assertThat(accepted.getId()).isEqualTo("2");
        assertThat(accepted.getUid()).isEqualTo("u2");
        assertThat(accepted.get("price")).isEqualTo(25);
        assertThat(accepted.get(Mutations.UPDATED_AT)).isEqualTo("2024-05-01T10:00:00Z");

        completeWrite(0);
        assertThat(handle.await()).isEqualTo(accepted);
        assertThat(store.findById(WIDGETS, "2")).contains(accepted);
    }

    @Test
    void update_없는_키면_NotFound_큐_등록_없음() {
        seed(List.of(widget("1", "u1", "a", 10)));

        assertThatThrownBy(() -> store.update(WIDGETS, "nope", Map.of("price", 1)))
            .isInstanceOf(NotFoundException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void update_타입_검사_활성화_시_위반이면_실패() {
        // given
        store = newStore(DocumentStoreConfig.defaultConfig()
            .withEnforceTypes(true)
            .withSchemas(Map.of(WIDGETS, Schema.builder().type("price", FieldKind.NUMBER).build())));
        seed(List.of(widget("1", "u1", "a", 10)));

        // when & then
        assertThatThrownBy(() -> store.update(WIDGETS, 1, Map.of("price", "free")))
            .isInstanceOf(SchemaValidationException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void delete_삭제_레코드_반환_및_감사() {
        // given
        seed(List.of(widget("1", "u1", "a", 10), widget("2", "u2", "b", 20)));

        // when
        WriteHandle<List<Document>> handle = store.delete(WIDGETS, 1);
        completeWrite(0);

        // then
        assertThat(handle.await()).extracting(Document::getUid).containsExactly("u1");
        assertThat(store.load(WIDGETS)).extracting(Document::getUid).containsExactly("u2");
        assertThat(store.auditTrail(WIDGETS)).extracting(AuditEntry::action).containsExactly(AuditAction.DELETE);
    }

    @Test
    void delete_없는_키면_NotFound() {
        assertThatThrownBy(() -> store.delete(WIDGETS, "ghost"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("ghost");
    }

    // ========================================
    // 3. read
    // ========================================

    @Test
    void findById_id_또는_uid로_조회() {
        seed(List.of(widget("1", "u1", "a", 10), widget("2", "u2", "b", 20)));

        assertThat(store.findById(WIDGETS, "2")).map(Document::getUid).contains("u2");
        assertThat(store.findById(WIDGETS, 2)).map(Document::getUid).contains("u2");
        assertThat(store.findById(WIDGETS, "u1")).map(Document::getId).contains("1");
        assertThat(store.findById(WIDGETS, "u3")).isEmpty();
    }

    @Test
    void find_필드_일치_숫자는_값으로_비교() {
        seed(List.of(widget("1", "u1", "a", 10), widget("2", "u2", "b", 20.5)));

        assertThat(store.find(WIDGETS, Map.of("price", 10L))).extracting(Document::getUid).containsExactly("u1");
        assertThat(store.find(WIDGETS, Map.of("price", 20.5, "name", "b"))).hasSize(1);
        assertThat(store.find(WIDGETS, Map.of("name", "z"))).isEmpty();
        assertThat(store.find(WIDGETS, Map.of())).hasSize(2);
    }

    @Test
    void find_술어_조회() {
        seed(List.of(widget("1", "u1", "a", 10), widget("2", "u2", "b", 20)));

        List<Document> expensive = store.find(WIDGETS,
            document -> ((Number) document.get("price")).intValue() > 15);

        assertThat(expensive).extracting(Document::getUid).containsExactly("u2");
    }

    // ========================================
    // 4. subscribe / initializeAll / close
    // ========================================

    @Test
    void subscribe_변경_수락_시_view_전달_구독자_예외_격리() {
        // given
        store.load(WIDGETS);
        List<List<Document>> received = new ArrayList<>();
        store.subscribe(WIDGETS, (collection, records) -> {
            throw new IllegalStateException("broken listener");
        });
        Subscription subscription = store.subscribe(WIDGETS, (collection, records) -> received.add(records));

        // when
        store.insert(WIDGETS, Map.of("name", "a"));
        subscription.unsubscribe();
        store.insert(WIDGETS, Map.of("name", "b"));

        // then
        assertThat(received).hasSize(1);
        assertThat(received.get(0)).hasSize(1);
    }

    @Test
    void initializeAll_실패한_컬렉션은_건너뜀() {
        // given
        store = newStore(DocumentStoreConfig.defaultConfig().withSchemas(Map.of(
            "users", Schema.empty(),
            "orders", Schema.empty())));
        lenient().when(objectStore.get(eq("db/orders.json"), nullable(String.class)))
            .thenThrow(new NetworkException("orders unavailable", null));

        // when
        List<CollectionName> initialized = store.initializeAll();

        // then
        assertThat(initialized).containsExactly(CollectionName.of("users"));
    }

    @Test
    void 원격_반영_후_캐시_확정과_알림은_쓰기를_완료한_스레드가_아닌_콜백_스레드에서_실행() {
        // given
        WriteHandle<Document> handle = store.insert(WIDGETS, Map.of("name", "a"));
        List<String> threads = new CopyOnWriteArrayList<>();
        store.subscribe(WIDGETS, (collection, records) -> threads.add(Thread.currentThread().getName()));

        // when
        completeWrite(0);
        handle.await();

        // then
        assertThat(threads).isNotEmpty().allMatch(name -> name.startsWith("docstore-callback-"));
        assertThat(Thread.currentThread().getName()).doesNotStartWith("docstore-callback-");
    }

    @Test
    void close_큐_종료_이후_변경_거부() throws Exception {
        // when
        store.close();

        // then
        verify(writeQueue).shutdown();
        assertThatThrownBy(() -> store.insert(WIDGETS, Map.of("name", "a")))
            .isInstanceOf(IllegalStateException.class);
    }
}
