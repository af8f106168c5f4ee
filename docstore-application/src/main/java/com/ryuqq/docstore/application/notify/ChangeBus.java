package com.ryuqq.docstore.application.notify;

import com.ryuqq.docstore.core.event.ChangeListener;
import com.ryuqq.docstore.core.event.Subscription;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 프로세스 내 컬렉션 변경 이벤트 multicast.
 *
 * <p><strong>아키텍처:</strong></p>
 * <ul>
 *   <li><strong>Listeners:</strong> ConcurrentHashMap&lt;CollectionName, CopyOnWriteArrayList&gt; - 컬렉션별 목록</li>
 *   <li><strong>Delivery:</strong> 동기, 발행 스레드에서 구독 순서대로</li>
 * </ul>
 *
 * <p><strong>예외 정책:</strong> 리스너가 던진 {@link Exception}(checked 포함)은 경고 로그만 남기고
 * 다음 리스너로 계속 전달하며 발행자에게 전파되지 않습니다.
 * {@link Error}({@code OutOfMemoryError}, {@code AssertionError} 등)는 잡지 않고 발행자에게 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Subscription subscription = bus.subscribe(CollectionName.of("orders"),
 *     (collection, records) -&gt; refreshOrderTable(records));
 * ...
 * subscription.unsubscribe();
 * </pre>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class ChangeBus {

    private static final Logger log = LoggerFactory.getLogger(ChangeBus.class);

    private final ConcurrentHashMap<CollectionName, CopyOnWriteArrayList<Registration>> listeners =
        new ConcurrentHashMap<>();

    /**
     * 컬렉션 하나에 리스너 등록.
     *
     * @param collection 구독할 컬렉션
     * @param listener   콜백
     * @return 구독 해제 핸들
     * @throws IllegalArgumentException collection 또는 listener가 null인 경우
     */
    public Subscription subscribe(CollectionName collection, ChangeListener listener) {
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        CopyOnWriteArrayList<Registration> registrations =
            listeners.computeIfAbsent(collection, key -> new CopyOnWriteArrayList<>());
        Registration registration = new Registration(registrations, listener);
        registrations.add(registration);
        return registration;
    }

    /**
     * 컬렉션의 모든 리스너에게 현재 레코드 전달.
     *
     * @param collection 변경된 컬렉션
     * @param records    현재 view
     */
    public void publish(CollectionName collection, List<Document> records) {
        CopyOnWriteArrayList<Registration> registrations = listeners.get(collection);
        if (registrations == null || registrations.isEmpty()) {
            return;
        }
        List<Document> view = List.copyOf(records);
        for (Registration registration : registrations) {
            try {
                registration.listener.onChange(collection, view);
            } catch (Exception e) {
                log.warn("Change listener failed for collection {}", collection, e);
            }
        }
    }

    public int subscriberCount(CollectionName collection) {
        CopyOnWriteArrayList<Registration> registrations = listeners.get(collection);
        return registrations == null ? 0 : registrations.size();
    }

    private static final class Registration implements Subscription {

        private final CopyOnWriteArrayList<Registration> owner;
        private final ChangeListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(CopyOnWriteArrayList<Registration> owner, ChangeListener listener) {
            this.owner = owner;
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                owner.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
