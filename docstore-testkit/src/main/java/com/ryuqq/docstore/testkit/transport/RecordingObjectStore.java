package com.ryuqq.docstore.testkit.transport;

import com.ryuqq.docstore.core.exception.ConflictException;
import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.spi.FetchResult;
import com.ryuqq.docstore.core.spi.ObjectStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동시성 테스트용 {@link ObjectStore} 계측 Decorator.
 *
 * <p>모든 호출을 시작/종료 시각({@link System#nanoTime()})과 결과와 함께 기록합니다.
 * 테스트는 PUT 횟수와 같은 경로의 PUT이 겹쳤는지 검증할 수 있습니다.</p>
 *
 * <p><strong>설정:</strong></p>
 * <ul>
 *   <li>{@link #setPutLatency(Duration)}: PUT마다 지연을 넣어 겹침 구간을 넓힘</li>
 *   <li>{@link #setPutInterceptor(PutInterceptor)}: PUT이 delegate에 닿기 전에 실행
 *       (예: 경쟁 작성자가 먼저 리비전을 올리게 함)</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public class RecordingObjectStore implements ObjectStore {

    /**
     * 기록된 호출 종류.
     */
    public enum Kind {
        GET,
        PUT
    }

    /**
     * 기록된 호출 결과.
     */
    public enum Result {
        OK,
        NOT_MODIFIED,
        NOT_FOUND,
        CONFLICT,
        ERROR
    }

    /**
     * 기록된 호출 하나.
     *
     * @param kind        GET 또는 PUT
     * @param path        객체 경로
     * @param sha         PUT이 보낸 리비전, 또는 GET이 보낸 ETag
     * @param startNanos  호출이 이 Decorator에 들어온 시각
     * @param endNanos    호출이 반환되거나 예외를 던진 시각
     * @param result      결과
     */
    public record Call(Kind kind, String path, String sha, long startNanos, long endNanos, Result result) {

        public boolean overlaps(Call other) {
            return startNanos < other.endNanos && other.startNanos < endNanos;
        }
    }

    /**
     * PUT 전달 직전에 호출되는 Hook.
     */
    @FunctionalInterface
    public interface PutInterceptor {

        /**
         * @param path    객체 경로
         * @param sha     PUT이 지정한 리비전
         * @param attempt 이 경로에 대한 PUT 순번 (1부터, 이번 호출 포함)
         */
        void beforePut(String path, String sha, int attempt);
    }

    private final ObjectStore delegate;
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> putsInFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> putAttempts = new ConcurrentHashMap<>();
    private final AtomicInteger maxConcurrentPuts = new AtomicInteger();
    private volatile Duration putLatency = Duration.ZERO;
    private volatile PutInterceptor putInterceptor;

    public RecordingObjectStore(ObjectStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public FetchResult get(String path, String ifNoneMatch) {
        long start = System.nanoTime();
        Result result = Result.ERROR;
        try {
            FetchResult fetched = delegate.get(path, ifNoneMatch);
            result = fetched.isNotModified() ? Result.NOT_MODIFIED : Result.OK;
            return fetched;
        } catch (NotFoundException e) {
            result = Result.NOT_FOUND;
            throw e;
        } finally {
            calls.add(new Call(Kind.GET, path, ifNoneMatch, start, System.nanoTime(), result));
        }
    }

    @Override
    public String put(String path, String content, String sha, String message) {
        long start = System.nanoTime();
        AtomicInteger inFlight = putsInFlight.computeIfAbsent(path, key -> new AtomicInteger());
        maxConcurrentPuts.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        Result result = Result.ERROR;
        try {
            int attempt = putAttempts.computeIfAbsent(path, key -> new AtomicInteger()).incrementAndGet();
            PutInterceptor interceptor = putInterceptor;
            if (interceptor != null) {
                interceptor.beforePut(path, sha, attempt);
            }
            pause();
            String newSha = delegate.put(path, content, sha, message);
            result = Result.OK;
            return newSha;
        } catch (ConflictException e) {
            result = Result.CONFLICT;
            throw e;
        } finally {
            inFlight.decrementAndGet();
            calls.add(new Call(Kind.PUT, path, sha, start, System.nanoTime(), result));
        }
    }

    private void pause() {
        Duration latency = putLatency;
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during simulated latency", e);
        }
    }

    // ========================================
    // Knobs
    // ========================================

    public void setPutLatency(Duration putLatency) {
        this.putLatency = putLatency == null ? Duration.ZERO : putLatency;
    }

    public void setPutInterceptor(PutInterceptor putInterceptor) {
        this.putInterceptor = putInterceptor;
    }

    /**
     * 감싼 원본 저장소. 이 프로세스를 거치지 않는 작성자를 흉내낼 때 사용.
     *
     * @return 원본 저장소
     */
    public ObjectStore delegate() {
        return delegate;
    }

    // ========================================
    // Queries
    // ========================================

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> puts(String path) {
        List<Call> puts = new ArrayList<>();
        for (Call call : calls) {
            if (call.kind() == Kind.PUT && call.path().equals(path)) {
                puts.add(call);
            }
        }
        return puts;
    }

    public int putCount() {
        return count(Kind.PUT, null);
    }

    public int putCount(String path) {
        return puts(path).size();
    }

    public int getCount() {
        return count(Kind.GET, null);
    }

    public int conflictCount() {
        return count(Kind.PUT, Result.CONFLICT);
    }

    public int totalCalls() {
        return calls.size();
    }

    /**
     * 한 경로에 동시에 진행 중이던 PUT의 최대 개수.
     *
     * @return 직렬화되었으면 1, PUT이 없었으면 0
     */
    public int maxConcurrentPuts() {
        return maxConcurrentPuts.get();
    }

    /**
     * 같은 경로의 PUT 두 개가 시간상 겹쳤는지 기록으로 검사.
     *
     * @param path 객체 경로
     * @return 겹친 쌍이 있으면 true
     */
    public boolean hasOverlappingPuts(String path) {
        List<Call> puts = puts(path);
        for (int i = 0; i < puts.size(); i++) {
            for (int j = i + 1; j < puts.size(); j++) {
                if (puts.get(i).overlaps(puts.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 기록과 카운터 초기화. 설정은 유지.
     */
    public void reset() {
        calls.clear();
        putAttempts.clear();
        maxConcurrentPuts.set(0);
    }

    private int count(Kind kind, Result result) {
        int count = 0;
        for (Call call : calls) {
            if (call.kind() == kind && (result == null || call.result() == result)) {
                count++;
            }
        }
        return count;
    }
}
