package personal.clinic.scheduling.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.scheduling.application.port.out.CacheStats;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU + TTL Cache
 * 용량 제한(LRU 축출)과 항목별 만료 시간(TTL)을 가진 인메모리 캐시
 *
 * <p>구조: 인덱스로 참조하는 노드 배열 위의 이중 연결 리스트 + key → 인덱스 맵.
 * head가 가장 최근 사용(MRU), tail이 가장 오래된 항목(LRU)이다.
 * 빈 노드는 free-list로 재사용한다. 전체를 하나의 락으로 보호한다.</p>
 *
 * <p>만료: 저장 후 경과 시간이 TTL을 초과하면 만료. 축출은 TTL과 무관하게 리스트 위치로만 결정한다.</p>
 *
 * @param <V> 값 타입
 */
@Slf4j
public class LruTtlCache<V> {

    public static final int DEFAULT_MAX_SIZE = 100;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private static final int NIL = -1;

    private final int maxSize;
    private final long ttlMillis;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // node arena
    private final String[] keys;
    private final Object[] values;
    private final long[] storedAt;
    private final int[] prev;
    private final int[] next;

    private final Map<String, Integer> index = new HashMap<>();
    private int head = NIL;
    private int tail = NIL;
    private int freeHead;

    private long hits;
    private long misses;
    private long evictions;
    private long invalidationEpoch;

    public LruTtlCache(int maxSize, Duration ttl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        this.maxSize = maxSize;
        this.ttlMillis = ttl.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.keys = new String[maxSize];
        this.values = new Object[maxSize];
        this.storedAt = new long[maxSize];
        this.prev = new int[maxSize];
        this.next = new int[maxSize];
        resetArena();
    }

    public LruTtlCache(Clock clock) {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL, clock);
    }

    /**
     * 조회 (적중 시 MRU로 이동, 만료 항목은 제거 후 미스 처리)
     */
    @SuppressWarnings("unchecked")
    public Optional<V> get(String key) {
        lock.lock();
        try {
            Integer node = index.get(key);
            if (node == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(node)) {
                removeNode(node);
                misses++;
                log.debug("Cache entry expired: key={}", key);
                return Optional.empty();
            }
            moveToHead(node);
            hits++;
            return Optional.of((V) values[node]);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 저장 (기존 키는 값/시각 갱신 후 MRU로 이동, 가득 찼으면 LRU 항목 하나 축출)
     */
    public void set(String key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 지정한 무효화 세대 이후 무효화가 없었을 때만 저장
     *
     * @return 저장 여부
     */
    public boolean setIfNotInvalidatedSince(String key, V value, long epoch) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (invalidationEpoch != epoch) {
                log.debug("Skipping cache population, invalidated during load: key={}", key);
                return false;
            }
            put(key, value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            invalidationEpoch++;
            Integer node = index.get(key);
            if (node == null) {
                return false;
            }
            removeNode(node);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전체 비우기 (통계는 유지)
     */
    public void clear() {
        lock.lock();
        try {
            invalidationEpoch++;
            int cleared = index.size();
            index.clear();
            resetArena();
            log.info("Cache cleared: entries={}", cleared);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키에 pattern 문자열이 포함된 항목 모두 제거
     *
     * @return 제거된 항목 수
     */
    public int invalidateBySubstring(String pattern) {
        lock.lock();
        try {
            invalidationEpoch++;
            List<Integer> matched = new ArrayList<>();
            for (Map.Entry<String, Integer> entry : index.entrySet()) {
                if (entry.getKey().contains(pattern)) {
                    matched.add(entry.getValue());
                }
            }
            matched.forEach(this::removeNode);
            if (!matched.isEmpty()) {
                log.debug("Cache invalidated: pattern={}, removed={}", pattern, matched.size());
            }
            return matched.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료 항목 일괄 제거
     *
     * @return 제거된 항목 수
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            int removed = 0;
            int node = tail;
            while (node != NIL) {
                int older = prev[node];
                if (isExpired(node)) {
                    removeNode(node);
                    removed++;
                }
                node = older;
            }
            if (removed > 0) {
                log.debug("Expired cache entries removed: count={}", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 무효화 세대 (delete/invalidate/clear 마다 증가)
     */
    public long invalidationEpoch() {
        lock.lock();
        try {
            return invalidationEpoch;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long requests = hits + misses;
            double hitRate = requests == 0 ? 0.0 : round(hits * 100.0 / requests);
            double usage = round(index.size() * 100.0 / maxSize);
            return new CacheStats(index.size(), maxSize, hits, misses, evictions, hitRate, usage);
        } finally {
            lock.unlock();
        }
    }

    /**
     * MRU → LRU 순서의 키 목록 (통계/순서에 영향 없음)
     */
    List<String> keysByRecency() {
        lock.lock();
        try {
            List<String> ordered = new ArrayList<>(index.size());
            for (int node = head; node != NIL; node = next[node]) {
                ordered.add(keys[node]);
            }
            return ordered;
        } finally {
            lock.unlock();
        }
    }

    private void put(String key, V value) {
        long now = clock.millis();
        Integer existing = index.get(key);
        if (existing != null) {
            values[existing] = value;
            storedAt[existing] = now;
            moveToHead(existing);
            return;
        }
        if (index.size() >= maxSize) {
            evictTail();
        }
        int node = allocate();
        keys[node] = key;
        values[node] = value;
        storedAt[node] = now;
        linkAtHead(node);
        index.put(key, node);
    }

    private boolean isExpired(int node) {
        return clock.millis() - storedAt[node] > ttlMillis;
    }

    private void evictTail() {
        int victim = tail;
        log.debug("Cache entry evicted: key={}", keys[victim]);
        removeNode(victim);
        evictions++;
    }

    private int allocate() {
        int node = freeHead;
        freeHead = next[node];
        return node;
    }

    private void removeNode(int node) {
        index.remove(keys[node]);
        unlink(node);
        keys[node] = null;
        values[node] = null;
        next[node] = freeHead;
        prev[node] = NIL;
        freeHead = node;
    }

    private void moveToHead(int node) {
        if (node == head) {
            return;
        }
        unlink(node);
        linkAtHead(node);
    }

    private void linkAtHead(int node) {
        prev[node] = NIL;
        next[node] = head;
        if (head != NIL) {
            prev[head] = node;
        }
        head = node;
        if (tail == NIL) {
            tail = node;
        }
    }

    private void unlink(int node) {
        int before = prev[node];
        int after = next[node];
        if (before != NIL) {
            next[before] = after;
        } else {
            head = after;
        }
        if (after != NIL) {
            prev[after] = before;
        } else {
            tail = before;
        }
    }

    private void resetArena() {
        for (int i = 0; i < maxSize; i++) {
            keys[i] = null;
            values[i] = null;
            prev[i] = NIL;
            next[i] = i + 1 < maxSize ? i + 1 : NIL;
        }
        head = NIL;
        tail = NIL;
        freeHead = 0;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
