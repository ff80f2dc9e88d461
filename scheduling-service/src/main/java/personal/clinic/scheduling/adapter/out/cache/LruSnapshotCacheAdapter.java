package personal.clinic.scheduling.adapter.out.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.scheduling.application.port.out.CacheStats;
import personal.clinic.scheduling.application.port.out.SnapshotCache;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * LRU Snapshot Cache Adapter
 * LruTtlCache 기반 read-through 캐시 구현체
 *
 * 로딩 시작 시점의 무효화 세대를 기억해 두고, 로딩 중 쓰기 무효화가 끼어들었으면
 * 결과를 캐시에 넣지 않는다 (쓰기 이전 스냅샷 재적재 방지).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LruSnapshotCacheAdapter implements SnapshotCache {

    private final LruTtlCache<Object> cache;

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, Supplier<T> loader) {
        Optional<Object> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: key={}", key);
            return (T) cached.get();
        }

        log.debug("Cache miss: key={}", key);
        long epoch = cache.invalidationEpoch();
        T loaded = loader.get();
        if (loaded != null) {
            cache.setIfNotInvalidatedSince(key, loaded, epoch);
        }
        return loaded;
    }

    @Override
    public int invalidate(String pattern) {
        return cache.invalidateBySubstring(pattern);
    }

    @Override
    public boolean evict(String key) {
        return cache.delete(key);
    }

    @Override
    public void clear() {
        cache.clear();
    }

    @Override
    public int cleanupExpired() {
        return cache.cleanupExpired();
    }

    @Override
    public CacheStats stats() {
        return cache.stats();
    }
}
