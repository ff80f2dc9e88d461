package personal.clinic.scheduling.adapter.out.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.clinic.scheduling.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LruSnapshotCacheAdapter 단위 테스트")
class LruSnapshotCacheAdapterTest {

    private LruTtlCache<Object> cache;
    private LruSnapshotCacheAdapter adapter;

    @BeforeEach
    void setUp() {
        cache = new LruTtlCache<>(10, Duration.ofSeconds(60), new MutableClock(Instant.parse("2025-11-25T09:00:00Z")));
        adapter = new LruSnapshotCacheAdapter(cache);
    }

    @Test
    @DisplayName("미스일 때만 loader를 호출하고 결과를 적재한다")
    void getOrLoad_LoadsOnceOnMiss() {
        // given
        AtomicInteger loads = new AtomicInteger();

        // when
        List<String> first = adapter.getOrLoad("patients:all", () -> {
            loads.incrementAndGet();
            return List.of("P1");
        });
        List<String> second = adapter.getOrLoad("patients:all", () -> {
            loads.incrementAndGet();
            return List.of("P2");
        });

        // then
        assertThat(first).containsExactly("P1");
        assertThat(second).containsExactly("P1");
        assertThat(loads).hasValue(1);
        assertThat(adapter.stats().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("loader가 null을 반환하면 적재하지 않는다")
    void getOrLoad_NullIsNotCached() {
        String result = adapter.getOrLoad("patients:P404", () -> null);

        assertThat(result).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("로딩 중 무효화가 발생하면 읽어 온 스냅샷을 적재하지 않는다")
    void getOrLoad_InvalidatedDuringLoad_IsNotCached() {
        // when: 로딩 도중 쓰기 경로가 무효화를 수행
        List<String> loaded = adapter.getOrLoad("appointments:all", () -> {
            adapter.invalidate("appointments");
            return List.of("stale");
        });

        // then: 호출자는 결과를 받지만 캐시에는 남지 않는다
        assertThat(loaded).containsExactly("stale");
        assertThat(cache.size()).isZero();
        assertThat(adapter.getOrLoad("appointments:all", () -> List.of("fresh"))).containsExactly("fresh");
    }

    @Test
    @DisplayName("evict는 단건 키만 제거한다")
    void evict_RemovesSingleKey() {
        adapter.getOrLoad("providers:all", () -> List.of("M1"));
        adapter.getOrLoad("providers:M1", () -> "M1");

        assertThat(adapter.evict("providers:M1")).isTrue();
        assertThat(adapter.evict("providers:M1")).isFalse();
        assertThat(cache.size()).isEqualTo(1);
    }
}
