package personal.clinic.scheduling.application.port.out;

import java.util.function.Supplier;

/**
 * 읽기 캐시 Port (read-through)
 * 캐시에 담기는 값은 불변 스냅샷이어야 한다.
 */
public interface SnapshotCache {

    /**
     * 캐시 조회, 미스 시 loader 결과를 적재 후 반환
     * loader가 null을 반환하면 적재하지 않는다.
     * 로딩 중 무효화가 발생했다면 결과는 반환하되 적재하지 않는다.
     */
    <T> T getOrLoad(String key, Supplier<T> loader);

    /**
     * 키에 pattern이 포함된 항목 모두 제거
     *
     * @return 제거된 항목 수
     */
    int invalidate(String pattern);

    boolean evict(String key);

    void clear();

    /**
     * 만료 항목 일괄 제거
     *
     * @return 제거된 항목 수
     */
    int cleanupExpired();

    CacheStats stats();
}
