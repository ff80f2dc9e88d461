package personal.clinic.scheduling.application.port.out;

/**
 * 캐시 통계
 *
 * @param size         현재 항목 수
 * @param maxSize      최대 항목 수
 * @param hits         적중 횟수
 * @param misses       미스 횟수 (만료 포함)
 * @param evictions    LRU 축출 횟수
 * @param hitRate      적중률 (%)
 * @param usagePercent 사용률 (%)
 */
public record CacheStats(
        int size,
        int maxSize,
        long hits,
        long misses,
        long evictions,
        double hitRate,
        double usagePercent) {
}
