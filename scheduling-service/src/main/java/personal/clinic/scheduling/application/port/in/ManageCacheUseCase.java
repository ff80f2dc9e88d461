package personal.clinic.scheduling.application.port.in;

import personal.clinic.scheduling.application.port.out.CacheStats;

/**
 * Manage Cache UseCase (Input Port)
 */
public interface ManageCacheUseCase {

    CacheStats getCacheStats();

    void clearCache();

    /**
     * 만료 항목 정리
     *
     * @return 제거된 항목 수
     */
    int cleanupExpiredEntries();
}
