package personal.clinic.scheduling.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;
import personal.clinic.scheduling.application.port.in.ManageCacheUseCase;
import personal.clinic.scheduling.config.SchedulingProperties;

import java.time.Duration;

/**
 * Cache Cleanup Scheduler
 * 조회되지 않는 만료 항목이 용량을 차지하지 않도록 주기적으로 제거
 * 주기: scheduling.cache.cleanup-interval-ms (첫 실행도 한 주기 뒤)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheCleanupScheduler implements SchedulingConfigurer {

    private final ManageCacheUseCase manageCacheUseCase;
    private final SchedulingProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = Duration.ofMillis(properties.cache().cleanupIntervalMs());
        registrar.addFixedDelayTask(new FixedDelayTask(this::removeExpiredEntries, interval, interval));
        log.info("Cache cleanup scheduled: intervalMs={}", interval.toMillis());
    }

    public void removeExpiredEntries() {
        int removed = manageCacheUseCase.cleanupExpiredEntries();
        if (removed > 0) {
            log.info("Expired cache entries cleaned up: removed={}", removed);
        }
    }
}
