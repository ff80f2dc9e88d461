package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.clinic.scheduling.application.port.in.GetStatisticsUseCase;
import personal.clinic.scheduling.application.port.in.ManageCacheUseCase;
import personal.clinic.scheduling.application.port.in.SchedulingStatistics;
import personal.clinic.scheduling.application.port.out.CacheStats;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scheduling Statistics Service
 * 엔티티 건수, 상태별 예약 건수, 캐시 통계
 */
@Service
@RequiredArgsConstructor
public class SchedulingStatisticsService implements GetStatisticsUseCase, ManageCacheUseCase {

    private final SnapshotLookupService lookups;
    private final SnapshotCache cache;

    @Override
    public SchedulingStatistics getStatistics() {
        List<Appointment> appointments = lookups.appointments();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (AppointmentStatus status : AppointmentStatus.values()) {
            byStatus.put(status.value(), 0L);
        }
        for (Appointment appointment : appointments) {
            byStatus.merge(appointment.status().value(), 1L, Long::sum);
        }
        return new SchedulingStatistics(
                lookups.patients().size(),
                lookups.providers().size(),
                appointments.size(),
                byStatus,
                cache.stats());
    }

    @Override
    public CacheStats getCacheStats() {
        return cache.stats();
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    @Override
    public int cleanupExpiredEntries() {
        return cache.cleanupExpired();
    }
}
