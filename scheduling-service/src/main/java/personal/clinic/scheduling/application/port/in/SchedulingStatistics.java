package personal.clinic.scheduling.application.port.in;

import personal.clinic.scheduling.application.port.out.CacheStats;

import java.util.Map;

/**
 * 운영 통계
 *
 * @param appointmentsByStatus 상태(소문자) → 건수
 */
public record SchedulingStatistics(
        int totalPatients,
        int totalProviders,
        int totalAppointments,
        Map<String, Long> appointmentsByStatus,
        CacheStats cache) {
}
