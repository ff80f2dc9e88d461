package personal.clinic.scheduling.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.scheduling.application.port.in.SchedulingStatistics;
import personal.clinic.scheduling.application.port.out.CacheStats;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulingStatisticsService 단위 테스트")
class SchedulingStatisticsServiceTest {

    @Mock
    private SnapshotLookupService lookups;
    @Mock
    private SnapshotCache cache;

    @InjectMocks
    private SchedulingStatisticsService statisticsService;

    @Test
    @DisplayName("상태별 건수는 모든 상태를 포함하고 예약이 없는 상태는 0이다")
    void statistics_CountsByStatus() {
        // given
        LocalDate date = LocalDate.of(2025, 11, 25);
        Appointment scheduled = Appointment.book("P1", "M1", date, "09:00", "");
        Appointment cancelled = Appointment.book("P2", "M1", date, "10:00", "")
                .changeStatus(AppointmentStatus.CANCELLED);
        Appointment another = Appointment.book("P3", "M1", date, "11:00", "");
        CacheStats cacheStats = new CacheStats(3, 100, 5, 3, 0, 62.5, 3.0);
        given(lookups.appointments()).willReturn(List.of(scheduled, cancelled, another));
        given(lookups.patients()).willReturn(List.of());
        given(lookups.providers()).willReturn(List.of());
        given(cache.stats()).willReturn(cacheStats);

        // when
        SchedulingStatistics statistics = statisticsService.getStatistics();

        // then
        assertThat(statistics.totalAppointments()).isEqualTo(3);
        assertThat(statistics.appointmentsByStatus())
                .containsExactly(
                        entry("scheduled", 2L),
                        entry("confirmed", 0L),
                        entry("completed", 0L),
                        entry("cancelled", 1L));
        assertThat(statistics.cache()).isEqualTo(cacheStats);
    }

    @Test
    @DisplayName("만료 항목 정리는 캐시에 위임한다")
    void cleanupExpiredEntries_DelegatesToCache() {
        given(cache.cleanupExpired()).willReturn(4);

        assertThat(statisticsService.cleanupExpiredEntries()).isEqualTo(4);
    }
}
