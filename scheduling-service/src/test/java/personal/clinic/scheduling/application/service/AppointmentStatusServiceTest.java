package personal.clinic.scheduling.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.adapter.out.lock.GlobalBookingLockAdapter;
import personal.clinic.scheduling.application.port.out.AppointmentRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;
import personal.clinic.scheduling.domain.service.SlotConflictDetector;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentStatusService 단위 테스트")
class AppointmentStatusServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 11, 25);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-20T01:30:00Z"), ZoneOffset.UTC);

    @Mock
    private SnapshotLookupService lookups;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private SnapshotCache cache;

    private AppointmentStatusService statusService;

    @BeforeEach
    void setUp() {
        statusService = new AppointmentStatusService(
                new GlobalBookingLockAdapter(), lookups, appointmentRepository, cache, new SlotConflictDetector(),
                new PatientDeletionGuard(), CLOCK);
    }

    @Test
    @DisplayName("취소 - CANCELLED로 저장하고 예약 캐시를 무효화한다")
    void cancel_Success() {
        // given
        Appointment appointment = Appointment.book("P1", "M1", DATE, "09:00", "");
        given(lookups.appointment(appointment.id())).willReturn(Optional.of(appointment));
        given(appointmentRepository.update(any(Appointment.class)))
                .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

        // when
        Outcome<Appointment> outcome = statusService.cancel(appointment.id());

        // then
        assertThat(outcome.value()).map(Appointment::status).contains(AppointmentStatus.CANCELLED);
        ArgumentCaptor<Appointment> captor = ArgumentCaptor.forClass(Appointment.class);
        then(appointmentRepository).should().update(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo(appointment.id());
        assertThat(captor.getValue().updatedAt()).isEqualTo(LocalDateTime.now(CLOCK));
        assertThat(captor.getValue().createdAt()).isEqualTo(appointment.createdAt());
        then(cache).should().invalidate(CacheKeys.APPOINTMENTS);
    }

    @Test
    @DisplayName("상태 전이는 제한하지 않는다 - COMPLETED에서 SCHEDULED로 되돌릴 수 있다")
    void changeStatus_AnyTransitionAllowed() {
        // given
        Appointment completed = Appointment.book("P1", "M1", DATE, "09:00", "")
                .changeStatus(AppointmentStatus.COMPLETED);
        given(lookups.appointment(completed.id())).willReturn(Optional.of(completed));
        given(appointmentRepository.update(any(Appointment.class)))
                .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

        // when
        Outcome<Appointment> outcome = statusService.changeStatus(completed.id(), AppointmentStatus.SCHEDULED);

        // then
        assertThat(outcome.value()).map(Appointment::status).contains(AppointmentStatus.SCHEDULED);
    }

    @Test
    @DisplayName("취소된 예약을 되살릴 때 시간대가 이미 재예약되었으면 거절한다")
    void restoreCancelled_SlotTaken() {
        // given
        Appointment cancelled = Appointment.book("P1", "M1", DATE, "09:00", "")
                .changeStatus(AppointmentStatus.CANCELLED);
        Appointment rebooked = Appointment.book("P2", "M1", DATE, "09:00", "");
        given(lookups.appointment(cancelled.id())).willReturn(Optional.of(cancelled));
        given(lookups.appointments()).willReturn(List.of(cancelled, rebooked));

        // when
        Outcome<Appointment> outcome = statusService.confirm(cancelled.id());

        // then
        assertThat(outcome.errorCode()).contains(ErrorCode.SLOT_ALREADY_BOOKED);
        assertThat(outcome.message()).isEqualTo("slot already booked");
        then(appointmentRepository).should(never()).update(any());
    }

    @Test
    @DisplayName("취소된 예약을 되살릴 때 시간대가 비어 있으면 허용한다")
    void restoreCancelled_SlotFree() {
        // given
        Appointment cancelled = Appointment.book("P1", "M1", DATE, "09:00", "")
                .changeStatus(AppointmentStatus.CANCELLED);
        given(lookups.appointment(cancelled.id())).willReturn(Optional.of(cancelled));
        given(lookups.appointments()).willReturn(List.of(cancelled));
        given(appointmentRepository.update(any(Appointment.class)))
                .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

        // when
        Outcome<Appointment> outcome = statusService.confirm(cancelled.id());

        // then
        assertThat(outcome.value()).map(Appointment::status).contains(AppointmentStatus.CONFIRMED);
    }

    @Test
    @DisplayName("존재하지 않는 예약")
    void changeStatus_NotFound() {
        given(lookups.appointment("C404")).willReturn(Optional.empty());

        Outcome<Appointment> outcome = statusService.complete("C404");

        assertThat(outcome.errorCode()).contains(ErrorCode.APPOINTMENT_NOT_FOUND);
        then(appointmentRepository).shouldHaveNoInteractions();
    }
}
