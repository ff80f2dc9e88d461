package personal.clinic.scheduling.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.RegisterPatientCommand;
import personal.clinic.scheduling.application.port.out.PatientRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;
import personal.clinic.scheduling.domain.model.Patient;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("PatientService 단위 테스트")
class PatientServiceTest {

    @Mock
    private PatientRepository patientRepository;
    @Mock
    private SnapshotLookupService lookups;
    @Mock
    private SnapshotCache cache;
    @Spy
    private PatientDeletionGuard deletionGuard = new PatientDeletionGuard();

    @InjectMocks
    private PatientService patientService;

    private final Patient kim = new Patient("P1", "Kim", "900101-1234567", "010-1111-2222", null, LocalDateTime.now());

    @Nested
    @DisplayName("환자 등록")
    class Register {

        @Test
        @DisplayName("등록 성공 - 저장 후 환자 캐시를 무효화한다")
        void register_Success() {
            // given
            given(lookups.patients()).willReturn(List.of(kim));
            given(patientRepository.save(any(Patient.class)))
                    .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

            // when
            Outcome<Patient> outcome = patientService.register(
                    new RegisterPatientCommand("Lee", "850505-2345678", null, "lee@example.com"));

            // then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.value()).map(Patient::id).hasValueSatisfying(id -> assertThat(id).startsWith("P"));
            then(cache).should().invalidate(CacheKeys.PATIENTS);
        }

        @Test
        @DisplayName("등록 실패 - 주민번호 중복")
        void register_DuplicateNationalId() {
            // given
            given(lookups.patients()).willReturn(List.of(kim));

            // when
            Outcome<Patient> outcome = patientService.register(
                    new RegisterPatientCommand("Other", kim.nationalId(), null, null));

            // then
            assertThat(outcome.errorCode()).contains(ErrorCode.DUPLICATE_NATIONAL_ID);
            then(patientRepository).should(never()).save(any());
        }
    }

    @Nested
    @DisplayName("환자 수정")
    class Update {

        @Test
        @DisplayName("자기 자신의 주민번호는 중복으로 보지 않는다")
        void update_SameNationalId() {
            // given
            given(lookups.patient("P1")).willReturn(Optional.of(kim));
            given(lookups.patients()).willReturn(List.of(kim));
            given(patientRepository.update(any(Patient.class)))
                    .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

            // when
            Outcome<Patient> outcome = patientService.update("P1",
                    new RegisterPatientCommand("Kim Minsu", kim.nationalId(), "010-9999-8888", null));

            // then
            assertThat(outcome.value()).map(Patient::name).contains("Kim Minsu");
            assertThat(outcome.value()).map(Patient::registeredAt).contains(kim.registeredAt());
        }

        @Test
        @DisplayName("존재하지 않는 환자")
        void update_NotFound() {
            given(lookups.patient("P404")).willReturn(Optional.empty());

            Outcome<Patient> outcome = patientService.update("P404",
                    new RegisterPatientCommand("Nobody", "000000-0000000", null, null));

            assertThat(outcome.errorCode()).contains(ErrorCode.PATIENT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("환자 삭제")
    class Delete {

        @Test
        @DisplayName("진행 중인 예약이 있으면 삭제할 수 없다")
        void delete_WithActiveAppointments() {
            // given
            Appointment active = Appointment.book("P1", "M1", LocalDate.of(2025, 11, 25), "09:00", "");
            given(lookups.patient("P1")).willReturn(Optional.of(kim));
            given(lookups.appointments()).willReturn(List.of(active));

            // when
            Outcome<Void> outcome = patientService.delete("P1");

            // then
            assertThat(outcome.errorCode()).contains(ErrorCode.PATIENT_HAS_ACTIVE_APPOINTMENTS);
            then(patientRepository).should(never()).delete(any());
        }

        @Test
        @DisplayName("완료/취소된 예약만 있으면 삭제할 수 있다")
        void delete_WithFinishedAppointments() {
            // given
            LocalDate date = LocalDate.of(2025, 11, 25);
            Appointment completed = Appointment.book("P1", "M1", date, "09:00", "")
                    .changeStatus(AppointmentStatus.COMPLETED);
            Appointment cancelled = Appointment.book("P1", "M1", date, "10:00", "")
                    .changeStatus(AppointmentStatus.CANCELLED);
            given(lookups.patient("P1")).willReturn(Optional.of(kim));
            given(lookups.appointments()).willReturn(List.of(completed, cancelled));
            given(patientRepository.delete("P1")).willReturn(Outcome.done());

            // when
            Outcome<Void> outcome = patientService.delete("P1");

            // then
            assertThat(outcome.isSuccess()).isTrue();
            then(cache).should().invalidate(CacheKeys.PATIENTS);
            then(deletionGuard).should().exclusively(any());
        }
    }
}
