package personal.clinic.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.scheduling.adapter.in.web.dto.AppointmentResponse;
import personal.clinic.scheduling.adapter.in.web.dto.BookAppointmentRequest;
import personal.clinic.scheduling.adapter.in.web.dto.ChangeStatusRequest;
import personal.clinic.scheduling.adapter.in.web.dto.RescheduleRequest;
import personal.clinic.scheduling.application.port.in.BookAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.ChangeAppointmentStatusUseCase;
import personal.clinic.scheduling.application.port.in.GetAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.RescheduleAppointmentUseCase;
import personal.clinic.scheduling.domain.model.Appointment;

import java.time.LocalDate;
import java.util.List;

/**
 * Appointment API Controller
 * 진료 예약 생성/조회/일정 변경/상태 변경 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final BookAppointmentUseCase bookAppointmentUseCase;
    private final RescheduleAppointmentUseCase rescheduleAppointmentUseCase;
    private final ChangeAppointmentStatusUseCase changeAppointmentStatusUseCase;
    private final GetAppointmentUseCase getAppointmentUseCase;

    /**
     * 진료 예약 생성
     * POST /api/v1/appointments
     */
    @PostMapping
    public ResponseEntity<ApiResponse<AppointmentResponse>> book(@Valid @RequestBody BookAppointmentRequest request) {
        log.info("Book appointment: patientId={}, providerId={}, date={}, slot={}",
                request.patientId(), request.providerId(), request.date(), request.slot());

        return OutcomeResponses.created(
                bookAppointmentUseCase.book(request.toCommand()),
                "Appointment booked",
                AppointmentResponse::from);
    }

    /**
     * 예약 목록 조회
     * GET /api/v1/appointments?patientId= | ?providerId=[&date=]
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<AppointmentResponse>>> list(
            @RequestParam(required = false) String patientId,
            @RequestParam(required = false) String providerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        List<Appointment> appointments;
        if (patientId != null) {
            appointments = getAppointmentUseCase.listByPatient(patientId);
        } else if (providerId != null && date != null) {
            appointments = getAppointmentUseCase.listByProviderAndDate(providerId, date);
        } else if (providerId != null) {
            appointments = getAppointmentUseCase.listByProvider(providerId);
        } else {
            appointments = getAppointmentUseCase.listAppointments();
        }

        List<AppointmentResponse> response = appointments.stream()
                .map(AppointmentResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Appointments found", response));
    }

    /**
     * 예약 조회
     * GET /api/v1/appointments/{appointmentId}
     */
    @GetMapping("/{appointmentId}")
    public ResponseEntity<ApiResponse<AppointmentResponse>> get(@PathVariable String appointmentId) {
        return OutcomeResponses.ok(
                getAppointmentUseCase.getAppointment(appointmentId),
                "Appointment found",
                AppointmentResponse::from);
    }

    /**
     * 일정 변경
     * PATCH /api/v1/appointments/{appointmentId}/schedule
     */
    @PatchMapping("/{appointmentId}/schedule")
    public ResponseEntity<ApiResponse<AppointmentResponse>> reschedule(
            @PathVariable String appointmentId,
            @Valid @RequestBody RescheduleRequest request
    ) {
        log.info("Reschedule appointment: appointmentId={}, date={}, slot={}",
                appointmentId, request.date(), request.slot());

        return OutcomeResponses.ok(
                rescheduleAppointmentUseCase.reschedule(request.toCommand(appointmentId)),
                "Appointment rescheduled",
                AppointmentResponse::from);
    }

    /**
     * 상태 변경
     * PATCH /api/v1/appointments/{appointmentId}/status
     */
    @PatchMapping("/{appointmentId}/status")
    public ResponseEntity<ApiResponse<AppointmentResponse>> changeStatus(
            @PathVariable String appointmentId,
            @Valid @RequestBody ChangeStatusRequest request
    ) {
        log.info("Change appointment status: appointmentId={}, status={}", appointmentId, request.status());

        return OutcomeResponses.ok(
                changeAppointmentStatusUseCase.changeStatus(appointmentId, request.toStatus()),
                "Appointment status changed",
                AppointmentResponse::from);
    }

    @PostMapping("/{appointmentId}/cancel")
    public ResponseEntity<ApiResponse<AppointmentResponse>> cancel(@PathVariable String appointmentId) {
        log.info("Cancel appointment: appointmentId={}", appointmentId);
        return OutcomeResponses.ok(
                changeAppointmentStatusUseCase.cancel(appointmentId),
                "Appointment cancelled",
                AppointmentResponse::from);
    }

    @PostMapping("/{appointmentId}/confirm")
    public ResponseEntity<ApiResponse<AppointmentResponse>> confirm(@PathVariable String appointmentId) {
        log.info("Confirm appointment: appointmentId={}", appointmentId);
        return OutcomeResponses.ok(
                changeAppointmentStatusUseCase.confirm(appointmentId),
                "Appointment confirmed",
                AppointmentResponse::from);
    }

    @PostMapping("/{appointmentId}/complete")
    public ResponseEntity<ApiResponse<AppointmentResponse>> complete(@PathVariable String appointmentId) {
        log.info("Complete appointment: appointmentId={}", appointmentId);
        return OutcomeResponses.ok(
                changeAppointmentStatusUseCase.complete(appointmentId),
                "Appointment completed",
                AppointmentResponse::from);
    }
}
