package personal.clinic.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.scheduling.adapter.in.web.dto.PatientRequest;
import personal.clinic.scheduling.adapter.in.web.dto.PatientResponse;
import personal.clinic.scheduling.application.port.in.ManagePatientUseCase;

import java.util.List;

/**
 * Patient API Controller
 * 환자 등록/조회/수정/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/patients")
@RequiredArgsConstructor
public class PatientController {

    private final ManagePatientUseCase managePatientUseCase;

    @PostMapping
    public ResponseEntity<ApiResponse<PatientResponse>> register(@Valid @RequestBody PatientRequest request) {
        log.info("Register patient: name={}", request.name());
        return OutcomeResponses.created(
                managePatientUseCase.register(request.toCommand()),
                "Patient registered",
                PatientResponse::from);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PatientResponse>>> list() {
        List<PatientResponse> response = managePatientUseCase.listPatients().stream()
                .map(PatientResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Patients found", response));
    }

    @GetMapping("/{patientId}")
    public ResponseEntity<ApiResponse<PatientResponse>> get(@PathVariable String patientId) {
        return OutcomeResponses.ok(
                managePatientUseCase.getPatient(patientId),
                "Patient found",
                PatientResponse::from);
    }

    @PutMapping("/{patientId}")
    public ResponseEntity<ApiResponse<PatientResponse>> update(
            @PathVariable String patientId,
            @Valid @RequestBody PatientRequest request
    ) {
        log.info("Update patient: patientId={}", patientId);
        return OutcomeResponses.ok(
                managePatientUseCase.update(patientId, request.toCommand()),
                "Patient updated",
                PatientResponse::from);
    }

    @DeleteMapping("/{patientId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String patientId) {
        log.info("Delete patient: patientId={}", patientId);
        return OutcomeResponses.noContent(managePatientUseCase.delete(patientId), "Patient deleted");
    }
}
