package personal.clinic.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.scheduling.adapter.in.web.dto.ProviderRequest;
import personal.clinic.scheduling.adapter.in.web.dto.ProviderResponse;
import personal.clinic.scheduling.application.port.in.GetAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.ManageProviderUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Provider API Controller
 * 의사 등록/조회/수정/삭제 및 진료 시간대 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ManageProviderUseCase manageProviderUseCase;
    private final GetAppointmentUseCase getAppointmentUseCase;

    @PostMapping
    public ResponseEntity<ApiResponse<ProviderResponse>> register(@Valid @RequestBody ProviderRequest request) {
        log.info("Register provider: name={}, licenseCode={}", request.name(), request.licenseCode());
        return OutcomeResponses.created(
                manageProviderUseCase.register(request.toCommand()),
                "Provider registered",
                ProviderResponse::from);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ProviderResponse>>> list() {
        List<ProviderResponse> response = manageProviderUseCase.listProviders().stream()
                .map(ProviderResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Providers found", response));
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<ApiResponse<ProviderResponse>> get(@PathVariable String providerId) {
        return OutcomeResponses.ok(
                manageProviderUseCase.getProvider(providerId),
                "Provider found",
                ProviderResponse::from);
    }

    @PutMapping("/{providerId}")
    public ResponseEntity<ApiResponse<ProviderResponse>> update(
            @PathVariable String providerId,
            @Valid @RequestBody ProviderRequest request
    ) {
        log.info("Update provider: providerId={}", providerId);
        return OutcomeResponses.ok(
                manageProviderUseCase.update(providerId, request.toCommand()),
                "Provider updated",
                ProviderResponse::from);
    }

    @DeleteMapping("/{providerId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String providerId) {
        log.info("Delete provider: providerId={}", providerId);
        return OutcomeResponses.noContent(manageProviderUseCase.delete(providerId), "Provider deleted");
    }

    /**
     * 진료 시간대 추가
     * POST /api/v1/providers/{providerId}/slots/{slot}
     */
    @PostMapping("/{providerId}/slots/{slot}")
    public ResponseEntity<ApiResponse<ProviderResponse>> addSlot(
            @PathVariable String providerId,
            @PathVariable String slot
    ) {
        log.info("Add provider slot: providerId={}, slot={}", providerId, slot);
        return OutcomeResponses.ok(
                manageProviderUseCase.addSlot(providerId, slot),
                "Slot added",
                ProviderResponse::from);
    }

    @DeleteMapping("/{providerId}/slots/{slot}")
    public ResponseEntity<ApiResponse<ProviderResponse>> removeSlot(
            @PathVariable String providerId,
            @PathVariable String slot
    ) {
        log.info("Remove provider slot: providerId={}, slot={}", providerId, slot);
        return OutcomeResponses.ok(
                manageProviderUseCase.removeSlot(providerId, slot),
                "Slot removed",
                ProviderResponse::from);
    }

    /**
     * 특정 날짜의 빈 시간대 조회
     * GET /api/v1/providers/{providerId}/free-slots?date=2025-11-25
     */
    @GetMapping("/{providerId}/free-slots")
    public ResponseEntity<ApiResponse<List<String>>> freeSlots(
            @PathVariable String providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return OutcomeResponses.ok(
                getAppointmentUseCase.freeSlots(providerId, date),
                "Free slots found",
                slots -> slots);
    }
}
