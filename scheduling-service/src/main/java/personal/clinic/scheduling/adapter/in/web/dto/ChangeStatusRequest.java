package personal.clinic.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

/**
 * 예약 상태 변경 요청 DTO
 *
 * @param status scheduled | confirmed | completed | cancelled
 */
public record ChangeStatusRequest(
        @NotBlank(message = "상태는 필수입니다.")
        String status
) {
    public AppointmentStatus toStatus() {
        return AppointmentStatus.from(status)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_STATUS, "Unknown status: " + status));
    }
}
