package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.List;

/**
 * Register Provider Command
 * 의사 등록/수정 커맨드
 *
 * @param availableSlots 진료 가능 시간대, 수정 시 null이면 기존 시간대 유지
 */
public record RegisterProviderCommand(
        String name,
        String licenseCode,
        String specialty,
        List<String> availableSlots
) {
    public RegisterProviderCommand {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Name cannot be null or blank");
        }
        if (licenseCode == null || licenseCode.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "License code cannot be null or blank");
        }
    }
}
