package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Register Patient Command
 * 환자 등록/수정 커맨드 (연락처는 검증하지 않음)
 */
public record RegisterPatientCommand(
        String name,
        String nationalId,
        String phone,
        String email
) {
    public RegisterPatientCommand {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Name cannot be null or blank");
        }
        if (nationalId == null || nationalId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "National ID cannot be null or blank");
        }
    }
}
