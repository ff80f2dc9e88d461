package personal.clinic.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Patient Domain Model
 * 환자 도메인 모델 (불변)
 * 연락처 정보는 검증하지 않으며, 주민번호(nationalId)는 환자 컬렉션 내에서 유일하다.
 */
public record Patient(
        String id,
        String name,
        String nationalId,
        String phone,
        String email,
        LocalDateTime registeredAt) {

    public Patient {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient ID cannot be null or blank");
        }
        if (nationalId == null || nationalId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "National ID cannot be null or blank");
        }
        if (registeredAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Registration time cannot be null");
        }
    }

    /**
     * 신규 환자 등록 (정적 팩토리 메서드)
     */
    public static Patient register(String name, String nationalId, String phone, String email) {
        return new Patient(
                EntityIds.next(EntityIds.PATIENT_PREFIX),
                name,
                nationalId,
                phone,
                email,
                LocalDateTime.now());
    }

    /**
     * 인적 사항 변경 (ID, 등록 시각 유지)
     */
    public Patient withDetails(String name, String nationalId, String phone, String email) {
        return new Patient(id, name, nationalId, phone, email, registeredAt);
    }
}
