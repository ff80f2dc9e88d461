package personal.clinic.scheduling.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Appointment Status Enum
 * 예약 상태 (상태 간 전이는 제한하지 않는다)
 */
public enum AppointmentStatus {
    /**
     * 예약됨 (생성 직후)
     */
    SCHEDULED("scheduled"),

    /**
     * 환자 확인 완료
     */
    CONFIRMED("confirmed"),

    /**
     * 진료 완료
     */
    COMPLETED("completed"),

    /**
     * 취소 (시간대 점유 해제)
     */
    CANCELLED("cancelled");

    private final String value;

    AppointmentStatus(String value) {
        this.value = value;
    }

    /**
     * 저장 포맷 (소문자)
     */
    public String value() {
        return value;
    }

    /**
     * 저장 포맷 또는 enum 이름으로부터 변환 (대소문자 무시)
     */
    public static Optional<AppointmentStatus> from(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim();
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(normalized)
                        || status.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
