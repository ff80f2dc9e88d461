package personal.clinic.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Patient Domain (2xxx)
    PATIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "환자를 찾을 수 없습니다."),
    DUPLICATE_NATIONAL_ID(HttpStatus.CONFLICT, "U002", "이미 등록된 주민번호입니다."),
    PATIENT_HAS_ACTIVE_APPOINTMENTS(HttpStatus.CONFLICT, "U003", "진행 중인 예약이 있는 환자는 삭제할 수 없습니다."),

    // Provider Domain (3xxx)
    PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "D001", "의사를 찾을 수 없습니다."),
    DUPLICATE_LICENSE_CODE(HttpStatus.CONFLICT, "D002", "이미 등록된 면허번호입니다."),

    // Appointment Domain (4xxx)
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    SLOT_UNAVAILABLE(HttpStatus.BAD_REQUEST, "B002", "해당 의사의 진료 가능 시간이 아닙니다."),
    SLOT_ALREADY_BOOKED(HttpStatus.CONFLICT, "B003", "이미 예약된 시간대입니다."),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "B004", "허용되지 않는 예약 상태입니다."),

    // Storage (6xxx)
    PERSISTENCE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "S001", "작업을 처리하지 못했습니다. 잠시 후 다시 시도해주세요."),
    BACKUP_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S002", "백업 생성에 실패했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
