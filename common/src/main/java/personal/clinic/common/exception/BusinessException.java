package personal.clinic.common.exception;

import lombok.Getter;

/**
 * 입력 검증 실패 예외
 * 웹 경계(Command 생성 시점)에서만 사용하며, 비즈니스 결과는 Outcome으로 반환한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}
