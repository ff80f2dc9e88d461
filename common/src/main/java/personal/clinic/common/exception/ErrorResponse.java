package personal.clinic.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param result  항상 "error"
 * @param code    에러 코드 (예: B003)
 * @param message 사용자에게 노출할 메시지
 */
public record ErrorResponse(
        String result,
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message);
    }
}
