package personal.clinic.scheduling.adapter.in.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;

import java.util.function.Function;

/**
 * Outcome → HTTP 응답 변환
 * <ul>
 *   <li>Success: successStatus + result=success</li>
 *   <li>Rejected: ErrorCode의 HTTP 상태 + 거절 사유 그대로</li>
 *   <li>Failed: 500 + 일반 메시지 (상세 원인은 로그로만)</li>
 * </ul>
 */
@Slf4j
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static <T, R> ResponseEntity<ApiResponse<R>> toResponse(Outcome<T> outcome,
                                                            HttpStatus successStatus,
                                                            String successMessage,
                                                            Function<? super T, ? extends R> mapper) {
        if (outcome instanceof Outcome.Success<T> success) {
            R body = success.value() == null ? null : mapper.apply(success.value());
            return ResponseEntity.status(successStatus).body(ApiResponse.success(successMessage, body));
        }
        if (outcome instanceof Outcome.Rejected<T> rejected) {
            ErrorCode errorCode = rejected.errorCode();
            return ResponseEntity.status(errorCode.getHttpStatus()).body(ApiResponse.error(rejected.reason()));
        }
        Outcome.Failed<T> failed = (Outcome.Failed<T>) outcome;
        log.error("Request failed: reason={}", failed.reason(), failed.cause());
        return ResponseEntity.status(ErrorCode.PERSISTENCE_FAILURE.getHttpStatus())
                .body(ApiResponse.error(ErrorCode.PERSISTENCE_FAILURE.getMessage()));
    }

    static <T, R> ResponseEntity<ApiResponse<R>> ok(Outcome<T> outcome,
                                                    String successMessage,
                                                    Function<? super T, ? extends R> mapper) {
        return toResponse(outcome, HttpStatus.OK, successMessage, mapper);
    }

    static <T, R> ResponseEntity<ApiResponse<R>> created(Outcome<T> outcome,
                                                         String successMessage,
                                                         Function<? super T, ? extends R> mapper) {
        return toResponse(outcome, HttpStatus.CREATED, successMessage, mapper);
    }

    static ResponseEntity<ApiResponse<Void>> noContent(Outcome<Void> outcome, String successMessage) {
        return toResponse(outcome, HttpStatus.OK, successMessage, ignored -> null);
    }
}
