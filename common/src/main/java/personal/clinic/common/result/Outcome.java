package personal.clinic.common.result;

import personal.clinic.common.exception.ErrorCode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 작업 결과 (Success | Rejected | Failed)
 * 예상 가능한 비즈니스 결과(미존재, 충돌 등)는 예외 대신 값으로 반환한다.
 * <ul>
 *   <li>{@link Success}: 성공, 결과 엔티티 포함</li>
 *   <li>{@link Rejected}: 비즈니스 규칙에 의한 거절, 사유를 그대로 사용자에게 노출</li>
 *   <li>{@link Failed}: 저장소 I/O 실패, 상세 원인은 운영자용 로그로만 남긴다</li>
 * </ul>
 *
 * @param <T> 성공 시 결과 타입
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Rejected, Outcome.Failed {

    record Success<T>(T value) implements Outcome<T> {
    }

    record Rejected<T>(ErrorCode errorCode, String reason) implements Outcome<T> {
        public Rejected {
            Objects.requireNonNull(errorCode, "errorCode");
        }
    }

    record Failed<T>(String reason, Throwable cause) implements Outcome<T> {
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 반환값이 없는 작업의 성공
     */
    static Outcome<Void> done() {
        return new Success<>(null);
    }

    static <T> Outcome<T> rejected(ErrorCode errorCode, String reason) {
        return new Rejected<>(errorCode, reason);
    }

    static <T> Outcome<T> failed(String reason, Throwable cause) {
        return new Failed<>(reason, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 성공 결과값 (Success가 아니거나 값이 null이면 empty)
     */
    default Optional<T> value() {
        if (this instanceof Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        return Optional.empty();
    }

    /**
     * 거절 코드 (Rejected가 아니면 empty)
     */
    default Optional<ErrorCode> errorCode() {
        if (this instanceof Rejected<T> rejected) {
            return Optional.of(rejected.errorCode());
        }
        return Optional.empty();
    }

    /**
     * 사용자에게 노출할 메시지
     */
    default String message() {
        if (this instanceof Rejected<T> rejected) {
            return rejected.reason();
        }
        if (this instanceof Failed<T> failed) {
            return failed.reason();
        }
        return "OK";
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return propagate();
    }

    default <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return propagate();
    }

    /**
     * Rejected/Failed를 다른 결과 타입으로 그대로 전달
     *
     * @throws IllegalStateException Success에서 호출한 경우
     */
    default <R> Outcome<R> propagate() {
        if (this instanceof Rejected<T> rejected) {
            return new Rejected<>(rejected.errorCode(), rejected.reason());
        }
        if (this instanceof Failed<T> failed) {
            return new Failed<>(failed.reason(), failed.cause());
        }
        throw new IllegalStateException("Cannot propagate a successful outcome");
    }
}
