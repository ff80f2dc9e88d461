package personal.clinic.scheduling.application.port.out;

import java.util.function.Supplier;

/**
 * 예약 임계 구역 Port
 * 충돌 검사부터 저장까지를 하나의 임계 구역으로 실행한다.
 *
 * 구현체:
 * - GlobalBookingLockAdapter: 프로세스 전체 단일 락 (기본값)
 * - ProviderShardedBookingLockAdapter: 의사별 락
 */
public interface BookingLockPort {

    /**
     * 임계 구역 안에서 action 실행 (타임아웃 없이 대기)
     * 재진입 불가: action 안에서 다시 호출하면 안 된다.
     *
     * @param providerId 대상 의사 ID
     */
    <T> T withinBookingSection(String providerId, Supplier<T> action);

    /**
     * 전략 이름 (로깅용)
     */
    String getStrategyName();
}
