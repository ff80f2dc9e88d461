package personal.clinic.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.scheduling.application.port.out.BookingLockPort;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Global Booking Lock Adapter
 * 프로세스 전체에서 하나의 이진 세마포어로 예약 임계 구역을 직렬화한다.
 *
 * 사용 환경:
 * - 기본값 (단일 노드)
 *
 * 주의: 재진입 불가. 임계 구역 안에서 다시 획득하면 교착 상태가 된다.
 */
@Slf4j
public class GlobalBookingLockAdapter implements BookingLockPort {

    private final Semaphore mutex = new Semaphore(1);

    @Override
    public <T> T withinBookingSection(String providerId, Supplier<T> action) {
        mutex.acquireUninterruptibly();
        try {
            log.debug("[GlobalLock] Acquired: providerId={}", providerId);
            return action.get();
        } finally {
            mutex.release();
        }
    }

    @Override
    public String getStrategyName() {
        return "global";
    }
}
