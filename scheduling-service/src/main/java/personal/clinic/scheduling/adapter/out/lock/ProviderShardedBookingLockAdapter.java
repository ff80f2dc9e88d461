package personal.clinic.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.scheduling.application.port.out.BookingLockPort;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Provider Sharded Booking Lock Adapter
 * 의사 ID별 이진 세마포어로 예약 임계 구역을 분리한다.
 * 충돌 검사는 (의사, 날짜, 시간대) 단위이므로 의사별 직렬화로 충분하다.
 *
 * 주의: 재진입 불가. 세마포어는 의사 수만큼 유지된다.
 */
@Slf4j
public class ProviderShardedBookingLockAdapter implements BookingLockPort {

    private final ConcurrentMap<String, Semaphore> mutexes = new ConcurrentHashMap<>();

    @Override
    public <T> T withinBookingSection(String providerId, Supplier<T> action) {
        Semaphore mutex = mutexes.computeIfAbsent(providerId, id -> new Semaphore(1));
        mutex.acquireUninterruptibly();
        try {
            log.debug("[ProviderLock] Acquired: providerId={}", providerId);
            return action.get();
        } finally {
            mutex.release();
        }
    }

    @Override
    public String getStrategyName() {
        return "provider";
    }

    int shardCount() {
        return mutexes.size();
    }
}
