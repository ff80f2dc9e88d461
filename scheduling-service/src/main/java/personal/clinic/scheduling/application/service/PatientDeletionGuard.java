package personal.clinic.scheduling.application.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Patient Deletion Guard
 * 환자 삭제와 환자를 참조하는 예약 생성을 직렬화한다.
 *
 * - 예약 생성/재활성화: 읽기 락 (의사별 예약 구역끼리는 동시에 진행)
 * - 환자 삭제: 쓰기 락 (진행 중인 예약이 끝난 뒤 활성 예약을 검사)
 *
 * 락 순서: 예약 임계 구역 → 읽기 락. 삭제는 예약 임계 구역을 잡지 않는다.
 */
@Component
public class PatientDeletionGuard {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public <T> T whileReferencing(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T exclusively(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
