package personal.clinic.scheduling.adapter.out.persistence;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 컬렉션별 락 테이블
 * 락은 처음 요청될 때 생성되며, 테이블 자체는 짧게 점유하는 별도 락으로 보호한다.
 * 같은 컬렉션에 대해 동시에 처음 요청해도 항상 동일한 락이 반환된다.
 */
class CollectionLockTable {

    private final Map<String, ReentrantLock> locks = new HashMap<>();
    private final ReentrantLock tableLock = new ReentrantLock();

    /**
     * 컬렉션 락 조회 (없으면 생성)
     * 재진입 가능: append/update/delete가 load-수정-save 전체 구간 동안 점유한다.
     */
    ReentrantLock lockFor(String collection) {
        tableLock.lock();
        try {
            return locks.computeIfAbsent(collection, name -> new ReentrantLock());
        } finally {
            tableLock.unlock();
        }
    }
}
