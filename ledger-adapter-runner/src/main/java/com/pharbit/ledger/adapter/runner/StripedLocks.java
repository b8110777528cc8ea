package com.pharbit.ledger.adapter.runner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 고정 개수의 읽기/쓰기 잠금 스트라이프.
 *
 * <p>엔티티 키는 해시로 스트라이프에 대응됩니다. 여러 키를 잡을 때는 스트라이프 번호 오름차순으로만
 * 획득하므로 교착 상태가 생기지 않습니다. 같은 스트라이프에 대응되는 키는 한 번만, 가장 강한 모드로
 * 잡습니다 (읽기 잠금에서 쓰기 잠금으로의 승격은 지원되지 않음).</p>
 *
 * <p>SHARED 키끼리는 동시에 잡을 수 있습니다. 서로 다른 키가 같은 스트라이프에 대응되면 불필요하게
 * 직렬화될 수 있지만 정확성에는 영향이 없습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
final class StripedLocks {

    private final ReentrantReadWriteLock[] stripes;

    StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive (current: " + stripeCount + ")");
        }
        this.stripes = new ReentrantReadWriteLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
    }

    /**
     * 키에 해당하는 스트라이프를 모두 잡은 상태로 작업 실행.
     *
     * @param keys 엔티티 잠금 키와 모드
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> T withLocks(Map<String, LockMode> keys, Supplier<T> action) {
        TreeMap<Integer, LockMode> indexes = new TreeMap<>();
        keys.forEach((key, mode) -> indexes.merge(stripeOf(key), mode, LockMode::merge));

        List<Lock> acquired = new ArrayList<>(indexes.size());
        try {
            for (Map.Entry<Integer, LockMode> entry : indexes.entrySet()) {
                ReentrantReadWriteLock stripe = stripes[entry.getKey()];
                Lock lock = entry.getValue() == LockMode.EXCLUSIVE ? stripe.writeLock() : stripe.readLock();
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    int stripeCount() {
        return stripes.length;
    }
}
