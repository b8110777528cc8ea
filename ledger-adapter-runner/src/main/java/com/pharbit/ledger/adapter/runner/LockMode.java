package com.pharbit.ledger.adapter.runner;

/**
 * 엔티티 잠금 모드.
 *
 * <p>판정에만 읽는 엔티티는 SHARED, 변경하는 엔티티는 EXCLUSIVE로 잡습니다.
 * 한 명령 안에서 같은 스트라이프에 두 모드가 겹치면 EXCLUSIVE가 우선합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
enum LockMode {

    SHARED,

    EXCLUSIVE;

    LockMode merge(LockMode other) {
        return this == EXCLUSIVE || other == EXCLUSIVE ? EXCLUSIVE : SHARED;
    }
}
