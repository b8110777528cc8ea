package com.pharbit.ledger.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

/**
 * 배치 상태 전이 규칙.
 *
 * <p>이 클래스는 배치 상태 그래프를 정의하고, 상태 변경이 허용된 간선을 따르는지 검증합니다.
 * 그래프에는 역방향 간선이 없습니다.</p>
 *
 * <p><strong>상태 변경 명령으로 허용되는 전이:</strong></p>
 * <ul>
 *   <li>PRODUCED → IN_TRANSIT</li>
 *   <li>IN_TRANSIT → AT_DISTRIBUTOR</li>
 *   <li>AT_DISTRIBUTOR → AT_PHARMACY</li>
 *   <li>AT_PHARMACY → DISPENSED</li>
 *   <li>비종료 상태 → RECALLED, EXPIRED</li>
 * </ul>
 *
 * <p><strong>폐기 전이:</strong> RECALLED → DESTROYED, EXPIRED → DESTROYED.
 * 폐기 명령에서만 사용하며, 상태 변경 명령으로는 도달할 수 없습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class BatchTransition {

    private BatchTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 상태에서 상태 변경 명령으로 도달 가능한 상태 집합.
     *
     * @param from 현재 상태
     * @return 허용 대상 상태 (종료 상태이면 빈 집합)
     */
    public static Set<BatchStatus> allowedTargets(BatchStatus from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (from.isTerminal()) {
            return EnumSet.noneOf(BatchStatus.class);
        }
        EnumSet<BatchStatus> targets = EnumSet.of(BatchStatus.RECALLED, BatchStatus.EXPIRED);
        switch (from) {
            case PRODUCED -> targets.add(BatchStatus.IN_TRANSIT);
            case IN_TRANSIT -> targets.add(BatchStatus.AT_DISTRIBUTOR);
            case AT_DISTRIBUTOR -> targets.add(BatchStatus.AT_PHARMACY);
            case AT_PHARMACY -> targets.add(BatchStatus.DISPENSED);
            default -> {
                // 종료 상태는 위에서 처리됨
            }
        }
        return targets;
    }

    /**
     * 상태 변경 명령으로 허용되는 간선인지 확인.
     */
    public static boolean isAllowed(BatchStatus from, BatchStatus to) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        return allowedTargets(from).contains(to);
    }

    /**
     * 폐기 명령이 허용되는 상태인지 확인.
     *
     * @param from 현재 상태
     * @return RECALLED 또는 EXPIRED이면 true
     */
    public static boolean isDisposable(BatchStatus from) {
        return from == BatchStatus.RECALLED || from == BatchStatus.EXPIRED;
    }

    /**
     * 저장된 두 상태 사이의 변화가 그래프(폐기 간선 포함) 위에 있는지 확인.
     *
     * <p>동일 상태 유지도 허용됩니다 (보관자만 바뀐 경우).</p>
     */
    public static boolean isStructurallyValid(BatchStatus from, BatchStatus to) {
        if (from == to) {
            return true;
        }
        if (to == BatchStatus.DESTROYED) {
            return isDisposable(from);
        }
        return isAllowed(from, to);
    }
}
