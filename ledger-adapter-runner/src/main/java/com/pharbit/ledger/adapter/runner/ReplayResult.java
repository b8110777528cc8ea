package com.pharbit.ledger.adapter.runner;

import java.util.List;

/**
 * 이벤트 재적용 결과.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 * @param replayed 재적용을 시도한 이벤트 수
 * @param divergences 원본과 다르게 적용된 이벤트 설명 (순서 유지)
 */
public record ReplayResult(
    int replayed,
    List<String> divergences
) {

    public ReplayResult {
        if (replayed < 0) {
            throw new IllegalArgumentException("replayed must not be negative (current: " + replayed + ")");
        }
        divergences = divergences == null ? List.of() : List.copyOf(divergences);
    }

    /**
     * 모든 이벤트가 원본과 같은 결과를 냈는지 확인.
     */
    public boolean isDeterministic() {
        return divergences.isEmpty();
    }
}
