package com.pharbit.ledger.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Owner 집합, 정족수, 제안 카운터.
 *
 * <p>Owner 집합은 추가 순서를 유지합니다.
 * Owner 제거 시 정족수가 새 Owner 수를 넘으면 Owner 수로 내려갑니다.</p>
 *
 * @param owners 다중 서명 주체 집합
 * @param quorum 통과에 필요한 최소 찬성 수
 * @param proposalCount 지금까지 생성된 제안 수
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record GovernanceState(
    Set<Identity> owners,
    int quorum,
    long proposalCount
) {

    public GovernanceState {
        if (owners == null) {
            throw new IllegalArgumentException("owners cannot be null");
        }
        if (quorum < 0 || quorum > owners.size()) {
            throw new IllegalArgumentException(
                "quorum must be within 0.." + owners.size() + " (current: " + quorum + ")"
            );
        }
        if (proposalCount < 0) {
            throw new IllegalArgumentException("proposalCount cannot be negative (current: " + proposalCount + ")");
        }
        owners = Collections.unmodifiableSet(new LinkedHashSet<>(owners));
    }

    /**
     * Owner가 없는 초기 상태.
     */
    public static GovernanceState empty() {
        return new GovernanceState(Set.of(), 0, 0);
    }

    public boolean isOwner(Identity identity) {
        return owners.contains(identity);
    }

    public GovernanceState withOwner(Identity owner) {
        Set<Identity> next = new LinkedHashSet<>(owners);
        next.add(owner);
        return new GovernanceState(next, quorum, proposalCount);
    }

    public GovernanceState withoutOwner(Identity owner) {
        Set<Identity> next = new LinkedHashSet<>(owners);
        next.remove(owner);
        return new GovernanceState(next, Math.min(quorum, next.size()), proposalCount);
    }

    public GovernanceState withQuorum(int quorum) {
        return new GovernanceState(owners, quorum, proposalCount);
    }

    public ProposalId nextProposalId() {
        return ProposalId.of(proposalCount + 1);
    }

    public GovernanceState withProposalCreated() {
        return new GovernanceState(owners, quorum, proposalCount + 1);
    }
}
