package com.pharbit.ledger.core.model;

import com.pharbit.ledger.core.statemachine.ProposalPhase;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 거버넌스 제안.
 *
 * <p><strong>단계:</strong></p>
 * <ul>
 *   <li>OPEN: now &lt; deadline, 투표 가능</li>
 *   <li>CLOSED_PENDING_EXECUTION: deadline ≤ now, 실행 대기</li>
 *   <li>EXECUTED: 실행 완료, passed 값 고정</li>
 * </ul>
 *
 * <p>passed는 실행 시점에 한 번만 계산되며 이후 다시 평가되지 않습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record GovernanceProposal(
    ProposalId id,
    String description,
    Identity proposer,
    Instant createdAt,
    Instant deadline,
    int yesVotes,
    int noVotes,
    Set<Identity> voters,
    boolean executed,
    boolean passed,
    ProposalAction action
) {

    public GovernanceProposal {
        if (id == null || proposer == null || createdAt == null || deadline == null) {
            throw new IllegalArgumentException("GovernanceProposal fields cannot be null (id: " + id + ")");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (yesVotes < 0 || noVotes < 0) {
            throw new IllegalArgumentException(
                "vote counts cannot be negative (yes: " + yesVotes + ", no: " + noVotes + ")"
            );
        }
        if (!executed && passed) {
            throw new IllegalArgumentException("passed can only be set on an executed proposal (id: " + id + ")");
        }
        voters = voters == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(voters));
        action = action == null ? ProposalAction.none() : action;
    }

    public static GovernanceProposal open(ProposalId id, String description, Identity proposer,
                                          Instant createdAt, Instant deadline, ProposalAction action) {
        return new GovernanceProposal(id, description, proposer, createdAt, deadline,
            0, 0, Set.of(), false, false, action);
    }

    public ProposalPhase phaseAt(Instant now) {
        if (executed) {
            return ProposalPhase.EXECUTED;
        }
        return now.isBefore(deadline) ? ProposalPhase.OPEN : ProposalPhase.CLOSED_PENDING_EXECUTION;
    }

    public boolean hasVoted(Identity owner) {
        return voters.contains(owner);
    }

    public GovernanceProposal withVote(Identity owner, boolean support) {
        Set<Identity> next = new LinkedHashSet<>(voters);
        next.add(owner);
        return new GovernanceProposal(id, description, proposer, createdAt, deadline,
            support ? yesVotes + 1 : yesVotes,
            support ? noVotes : noVotes + 1,
            next, false, false, action);
    }

    public GovernanceProposal executedWith(boolean outcome) {
        return new GovernanceProposal(id, description, proposer, createdAt, deadline,
            yesVotes, noVotes, voters, true, outcome, action);
    }
}
