package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.outcome.LedgerInvariantViolation;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;
import com.pharbit.ledger.core.statemachine.BatchStatus;
import com.pharbit.ledger.core.statemachine.BatchTransition;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 커밋 직전 구조적 불변식 검사.
 *
 * <p>리듀서가 올바르다면 항상 통과해야 합니다. 위반은 명령 하나의 실패가 아니라
 * 이전 버그의 징후이므로 {@link LedgerInvariantViolation}을 던집니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ul>
 *   <li>신규 배치는 PRODUCED 상태로만 생성</li>
 *   <li>배치의 생성 정보(생산자, 수량, 날짜 등)는 불변</li>
 *   <li>배치 상태 변화는 상태 그래프(폐기 간선 포함) 위에 있음</li>
 *   <li>보관자 이전 기록의 이전 보관자 = 저장된 보관자</li>
 *   <li>Owner 1명 이상, 1 ≤ quorum ≤ |owners|</li>
 *   <li>실행된 제안은 다시 바뀌지 않음, 투표 수 = 투표자 수</li>
 *   <li>GOVERNANCE_OWNER 역할은 Owner 집합과 일치</li>
 *   <li>측정값/감사/규정 준수 기록 순번은 간격 없이 증가</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class LedgerInvariants {

    private LedgerInvariants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 변경 목록을 현재 상태에 적용했을 때 불변식이 유지되는지 검사.
     *
     * @param before 커밋 전 상태
     * @param changes 커밋할 변경
     * @throws LedgerInvariantViolation 위반 시
     */
    public static void check(LedgerView before, List<StateChange> changes) {
        GovernanceState governanceAfter = before.governance();
        for (StateChange change : changes) {
            if (change instanceof StateChange.PutGovernance put) {
                governanceAfter = put.state();
            }
        }

        Map<BatchId, Integer> pendingReadings = new HashMap<>();
        for (StateChange change : changes) {
            if (change instanceof StateChange.PutBatch put) {
                checkBatch(before, put.batch());
            } else if (change instanceof StateChange.AppendTransfer append) {
                checkTransfer(before, append.transfer());
            } else if (change instanceof StateChange.PutGovernance put) {
                checkGovernance(before.governance(), put.state());
            } else if (change instanceof StateChange.PutProposal put) {
                checkProposal(before, put.proposal(), governanceAfter);
            } else if (change instanceof StateChange.PutRoles put) {
                checkOwnerRole(put.identity(), put.roles(), governanceAfter);
            } else if (change instanceof StateChange.PutStakeholder put) {
                checkStakeholder(before, put.record());
            } else if (change instanceof StateChange.AppendReading append) {
                TelemetryReading reading = append.reading();
                int pending = pendingReadings.merge(reading.batchId(), 1, Integer::sum) - 1;
                int expected = before.readings(reading.batchId()).size() + pending;
                require(reading.index() == expected, "telemetry.index",
                    "reading index " + reading.index() + " != expected " + expected);
            } else if (change instanceof StateChange.AppendAuditEntry append) {
                AuditEntry entry = append.entry();
                int expected = before.auditEntries(entry.batchId()).size() + 1;
                require(entry.sequence() == expected, "audit.sequence",
                    "audit sequence " + entry.sequence() + " != expected " + expected);
            } else if (change instanceof StateChange.PutComplianceRecord put) {
                checkComplianceRecord(before, put.record());
            }
        }
    }

    private static void checkBatch(LedgerView before, Batch next) {
        Optional<Batch> prior = before.batch(next.id());
        if (prior.isEmpty()) {
            require(next.status() == BatchStatus.PRODUCED, "batch.initial-status",
                "new batch " + next.id().getValue() + " created in " + next.status());
            return;
        }
        Batch stored = prior.get();
        require(stored.sameOrigin(next), "batch.origin",
            "immutable fields changed for batch " + next.id().getValue());
        require(BatchTransition.isStructurallyValid(stored.status(), next.status()), "batch.status-graph",
            "stored transition " + stored.status() + " → " + next.status() + " for batch " + next.id().getValue());
    }

    private static void checkTransfer(LedgerView before, CustodyTransfer transfer) {
        Optional<Batch> stored = before.batch(transfer.batchId());
        require(stored.isPresent(), "custody.batch", "transfer for unknown batch " + transfer.batchId().getValue());
        require(stored.get().custodian().equals(transfer.from()), "custody.from",
            "transfer source " + transfer.from().getValue() + " is not the stored custodian");
    }

    private static void checkGovernance(GovernanceState before, GovernanceState next) {
        require(!next.owners().isEmpty(), "governance.owners", "owner set is empty");
        require(next.quorum() >= 1 && next.quorum() <= next.owners().size(), "governance.quorum",
            "quorum " + next.quorum() + " outside 1.." + next.owners().size());
        require(next.proposalCount() >= before.proposalCount(), "governance.proposal-count",
            "proposal counter decreased to " + next.proposalCount());
    }

    private static void checkProposal(LedgerView before, GovernanceProposal next, GovernanceState governanceAfter) {
        require(next.yesVotes() + next.noVotes() == next.voters().size(), "proposal.tally",
            "tally does not match voters for proposal " + next.id().getValue());
        Optional<GovernanceProposal> prior = before.proposal(next.id());
        if (prior.isEmpty()) {
            require(next.id().getValue() <= governanceAfter.proposalCount(), "proposal.id",
                "proposal id " + next.id().getValue() + " beyond counter " + governanceAfter.proposalCount());
            return;
        }
        require(!prior.get().executed(), "proposal.executed",
            "executed proposal " + next.id().getValue() + " modified");
    }

    private static void checkOwnerRole(Identity identity, Set<Role> roles, GovernanceState governanceAfter) {
        require(roles.contains(Role.GOVERNANCE_OWNER) == governanceAfter.isOwner(identity), "governance.owner-role",
            "GOVERNANCE_OWNER role out of sync for " + identity.getValue());
    }

    private static void checkStakeholder(LedgerView before, StakeholderRecord next) {
        before.stakeholder(next.identity()).ifPresent(stored -> require(
            stored.role() == next.role() && stored.registeredAt().equals(next.registeredAt()),
            "stakeholder.origin", "registration fields changed for " + next.identity().getValue()));
    }

    private static void checkComplianceRecord(LedgerView before, ComplianceRecord next) {
        List<ComplianceRecord> stored = before.complianceRecords(next.batchId());
        boolean exists = stored.stream().anyMatch(r -> r.id().equals(next.id()));
        if (!exists) {
            require(next.id().sequence() == stored.size() + 1, "compliance.sequence",
                "compliance sequence " + next.id().sequence() + " != expected " + (stored.size() + 1));
        }
    }

    private static void require(boolean condition, String invariant, String message) {
        if (!condition) {
            throw new LedgerInvariantViolation(invariant, message);
        }
    }
}
