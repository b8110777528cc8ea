package com.pharbit.ledger.application.query;

import com.pharbit.ledger.core.model.ApprovalId;
import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.ComplianceRecordId;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.RegulatoryApproval;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.StatusChange;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.outcome.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 읽기 전용 투영 (query surface).
 *
 * <p>모든 조회는 부수 효과가 없고 배타적 잠금을 잡지 않으며, 커밋 단위로 일관된 스냅샷을 봅니다.
 * 조회 실패가 의미 있는 경우(등록되지 않은 Stakeholder, 없는 배치 등)에는 {@link Outcome}으로 반환합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface LedgerQueries {

    // ========== Access Registry ==========

    boolean hasRole(Identity identity, Role role);

    boolean hasAnyRole(Identity identity, Role... roles);

    Set<Role> rolesOf(Identity identity);

    // ========== Stakeholder Directory ==========

    /**
     * Stakeholder 조회.
     *
     * @return 기록, 없으면 NOT_REGISTERED 실패 (기본 기록을 만들지 않음)
     */
    Outcome<StakeholderRecord> getStakeholder(Identity identity);

    List<StakeholderRecord> listStakeholders();

    // ========== Batch Ledger ==========

    Outcome<Batch> getBatch(BatchId batchId);

    List<Batch> listBatches();

    List<CustodyTransfer> getTransferHistory(BatchId batchId);

    List<StatusChange> getStatusHistory(BatchId batchId);

    // ========== Telemetry Validator ==========

    /**
     * 배치에 적용되는 유효 범위 (배치별 → 레저 기본 → 정책 기본).
     */
    TelemetryBounds telemetryBounds(BatchId batchId);

    Outcome<TelemetryReading> latestReading(BatchId batchId);

    Outcome<List<TelemetryReading>> telemetryHistory(BatchId batchId);

    /**
     * @param index 0부터 시작하는 삽입 순번
     * @return 측정값, 범위 밖이면 OUT_OF_BOUNDS
     */
    Outcome<TelemetryReading> readingAt(BatchId batchId, int index);

    // ========== Compliance & Audit ==========

    Outcome<ComplianceRecord> getComplianceRecord(ComplianceRecordId recordId);

    List<ComplianceRecord> complianceRecords(BatchId batchId);

    Outcome<List<AuditEntry>> getAuditTrail(BatchId batchId);

    boolean isBatchCompliant(BatchId batchId);

    /**
     * @param now 기준 시각 (승인 유효 기간 판정용)
     */
    boolean isDrugApproved(String drugCode, Instant now);

    Optional<RegulatoryApproval> getApproval(ApprovalId approvalId);

    // ========== Governance ==========

    Outcome<GovernanceProposal> getProposal(ProposalId proposalId);

    Set<Identity> owners();

    int quorum();
}
