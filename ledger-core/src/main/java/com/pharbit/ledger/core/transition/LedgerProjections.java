package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.ComplianceRecordId;
import com.pharbit.ledger.core.model.ComplianceStatus;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.outcome.Outcome;
import com.pharbit.ledger.core.spi.LedgerView;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 읽기 전용 투영 (query surface).
 *
 * <p>모든 메서드는 부수 효과가 없으며, 조회 실패는 예외 대신 {@link Outcome}으로 반환합니다.
 * 등록되지 않은 Stakeholder 조회는 기본값을 만들지 않고 NOT_REGISTERED로 실패합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class LedgerProjections {

    private LedgerProjections() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean hasRole(LedgerView view, Identity identity, Role role) {
        return view.rolesOf(identity).contains(role);
    }

    public static boolean hasAnyRole(LedgerView view, Identity identity, Role... roles) {
        Set<Role> held = view.rolesOf(identity);
        for (Role role : roles) {
            if (held.contains(role)) {
                return true;
            }
        }
        return false;
    }

    public static Outcome<StakeholderRecord> stakeholder(LedgerView view, Identity identity) {
        return view.stakeholder(identity)
            .map(Outcome::ok)
            .orElseGet(() -> Outcome.fail(ErrorKind.NOT_REGISTERED,
                "Stakeholder not registered: " + identity.getValue()));
    }

    public static Outcome<Batch> batch(LedgerView view, BatchId batchId) {
        return view.batch(batchId)
            .map(Outcome::ok)
            .orElseGet(() -> batchNotFound(batchId));
    }

    /**
     * 유효 텔레메트리 범위: 배치별 범위 → 레저 기본 범위 → 정책 기본값.
     */
    public static TelemetryBounds effectiveBounds(LedgerView view, BatchId batchId, LedgerPolicy policy) {
        return view.batchBounds(batchId)
            .or(view::defaultBounds)
            .orElse(policy.defaultBounds());
    }

    public static Outcome<List<TelemetryReading>> telemetryHistory(LedgerView view, BatchId batchId) {
        if (view.batch(batchId).isEmpty()) {
            return batchNotFound(batchId);
        }
        return Outcome.ok(view.readings(batchId));
    }

    public static Outcome<TelemetryReading> latestReading(LedgerView view, BatchId batchId) {
        if (view.batch(batchId).isEmpty()) {
            return batchNotFound(batchId);
        }
        List<TelemetryReading> readings = view.readings(batchId);
        if (readings.isEmpty()) {
            return Outcome.fail(ErrorKind.NOT_FOUND, "No telemetry recorded for batch " + batchId.getValue());
        }
        return Outcome.ok(readings.get(readings.size() - 1));
    }

    /**
     * 인덱스로 측정값 조회.
     *
     * @param index 0부터 시작하는 삽입 순번
     * @return 측정값, 배치가 없으면 NOT_FOUND, 범위 밖이면 OUT_OF_BOUNDS
     */
    public static Outcome<TelemetryReading> readingAt(LedgerView view, BatchId batchId, int index) {
        if (view.batch(batchId).isEmpty()) {
            return batchNotFound(batchId);
        }
        List<TelemetryReading> readings = view.readings(batchId);
        if (index < 0 || index >= readings.size()) {
            return Outcome.fail(ErrorKind.OUT_OF_BOUNDS,
                "Reading index " + index + " out of bounds (size: " + readings.size() + ")");
        }
        return Outcome.ok(readings.get(index));
    }

    public static Optional<ComplianceRecord> findComplianceRecord(LedgerView view, ComplianceRecordId id) {
        return view.complianceRecords(id.batchId()).stream()
            .filter(record -> record.id().equals(id))
            .findFirst();
    }

    public static Outcome<ComplianceRecord> complianceRecord(LedgerView view, ComplianceRecordId id) {
        return findComplianceRecord(view, id)
            .map(Outcome::ok)
            .orElseGet(() -> Outcome.fail(ErrorKind.NOT_FOUND, "Compliance record not found: " + id));
    }

    public static Outcome<List<AuditEntry>> auditTrail(LedgerView view, BatchId batchId) {
        if (view.batch(batchId).isEmpty()) {
            return batchNotFound(batchId);
        }
        return Outcome.ok(view.auditEntries(batchId));
    }

    /**
     * 배치 규정 준수 여부.
     *
     * @return PASSED 기록이 하나 이상 있고 FAILED 기록이 하나도 없으면 true
     */
    public static boolean isBatchCompliant(LedgerView view, BatchId batchId) {
        List<ComplianceRecord> records = view.complianceRecords(batchId);
        boolean anyPassed = records.stream().anyMatch(r -> r.status() == ComplianceStatus.PASSED);
        boolean anyFailed = records.stream().anyMatch(r -> r.status() == ComplianceStatus.FAILED);
        return anyPassed && !anyFailed;
    }

    /**
     * 의약품 코드 승인 여부.
     *
     * @return 회수되지 않았고 now가 승인 기간 안에 있는 승인이 하나라도 있으면 true
     */
    public static boolean isDrugApproved(LedgerView view, String drugCode, Instant now) {
        return view.approvals().stream()
            .anyMatch(a -> a.drugCode().equals(drugCode) && a.isEffectiveAt(now));
    }

    public static Outcome<GovernanceProposal> proposal(LedgerView view, ProposalId id) {
        return view.proposal(id)
            .map(Outcome::ok)
            .orElseGet(() -> Outcome.fail(ErrorKind.PROPOSAL_NOT_FOUND, "Proposal not found: " + id.getValue()));
    }

    private static <T> Outcome<T> batchNotFound(BatchId batchId) {
        return Outcome.fail(ErrorKind.NOT_FOUND, "Batch not found: " + batchId.getValue());
    }
}
