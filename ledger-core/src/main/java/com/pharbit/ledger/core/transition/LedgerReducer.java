package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.AddComplianceCheck;
import com.pharbit.ledger.core.contract.AddOwner;
import com.pharbit.ledger.core.contract.BindSensor;
import com.pharbit.ledger.core.contract.Command;
import com.pharbit.ledger.core.contract.CreateBatch;
import com.pharbit.ledger.core.contract.CreateProposal;
import com.pharbit.ledger.core.contract.DestroyBatch;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.ExecuteProposal;
import com.pharbit.ledger.core.contract.GrantApproval;
import com.pharbit.ledger.core.contract.GrantRole;
import com.pharbit.ledger.core.contract.RecordAuditTrail;
import com.pharbit.ledger.core.contract.RecordTelemetry;
import com.pharbit.ledger.core.contract.RegisterStakeholder;
import com.pharbit.ledger.core.contract.RemoveOwner;
import com.pharbit.ledger.core.contract.RevokeApproval;
import com.pharbit.ledger.core.contract.RevokeRole;
import com.pharbit.ledger.core.contract.SetActive;
import com.pharbit.ledger.core.contract.SetBatchBounds;
import com.pharbit.ledger.core.contract.SetKyc;
import com.pharbit.ledger.core.contract.SetQuorum;
import com.pharbit.ledger.core.contract.SetTelemetryBounds;
import com.pharbit.ledger.core.contract.TransferCustody;
import com.pharbit.ledger.core.contract.UpdateComplianceStatus;
import com.pharbit.ledger.core.contract.UpdateStatus;
import com.pharbit.ledger.core.contract.Vote;
import com.pharbit.ledger.core.spi.LedgerView;

/**
 * 순수 상태 전이 함수: (state, command, now) → (outcome, changes, event).
 *
 * <p>리듀서는 저장소를 읽기만 하며 쓰지 않습니다. "현재 시각"은 Envelope의 issuedAt만 사용하므로
 * 같은 상태와 같은 Envelope에 대해 항상 같은 결과를 돌려줍니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>권한 판정 ({@link Permissions})</li>
 *   <li>명령별 검증</li>
 *   <li>변경 목록과 이벤트 초안 생성</li>
 * </ol>
 *
 * <p>검증 실패는 예외가 아닌 {@link com.pharbit.ledger.core.outcome.Fail} 결과로 반환됩니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class LedgerReducer {

    private final AccessRegistryHandler access = new AccessRegistryHandler();
    private final StakeholderDirectoryHandler stakeholders = new StakeholderDirectoryHandler();
    private final BatchLedgerHandler batches = new BatchLedgerHandler();
    private final ComplianceAuditHandler compliance = new ComplianceAuditHandler();
    private final TelemetryHandler telemetry;
    private final GovernanceHandler governance;
    private final LedgerPolicy policy;

    public LedgerReducer(LedgerPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
        this.telemetry = new TelemetryHandler(policy);
        this.governance = new GovernanceHandler(policy);
    }

    public LedgerReducer() {
        this(new LedgerPolicy());
    }

    public LedgerPolicy policy() {
        return policy;
    }

    /**
     * 명령 평가.
     *
     * @param view 현재 상태
     * @param envelope 명령 Envelope
     * @param <R> 결과 값 타입
     * @return 평가 결과 (거부 시 변경 없음)
     */
    public <R> Transition<R> reduce(LedgerView view, Envelope<R> envelope) {
        try {
            // 각 명령 타입의 핸들러는 Command<R>의 R과 같은 결과 타입을 반환
            Transition<R> transition = (Transition<R>) dispatch(view, envelope);
            return transition;
        } catch (CommandRejection rejection) {
            return Transition.rejected(rejection.kind(), rejection.getMessage());
        }
    }

    private Transition<?> dispatch(LedgerView view, Envelope<?> envelope) {
        Command<?> command = envelope.command();

        // Access Registry
        if (command instanceof GrantRole c) return access.grant(view, envelope, c);
        if (command instanceof RevokeRole c) return access.revoke(view, envelope, c);

        // Stakeholder Directory
        if (command instanceof RegisterStakeholder c) return stakeholders.register(view, envelope, c);
        if (command instanceof SetKyc c) return stakeholders.setKyc(view, envelope, c);
        if (command instanceof SetActive c) return stakeholders.setActive(view, envelope, c);

        // Batch Ledger
        if (command instanceof CreateBatch c) return batches.create(view, envelope, c);
        if (command instanceof UpdateStatus c) return batches.updateStatus(view, envelope, c);
        if (command instanceof DestroyBatch c) return batches.destroy(view, envelope, c);
        if (command instanceof TransferCustody c) return batches.transfer(view, envelope, c);

        // Telemetry Validator
        if (command instanceof SetTelemetryBounds c) return telemetry.setBounds(view, envelope, c);
        if (command instanceof SetBatchBounds c) return telemetry.setBatchBounds(view, envelope, c);
        if (command instanceof BindSensor c) return telemetry.bindSensor(view, envelope, c);
        if (command instanceof RecordTelemetry c) return telemetry.record(view, envelope, c);

        // Compliance & Audit
        if (command instanceof AddComplianceCheck c) return compliance.addCheck(view, envelope, c);
        if (command instanceof UpdateComplianceStatus c) return compliance.updateStatus(view, envelope, c);
        if (command instanceof RecordAuditTrail c) return compliance.recordAudit(view, envelope, c);
        if (command instanceof GrantApproval c) return compliance.grantApproval(view, envelope, c);
        if (command instanceof RevokeApproval c) return compliance.revokeApproval(view, envelope, c);

        // Governance
        if (command instanceof AddOwner c) return governance.addOwner(view, envelope, c);
        if (command instanceof RemoveOwner c) return governance.removeOwner(view, envelope, c);
        if (command instanceof SetQuorum c) return governance.setQuorum(view, envelope, c);
        if (command instanceof CreateProposal c) return governance.createProposal(view, envelope, c);
        if (command instanceof Vote c) return governance.vote(view, envelope, c);
        if (command instanceof ExecuteProposal c) return governance.execute(view, envelope, c);

        throw new IllegalArgumentException("Unsupported command type: " + command.type());
    }
}
