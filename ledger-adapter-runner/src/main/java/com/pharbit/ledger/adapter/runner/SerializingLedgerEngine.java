package com.pharbit.ledger.adapter.runner;

import com.pharbit.ledger.application.feed.EventFeed;
import com.pharbit.ledger.application.gateway.LedgerGateway;
import com.pharbit.ledger.application.query.LedgerQueries;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.event.LedgerEvent;
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
import com.pharbit.ledger.core.outcome.Fail;
import com.pharbit.ledger.core.outcome.LedgerInvariantViolation;
import com.pharbit.ledger.core.outcome.Outcome;
import com.pharbit.ledger.core.spi.EventLog;
import com.pharbit.ledger.core.spi.EventSubscriber;
import com.pharbit.ledger.core.spi.LedgerStore;
import com.pharbit.ledger.core.spi.StateChange;
import com.pharbit.ledger.core.transition.LedgerGenesis;
import com.pharbit.ledger.core.transition.LedgerInvariants;
import com.pharbit.ledger.core.transition.LedgerProjections;
import com.pharbit.ledger.core.transition.LedgerReducer;
import com.pharbit.ledger.core.transition.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 명령을 직렬 가능 순서로 적용하는 원장 엔진.
 *
 * <p>LedgerGateway, LedgerQueries, EventFeed를 하나의 인스턴스로 제공합니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>명령이 읽고 쓰는 엔티티 키 계산 ({@link CommandLocks})</li>
 *   <li>해당 스트라이프 잠금 획득 (읽기 전용 키는 공유, 쓰는 키는 배타, 오름차순)</li>
 *   <li>LedgerReducer로 전이 평가 (거부 시 Fail 반환, 상태 변경 없음)</li>
 *   <li>커밋 모니터 안에서 불변식 검사 → 저장소 커밋 → 이벤트 추가</li>
 *   <li>잠금 해제 후 구독자에게 이벤트 전달 (모니터와 스트라이프 잠금 밖)</li>
 *   <li>Ok 반환</li>
 * </ol>
 *
 * <p><strong>동시성 보장:</strong></p>
 * <ul>
 *   <li>충돌하는 명령은 잠금 키를 공유하므로 순서대로 평가됨</li>
 *   <li>커밋과 이벤트 추가는 같은 모니터 안에서 수행되어 이벤트 순서 = 커밋 순서</li>
 *   <li>조회는 저장소의 스냅샷 읽기이므로 부분 적용된 명령을 관찰하지 않음</li>
 * </ul>
 *
 * <p><strong>불변식 위반:</strong></p>
 * <p>커밋 직전 {@link LedgerInvariantViolation}이 발생하면 엔진은 정지 상태가 되며,
 * 이후 모든 submit은 IllegalStateException을 던집니다. 정지를 일으킨 변경은 커밋되지 않습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public class SerializingLedgerEngine implements LedgerGateway, LedgerQueries, EventFeed {

    private static final Logger log = LoggerFactory.getLogger(SerializingLedgerEngine.class);

    private final LedgerStore store;
    private final EventLog eventLog;
    private final LedgerReducer reducer;
    private final StripedLocks locks;
    private final Object commitMonitor = new Object();

    private volatile String haltReason;

    /**
     * 생성자.
     *
     * <p>저장소에 Owner가 없으면 genesis를 적용합니다. 이미 초기화된 저장소라면 genesis는 무시됩니다.</p>
     *
     * @param store 원장 저장소
     * @param eventLog 이벤트 로그
     * @param genesis 초기 역할/Owner 구성
     * @param config 엔진 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public SerializingLedgerEngine(LedgerStore store, EventLog eventLog, LedgerGenesis genesis,
                                   LedgerEngineConfig config) {
        this(store, eventLog, genesis, config, config == null ? null : new LedgerReducer(config.policy()));
    }

    SerializingLedgerEngine(LedgerStore store, EventLog eventLog, LedgerGenesis genesis,
                            LedgerEngineConfig config, LedgerReducer reducer) {
        if (store == null || eventLog == null || genesis == null || config == null || reducer == null) {
            throw new IllegalArgumentException("store, eventLog, genesis, config and reducer cannot be null");
        }
        this.store = store;
        this.eventLog = eventLog;
        this.reducer = reducer;
        this.locks = new StripedLocks(config.lockStripes());
        applyGenesis(genesis);
    }

    private void applyGenesis(LedgerGenesis genesis) {
        if (!store.governance().owners().isEmpty()) {
            log.info("Ledger store already initialized, genesis skipped");
            return;
        }
        List<StateChange> changes = genesis.toChanges();
        LedgerInvariants.check(store, changes);
        store.commit(changes);
        log.info("Genesis applied: {} identities, owners={}, quorum={}",
            genesis.grants().size(), genesis.owners(), genesis.quorum());
    }

    // ========== LedgerGateway ==========

    @Override
    public <R> Outcome<R> submit(Envelope<R> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        ensureRunning();
        Map<String, LockMode> keys = CommandLocks.keysFor(store, envelope);
        Outcome<R> outcome = locks.withLocks(keys, () -> apply(envelope));
        eventLog.deliverPending();
        return outcome;
    }

    private <R> Outcome<R> apply(Envelope<R> envelope) {
        ensureRunning();

        Transition<R> transition = reducer.reduce(store, envelope);
        if (!transition.isAccepted()) {
            log.debug("Command rejected: {} by {} ({}: {})", envelope.command().type(),
                envelope.caller(), transition.outcome().errorKind(), failureMessage(transition.outcome()));
            return transition.outcome();
        }

        synchronized (commitMonitor) {
            ensureRunning();
            try {
                LedgerInvariants.check(store, transition.changes());
            } catch (LedgerInvariantViolation violation) {
                halt(envelope, violation);
                throw violation;
            }
            store.commit(transition.changes());
            LedgerEvent event = eventLog.append(transition.event(), envelope);
            log.debug("Command applied: seq={}, type={}, entity={}, caller={}",
                event.sequence(), event.type(), event.entityId(), event.actor());
        }
        return transition.outcome();
    }

    private void halt(Envelope<?> envelope, LedgerInvariantViolation violation) {
        haltReason = violation.getInvariant() + " (" + violation.getMessage() + ")";
        log.error("Ledger engine halted on {} from command {}: {}",
            envelope.command().type(), envelope.commandId(), haltReason, violation);
    }

    private void ensureRunning() {
        if (haltReason != null) {
            throw new IllegalStateException("Ledger engine halted: " + haltReason);
        }
    }

    /**
     * 불변식 위반으로 정지되었는지 확인.
     */
    public boolean isHalted() {
        return haltReason != null;
    }

    private static String failureMessage(Outcome<?> outcome) {
        return outcome instanceof Fail<?> fail ? fail.message() : "";
    }

    // ========== Access Registry ==========

    @Override
    public boolean hasRole(Identity identity, Role role) {
        return LedgerProjections.hasRole(store, identity, role);
    }

    @Override
    public boolean hasAnyRole(Identity identity, Role... roles) {
        return LedgerProjections.hasAnyRole(store, identity, roles);
    }

    @Override
    public Set<Role> rolesOf(Identity identity) {
        return store.rolesOf(identity);
    }

    // ========== Stakeholder Directory ==========

    @Override
    public Outcome<StakeholderRecord> getStakeholder(Identity identity) {
        return LedgerProjections.stakeholder(store, identity);
    }

    @Override
    public List<StakeholderRecord> listStakeholders() {
        return store.stakeholders();
    }

    // ========== Batch Ledger ==========

    @Override
    public Outcome<Batch> getBatch(BatchId batchId) {
        return LedgerProjections.batch(store, batchId);
    }

    @Override
    public List<Batch> listBatches() {
        return store.batches();
    }

    @Override
    public List<CustodyTransfer> getTransferHistory(BatchId batchId) {
        return store.transfers(batchId);
    }

    @Override
    public List<StatusChange> getStatusHistory(BatchId batchId) {
        return store.statusChanges(batchId);
    }

    // ========== Telemetry Validator ==========

    @Override
    public TelemetryBounds telemetryBounds(BatchId batchId) {
        return LedgerProjections.effectiveBounds(store, batchId, reducer.policy());
    }

    @Override
    public Outcome<TelemetryReading> latestReading(BatchId batchId) {
        return LedgerProjections.latestReading(store, batchId);
    }

    @Override
    public Outcome<List<TelemetryReading>> telemetryHistory(BatchId batchId) {
        return LedgerProjections.telemetryHistory(store, batchId);
    }

    @Override
    public Outcome<TelemetryReading> readingAt(BatchId batchId, int index) {
        return LedgerProjections.readingAt(store, batchId, index);
    }

    // ========== Compliance & Audit ==========

    @Override
    public Outcome<ComplianceRecord> getComplianceRecord(ComplianceRecordId recordId) {
        return LedgerProjections.complianceRecord(store, recordId);
    }

    @Override
    public List<ComplianceRecord> complianceRecords(BatchId batchId) {
        return store.complianceRecords(batchId);
    }

    @Override
    public Outcome<List<AuditEntry>> getAuditTrail(BatchId batchId) {
        return LedgerProjections.auditTrail(store, batchId);
    }

    @Override
    public boolean isBatchCompliant(BatchId batchId) {
        return LedgerProjections.isBatchCompliant(store, batchId);
    }

    @Override
    public boolean isDrugApproved(String drugCode, Instant now) {
        return LedgerProjections.isDrugApproved(store, drugCode, now);
    }

    @Override
    public Optional<RegulatoryApproval> getApproval(ApprovalId approvalId) {
        return store.approval(approvalId);
    }

    // ========== Governance ==========

    @Override
    public Outcome<GovernanceProposal> getProposal(ProposalId proposalId) {
        return LedgerProjections.proposal(store, proposalId);
    }

    @Override
    public Set<Identity> owners() {
        return store.governance().owners();
    }

    @Override
    public int quorum() {
        return store.governance().quorum();
    }

    // ========== EventFeed ==========

    @Override
    public void subscribe(EventSubscriber subscriber) {
        eventLog.subscribe(subscriber);
    }

    @Override
    public void unsubscribe(EventSubscriber subscriber) {
        eventLog.unsubscribe(subscriber);
    }

    @Override
    public List<LedgerEvent> replay(long fromSequence) {
        return eventLog.readFrom(fromSequence, Integer.MAX_VALUE);
    }

    @Override
    public long lastSequence() {
        return eventLog.lastSequence();
    }
}
