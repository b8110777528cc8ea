package com.pharbit.ledger.adapter.inmemory.store;

import com.pharbit.ledger.core.model.ApprovalId;
import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.RegulatoryApproval;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.StatusChange;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.spi.LedgerStore;
import com.pharbit.ledger.core.spi.StateChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link LedgerStore} SPI for testing and reference purposes.
 *
 * <p>All state lives behind a single {@link ReentrantReadWriteLock}: {@link #commit(List)} applies
 * every change of one command under the write lock, and every read takes the read lock and returns
 * an immutable copy. Readers therefore never block each other and never observe half a commit.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>roles:</strong> ConcurrentHashMap&lt;Identity, Set&lt;Role&gt;&gt; - Access Registry</li>
 *   <li><strong>stakeholders, batches:</strong> LinkedHashMap - registration / creation order</li>
 *   <li><strong>transfers, statusChanges, readings, complianceRecords, auditEntries:</strong>
 *       per-batch ArrayList - append order</li>
 *   <li><strong>approvals:</strong> LinkedHashMap&lt;ApprovalId, RegulatoryApproval&gt; - id order</li>
 *   <li><strong>proposals:</strong> ConcurrentHashMap&lt;ProposalId, GovernanceProposal&gt;</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart (rebuild by replaying the event log)</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Identity, Set<Role>> roles = new ConcurrentHashMap<>();
    private final Map<Identity, StakeholderRecord> stakeholders = new LinkedHashMap<>();
    private final Map<BatchId, Batch> batches = new LinkedHashMap<>();
    private final Map<BatchId, List<CustodyTransfer>> transfers = new ConcurrentHashMap<>();
    private final Map<BatchId, List<StatusChange>> statusChanges = new ConcurrentHashMap<>();
    private final Map<BatchId, TelemetryBounds> batchBounds = new ConcurrentHashMap<>();
    private final Map<BatchId, Set<Identity>> sensorBindings = new ConcurrentHashMap<>();
    private final Map<BatchId, List<TelemetryReading>> readings = new ConcurrentHashMap<>();
    private final Map<BatchId, List<ComplianceRecord>> complianceRecords = new ConcurrentHashMap<>();
    private final Map<BatchId, List<AuditEntry>> auditEntries = new ConcurrentHashMap<>();
    private final Map<ApprovalId, RegulatoryApproval> approvals = new LinkedHashMap<>();
    private final Map<ProposalId, GovernanceProposal> proposals = new ConcurrentHashMap<>();

    private TelemetryBounds defaultBounds;
    private GovernanceState governance = GovernanceState.empty();

    @Override
    public void commit(List<StateChange> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        lock.writeLock().lock();
        try {
            for (StateChange change : changes) {
                apply(change);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void apply(StateChange change) {
        if (change instanceof StateChange.PutRoles put) {
            roles.put(put.identity(), put.roles());
        } else if (change instanceof StateChange.PutStakeholder put) {
            stakeholders.put(put.record().identity(), put.record());
        } else if (change instanceof StateChange.PutBatch put) {
            batches.put(put.batch().id(), put.batch());
        } else if (change instanceof StateChange.AppendTransfer append) {
            appendTo(transfers, append.transfer().batchId(), append.transfer());
        } else if (change instanceof StateChange.AppendStatusChange append) {
            appendTo(statusChanges, append.change().batchId(), append.change());
        } else if (change instanceof StateChange.PutDefaultBounds put) {
            defaultBounds = put.bounds();
        } else if (change instanceof StateChange.PutBatchBounds put) {
            batchBounds.put(put.batchId(), put.bounds());
        } else if (change instanceof StateChange.PutSensorBinding put) {
            Set<Identity> devices = sensorBindings.computeIfAbsent(put.batchId(), id -> new LinkedHashSet<>());
            if (put.bound()) {
                devices.add(put.device());
            } else {
                devices.remove(put.device());
            }
        } else if (change instanceof StateChange.AppendReading append) {
            appendTo(readings, append.reading().batchId(), append.reading());
        } else if (change instanceof StateChange.PutComplianceRecord put) {
            putComplianceRecord(put.record());
        } else if (change instanceof StateChange.AppendAuditEntry append) {
            appendTo(auditEntries, append.entry().batchId(), append.entry());
        } else if (change instanceof StateChange.PutApproval put) {
            approvals.put(put.approval().id(), put.approval());
        } else if (change instanceof StateChange.PutGovernance put) {
            governance = put.state();
        } else if (change instanceof StateChange.PutProposal put) {
            proposals.put(put.proposal().id(), put.proposal());
        } else {
            throw new IllegalArgumentException("Unsupported state change: " + change);
        }
    }

    private void putComplianceRecord(ComplianceRecord record) {
        List<ComplianceRecord> records = complianceRecords.computeIfAbsent(record.batchId(), id -> new ArrayList<>());
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).id().equals(record.id())) {
                records.set(i, record);
                return;
            }
        }
        records.add(record);
    }

    private static <T> void appendTo(Map<BatchId, List<T>> target, BatchId batchId, T entry) {
        target.computeIfAbsent(batchId, id -> new ArrayList<>()).add(entry);
    }

    // ========== LedgerView ==========

    @Override
    public Set<Role> rolesOf(Identity identity) {
        return read(() -> {
            Set<Role> held = roles.get(identity);
            return held == null || held.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(held));
        });
    }

    @Override
    public Optional<StakeholderRecord> stakeholder(Identity identity) {
        return read(() -> Optional.ofNullable(stakeholders.get(identity)));
    }

    @Override
    public List<StakeholderRecord> stakeholders() {
        return read(() -> List.copyOf(stakeholders.values()));
    }

    @Override
    public Optional<Batch> batch(BatchId batchId) {
        return read(() -> Optional.ofNullable(batches.get(batchId)));
    }

    @Override
    public List<Batch> batches() {
        return read(() -> List.copyOf(batches.values()));
    }

    @Override
    public List<CustodyTransfer> transfers(BatchId batchId) {
        return read(() -> List.copyOf(transfers.getOrDefault(batchId, List.of())));
    }

    @Override
    public List<StatusChange> statusChanges(BatchId batchId) {
        return read(() -> List.copyOf(statusChanges.getOrDefault(batchId, List.of())));
    }

    @Override
    public Optional<TelemetryBounds> defaultBounds() {
        return read(() -> Optional.ofNullable(defaultBounds));
    }

    @Override
    public Optional<TelemetryBounds> batchBounds(BatchId batchId) {
        return read(() -> Optional.ofNullable(batchBounds.get(batchId)));
    }

    @Override
    public Set<Identity> boundSensors(BatchId batchId) {
        return read(() -> Set.copyOf(sensorBindings.getOrDefault(batchId, Set.of())));
    }

    @Override
    public List<TelemetryReading> readings(BatchId batchId) {
        return read(() -> List.copyOf(readings.getOrDefault(batchId, List.of())));
    }

    @Override
    public List<ComplianceRecord> complianceRecords(BatchId batchId) {
        return read(() -> List.copyOf(complianceRecords.getOrDefault(batchId, List.of())));
    }

    @Override
    public List<AuditEntry> auditEntries(BatchId batchId) {
        return read(() -> List.copyOf(auditEntries.getOrDefault(batchId, List.of())));
    }

    @Override
    public Optional<RegulatoryApproval> approval(ApprovalId approvalId) {
        return read(() -> Optional.ofNullable(approvals.get(approvalId)));
    }

    @Override
    public List<RegulatoryApproval> approvals() {
        return read(() -> List.copyOf(approvals.values()));
    }

    @Override
    public GovernanceState governance() {
        return read(() -> governance);
    }

    @Override
    public Optional<GovernanceProposal> proposal(ProposalId proposalId) {
        return read(() -> Optional.ofNullable(proposals.get(proposalId)));
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
