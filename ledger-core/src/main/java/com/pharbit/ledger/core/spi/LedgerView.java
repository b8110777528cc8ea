package com.pharbit.ledger.core.spi;

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

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over the whole ledger state.
 *
 * <p>The reducer evaluates commands against this view; the query surface is built on it as well.
 * Implementations must return immutable snapshots: a returned collection never changes after
 * the call returns.</p>
 *
 * <p><strong>Ordering Contract:</strong></p>
 * <ul>
 *   <li>{@link #stakeholders()} - registration order</li>
 *   <li>{@link #batches()} - creation order</li>
 *   <li>Per-batch lists (transfers, status changes, readings, compliance, audits) - append order</li>
 *   <li>{@link #approvals()} - id order</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface LedgerView {

    /**
     * Roles held by an identity.
     *
     * @param identity identity to look up
     * @return held roles, empty if none
     */
    Set<Role> rolesOf(Identity identity);

    Optional<StakeholderRecord> stakeholder(Identity identity);

    List<StakeholderRecord> stakeholders();

    Optional<Batch> batch(BatchId batchId);

    List<Batch> batches();

    List<CustodyTransfer> transfers(BatchId batchId);

    List<StatusChange> statusChanges(BatchId batchId);

    /**
     * Ledger-wide bounds set by a regulator or a passed proposal.
     *
     * @return stored bounds, empty when never set (callers fall back to policy defaults)
     */
    Optional<TelemetryBounds> defaultBounds();

    Optional<TelemetryBounds> batchBounds(BatchId batchId);

    /**
     * Sensor devices bound to a batch.
     *
     * @param batchId batch
     * @return bound devices, empty if none
     */
    Set<Identity> boundSensors(BatchId batchId);

    List<TelemetryReading> readings(BatchId batchId);

    List<ComplianceRecord> complianceRecords(BatchId batchId);

    List<AuditEntry> auditEntries(BatchId batchId);

    Optional<RegulatoryApproval> approval(ApprovalId approvalId);

    List<RegulatoryApproval> approvals();

    /**
     * Owner set, quorum and proposal counter.
     *
     * @return governance state, {@link GovernanceState#empty()} before genesis
     */
    GovernanceState governance();

    Optional<GovernanceProposal> proposal(ProposalId proposalId);
}
