package com.pharbit.ledger.core.spi;

import com.pharbit.ledger.core.model.AuditEntry;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.RegulatoryApproval;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.StatusChange;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;

import java.util.Set;

/**
 * One write produced by the reducer, applied by {@link LedgerStore#commit(java.util.List)}.
 *
 * <p>{@code Put*} changes replace the stored value for their key; {@code Append*} changes add an
 * entry to a per-batch log.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public sealed interface StateChange {

    record PutRoles(Identity identity, Set<Role> roles) implements StateChange {
        public PutRoles {
            if (identity == null || roles == null) {
                throw new IllegalArgumentException("identity and roles cannot be null");
            }
            roles = Set.copyOf(roles);
        }
    }

    record PutStakeholder(StakeholderRecord record) implements StateChange {
    }

    record PutBatch(Batch batch) implements StateChange {
    }

    record AppendTransfer(CustodyTransfer transfer) implements StateChange {
    }

    record AppendStatusChange(StatusChange change) implements StateChange {
    }

    record PutDefaultBounds(TelemetryBounds bounds) implements StateChange {
    }

    record PutBatchBounds(BatchId batchId, TelemetryBounds bounds) implements StateChange {
    }

    record PutSensorBinding(BatchId batchId, Identity device, boolean bound) implements StateChange {
    }

    record AppendReading(TelemetryReading reading) implements StateChange {
    }

    record PutComplianceRecord(ComplianceRecord record) implements StateChange {
    }

    record AppendAuditEntry(AuditEntry entry) implements StateChange {
    }

    record PutApproval(RegulatoryApproval approval) implements StateChange {
    }

    record PutGovernance(GovernanceState state) implements StateChange {
    }

    record PutProposal(GovernanceProposal proposal) implements StateChange {
    }
}
