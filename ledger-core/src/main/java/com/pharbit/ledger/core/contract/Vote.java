package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.ProposalId;

/**
 * 제안 투표 (Owner 전용, 제안당 1회).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Vote(
    ProposalId proposalId,
    boolean support
) implements Command<GovernanceProposal> {

    public Vote {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.VOTE;
    }
}
