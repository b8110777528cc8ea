package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.ProposalAction;

import java.time.Duration;

/**
 * 제안 생성 (Owner 전용). action이 null이면 NoAction.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record CreateProposal(
    String description,
    Duration votingPeriod,
    ProposalAction action
) implements Command<GovernanceProposal> {

    public CreateProposal {
        if (votingPeriod == null) {
            throw new IllegalArgumentException("votingPeriod cannot be null");
        }
        action = action == null ? ProposalAction.none() : action;
    }

    @Override
    public CommandType type() {
        return CommandType.CREATE_PROPOSAL;
    }
}
