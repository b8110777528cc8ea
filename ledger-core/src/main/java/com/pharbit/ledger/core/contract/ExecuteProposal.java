package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.ProposalId;

/**
 * 마감된 제안 실행 (Owner 전용). 결과 값은 고정된 passed.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record ExecuteProposal(
    ProposalId proposalId
) implements Command<Boolean> {

    public ExecuteProposal {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.EXECUTE_PROPOSAL;
    }
}
