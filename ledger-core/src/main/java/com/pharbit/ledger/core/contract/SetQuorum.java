package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.GovernanceState;

/**
 * 정족수 변경 (ADMIN 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record SetQuorum(
    int quorum
) implements Command<GovernanceState> {

    @Override
    public CommandType type() {
        return CommandType.SET_QUORUM;
    }
}
