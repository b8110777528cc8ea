package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;

/**
 * Owner 추가 (ADMIN 전용). GOVERNANCE_OWNER 역할도 함께 부여됩니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record AddOwner(
    Identity owner
) implements Command<GovernanceState> {

    public AddOwner {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.ADD_OWNER;
    }
}
