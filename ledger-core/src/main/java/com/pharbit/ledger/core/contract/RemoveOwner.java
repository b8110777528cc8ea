package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;

/**
 * Owner 제거 (ADMIN 전용). 정족수는 필요 시 Owner 수로 내려갑니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RemoveOwner(
    Identity owner
) implements Command<GovernanceState> {

    public RemoveOwner {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.REMOVE_OWNER;
    }
}
