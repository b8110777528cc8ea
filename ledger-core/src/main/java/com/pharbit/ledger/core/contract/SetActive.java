package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.StakeholderRecord;

/**
 * 활성/비활성 전환 (REGISTRAR 전용).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record SetActive(
    Identity identity,
    boolean active
) implements Command<StakeholderRecord> {

    public SetActive {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.SET_ACTIVE;
    }
}
