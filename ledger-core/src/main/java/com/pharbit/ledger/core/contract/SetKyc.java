package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.StakeholderRecord;

/**
 * KYC 상태 갱신 (REGISTRAR 전용). reference는 null 허용.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record SetKyc(
    Identity identity,
    boolean completed,
    String reference
) implements Command<StakeholderRecord> {

    public SetKyc {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.SET_KYC;
    }
}
