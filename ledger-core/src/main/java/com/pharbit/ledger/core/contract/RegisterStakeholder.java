package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;

/**
 * 조직 등록 (REGISTRAR 전용). 같은 명령 안에서 role도 Access Registry에 부여됩니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RegisterStakeholder(
    Identity identity,
    String name,
    Role role
) implements Command<StakeholderRecord> {

    public RegisterStakeholder {
        if (identity == null || name == null || role == null) {
            throw new IllegalArgumentException("identity, name, role cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.REGISTER_STAKEHOLDER;
    }
}
