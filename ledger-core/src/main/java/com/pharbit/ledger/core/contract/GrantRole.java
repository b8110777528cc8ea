package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;

/**
 * 역할 부여 (ADMIN 전용, 멱등). 결과 값은 실제 변경 여부.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record GrantRole(
    Identity identity,
    Role role
) implements Command<Boolean> {

    public GrantRole {
        if (identity == null || role == null) {
            throw new IllegalArgumentException("identity, role cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.GRANT_ROLE;
    }
}
