package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;

/**
 * 역할 회수 (ADMIN 전용, 멱등). 결과 값은 실제 변경 여부.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RevokeRole(
    Identity identity,
    Role role
) implements Command<Boolean> {

    public RevokeRole {
        if (identity == null || role == null) {
            throw new IllegalArgumentException("identity, role cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.REVOKE_ROLE;
    }
}
