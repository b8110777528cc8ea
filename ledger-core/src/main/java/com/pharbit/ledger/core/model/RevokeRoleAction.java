package com.pharbit.ledger.core.model;

/**
 * 통과 시 역할을 회수하는 작업.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record RevokeRoleAction(Identity holder, Role role) implements ProposalAction {

    public RevokeRoleAction {
        if (holder == null || role == null) {
            throw new IllegalArgumentException("holder and role cannot be null");
        }
    }

    @Override
    public String summary() {
        return "revoke " + role + " from " + holder.getValue();
    }
}
