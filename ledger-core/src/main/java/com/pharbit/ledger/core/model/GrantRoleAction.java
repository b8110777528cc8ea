package com.pharbit.ledger.core.model;

/**
 * 통과 시 역할을 부여하는 작업.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record GrantRoleAction(Identity grantee, Role role) implements ProposalAction {

    public GrantRoleAction {
        if (grantee == null || role == null) {
            throw new IllegalArgumentException("grantee and role cannot be null");
        }
    }

    @Override
    public String summary() {
        return "grant " + role + " to " + grantee.getValue();
    }
}
