package com.pharbit.ledger.core.model;

/**
 * 관리 작업 없이 의사 결정만 기록하는 제안.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record NoAction() implements ProposalAction {

    static final NoAction INSTANCE = new NoAction();

    @Override
    public String summary() {
        return "none";
    }
}
