package com.pharbit.ledger.core.model;

/**
 * 거버넌스 제안의 순차 식별자 (1부터 시작).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class ProposalId {

    private final long value;

    private ProposalId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("ProposalId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    public static ProposalId of(long value) {
        return new ProposalId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProposalId that = (ProposalId) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "ProposalId{" + value + '}';
    }
}
