package com.pharbit.ledger.core.model;

/**
 * 규제 승인 기록의 순차 식별자 (1부터 시작).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class ApprovalId {

    private final long value;

    private ApprovalId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("ApprovalId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    public static ApprovalId of(long value) {
        return new ApprovalId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApprovalId that = (ApprovalId) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "ApprovalId{" + value + '}';
    }
}
