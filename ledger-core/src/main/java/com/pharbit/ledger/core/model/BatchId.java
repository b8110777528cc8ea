package com.pharbit.ledger.core.model;

/**
 * 의약품 배치의 외부 식별자 (예: 제조사 로트 번호).
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class BatchId {

    private final String value;

    private BatchId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("BatchId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("BatchId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("BatchId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * BatchId 생성.
     *
     * @param value 배치 번호
     * @return BatchId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static BatchId of(String value) {
        return new BatchId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchId batchId = (BatchId) o;
        return value.equals(batchId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "BatchId{" + value + '}';
    }
}
