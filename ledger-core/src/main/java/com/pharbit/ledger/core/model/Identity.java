package com.pharbit.ledger.core.model;

/**
 * 참여자(사람, 조직, 디바이스)를 가리키는 전역 고유 식별자.
 *
 * <p>Identity는 인증 계층에서 이미 확인된 호출자를 나타내며,
 * 레저 내부에서는 조회 키로만 사용됩니다 (소유 관계 없음).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class Identity implements Comparable<Identity> {

    private final String value;

    private Identity(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("Identity length cannot exceed 128 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Identity cannot contain whitespace: '" + value + "'");
        }
        this.value = value;
    }

    /**
     * Identity 생성.
     *
     * @param value 식별자 값
     * @return Identity 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Identity of(String value) {
        return new Identity(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Identity other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identity identity = (Identity) o;
        return value.equals(identity.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Identity{" + value + '}';
    }
}
