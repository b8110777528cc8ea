package com.pharbit.ledger.core.outcome;

/**
 * 명령 거부.
 *
 * <p>거부된 명령은 어떤 상태도 바꾸지 않으며 이벤트를 남기지 않습니다.</p>
 *
 * @param kind 오류 종류
 * @param message 오류 메시지
 * @param <T> 성공 시 값 타입 (타입 일치용)
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Fail<T>(
    ErrorKind kind,
    String message
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 비어 있는 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static <T> Fail<T> of(ErrorKind kind, String message) {
        return new Fail<>(kind, message);
    }

    /**
     * 값 타입을 바꾼 동일 실패.
     */
    public <U> Fail<U> recast() {
        return new Fail<>(kind, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
