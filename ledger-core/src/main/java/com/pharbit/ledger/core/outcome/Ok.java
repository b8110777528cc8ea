package com.pharbit.ledger.core.outcome;

/**
 * 명령 성공.
 *
 * @param value 생성/갱신된 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
