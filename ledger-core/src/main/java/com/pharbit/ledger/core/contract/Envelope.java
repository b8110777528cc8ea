package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.CommandId;
import com.pharbit.ledger.core.model.Identity;

import java.time.Instant;

/**
 * 명령 제출 단위.
 *
 * <p>Envelope는 명령에 제출 식별자, 인증 계층에서 확인된 호출자, 논리 시각을 덧붙입니다.
 * 리듀서는 {@code issuedAt}을 "현재 시각"으로 사용하므로, 같은 Envelope 순서를 다시 적용하면
 * 같은 결과가 나옵니다.</p>
 *
 * @param commandId 제출 식별자
 * @param caller 호출자 Identity
 * @param command 명령
 * @param issuedAt 논리 시각 (now)
 * @param <R> 명령 결과 타입
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Envelope<R>(
    CommandId commandId,
    Identity caller,
    Command<R> command,
    Instant issuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public Envelope {
        if (commandId == null) {
            throw new IllegalArgumentException("commandId cannot be null");
        }
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
    }

    /**
     * 무작위 CommandId로 Envelope 생성.
     */
    public static <R> Envelope<R> of(Identity caller, Command<R> command, Instant issuedAt) {
        return new Envelope<>(CommandId.random(), caller, command, issuedAt);
    }
}
