package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.outcome.ErrorKind;

/**
 * 가드 실패. 리듀서 경계에서 {@link com.pharbit.ledger.core.outcome.Fail}로 변환되며 밖으로 나가지 않습니다.
 */
final class CommandRejection extends RuntimeException {

    private final ErrorKind kind;

    CommandRejection(ErrorKind kind, String message) {
        super(message, null, false, false);
        this.kind = kind;
    }

    ErrorKind kind() {
        return kind;
    }
}
