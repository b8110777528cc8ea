package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;

/**
 * 핸들러 공통 가드. 조건을 만족하지 않으면 {@link CommandRejection}을 던집니다.
 */
final class Guards {

    private Guards() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void require(boolean condition, ErrorKind kind, String message) {
        if (!condition) {
            throw new CommandRejection(kind, message);
        }
    }

    static void authorize(boolean allowed, Envelope<?> envelope) {
        if (!allowed) {
            throw new CommandRejection(ErrorKind.UNAUTHORIZED,
                envelope.caller().getValue() + " is not authorized for " + envelope.command().type());
        }
    }

    static String text(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new CommandRejection(ErrorKind.BAD_INPUT, field + " cannot be blank");
        }
        return value;
    }

    static Batch batch(LedgerView view, BatchId batchId) {
        return view.batch(batchId)
            .orElseThrow(() -> new CommandRejection(ErrorKind.NOT_FOUND, "Batch not found: " + batchId.getValue()));
    }
}
