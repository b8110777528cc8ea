package com.pharbit.ledger.core.model;

import java.time.Instant;

/**
 * 보관자 이전 이력 한 건. 배치별 append-only.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record CustodyTransfer(
    BatchId batchId,
    Identity from,
    Identity to,
    String reason,
    String location,
    Instant at
) {

    public CustodyTransfer {
        if (batchId == null || from == null || to == null || at == null) {
            throw new IllegalArgumentException("batchId, from, to and at cannot be null");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        reason = reason == null ? "" : reason;
    }
}
