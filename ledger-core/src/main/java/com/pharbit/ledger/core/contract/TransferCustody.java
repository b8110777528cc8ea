package com.pharbit.ledger.core.contract;

import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.Identity;

/**
 * 보관자 이전. 호출자가 현재 보관자여야 합니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record TransferCustody(
    BatchId batchId,
    Identity newCustodian,
    String reason,
    String location
) implements Command<CustodyTransfer> {

    public TransferCustody {
        if (batchId == null || newCustodian == null) {
            throw new IllegalArgumentException("batchId, newCustodian cannot be null");
        }
    }

    @Override
    public CommandType type() {
        return CommandType.TRANSFER_CUSTODY;
    }
}
