package com.pharbit.ledger.core.spi;

import java.util.List;

/**
 * Ledger state storage.
 *
 * <p>This SPI adds a single write operation to {@link LedgerView}. A commit carries every
 * {@link StateChange} produced by one command and must be applied atomically: concurrent
 * readers observe either none or all of the changes.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: all changes of a commit become visible together</li>
 *   <li>Order: changes are applied in list order</li>
 *   <li>Append semantics: {@code Append*} changes never replace existing entries</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface LedgerStore extends LedgerView {

    /**
     * Apply the state changes of one command atomically.
     *
     * @param changes changes in application order (may be empty)
     * @throws IllegalArgumentException if changes is null
     */
    void commit(List<StateChange> changes);
}
