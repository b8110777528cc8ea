/**
 * Event feed model.
 *
 * <p>Each accepted command yields exactly one {@link com.pharbit.ledger.core.event.LedgerEvent}.
 * Rejected commands yield none.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.event;
