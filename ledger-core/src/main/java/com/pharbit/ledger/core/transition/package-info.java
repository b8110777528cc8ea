/**
 * Pure transition function.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.pharbit.ledger.core.transition.LedgerReducer} - dispatches a command to its component handler</li>
 *   <li>{@link com.pharbit.ledger.core.transition.Permissions} - role predicates per command</li>
 *   <li>{@link com.pharbit.ledger.core.transition.LedgerInvariants} - structural checks before commit</li>
 *   <li>{@link com.pharbit.ledger.core.transition.LedgerProjections} - side-effect-free queries</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>{@link com.pharbit.ledger.core.transition.LedgerPolicy} holds the staleness window, voting
 * period range and default telemetry bounds; {@link com.pharbit.ledger.core.transition.LedgerGenesis}
 * seeds initial roles and the owner set.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.transition;
