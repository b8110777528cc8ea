/**
 * Command outcomes and error taxonomy.
 *
 * <h2>Outcome Types</h2>
 * <ul>
 *   <li>{@link com.pharbit.ledger.core.outcome.Ok} - command applied, one event appended</li>
 *   <li>{@link com.pharbit.ledger.core.outcome.Fail} - command rejected with an {@link com.pharbit.ledger.core.outcome.ErrorKind}</li>
 * </ul>
 *
 * <h2>Fatal Errors</h2>
 * <p>{@link com.pharbit.ledger.core.outcome.LedgerInvariantViolation} is the only thrown failure;
 * it halts the engine rather than rejecting a single command.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.outcome;
