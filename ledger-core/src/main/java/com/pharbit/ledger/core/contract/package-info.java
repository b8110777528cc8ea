/**
 * Command contracts.
 *
 * <h2>Submission</h2>
 * <p>Every mutation is a {@link com.pharbit.ledger.core.contract.Command} record wrapped in an
 * {@link com.pharbit.ledger.core.contract.Envelope} that carries the resolved caller and the logical
 * time used as "now" by the reducer.</p>
 *
 * <h2>Validation Split</h2>
 * <ul>
 *   <li>Record constructors reject {@code null} with {@link java.lang.IllegalArgumentException}</li>
 *   <li>Semantic checks (blank text, ranges, dates) become {@code BAD_INPUT} failures in the reducer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.contract;
