/**
 * Ledger domain model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.pharbit.ledger.core.model.Identity} - resolved caller or participant</li>
 *   <li>{@link com.pharbit.ledger.core.model.BatchId} - external batch number</li>
 *   <li>{@link com.pharbit.ledger.core.model.CommandId} - submission identifier carried into events</li>
 *   <li>{@link com.pharbit.ledger.core.model.ProposalId}, {@link com.pharbit.ledger.core.model.ApprovalId} - sequential ids</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <p>All entities are immutable records; a mutation produces a new record that replaces the
 * stored one inside a single atomic commit.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.model;
