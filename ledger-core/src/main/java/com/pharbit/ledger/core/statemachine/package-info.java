/**
 * Batch and proposal lifecycles.
 *
 * <h2>Batch Status Graph</h2>
 * <ul>
 *   <li>PRODUCED → IN_TRANSIT → AT_DISTRIBUTOR → AT_PHARMACY → DISPENSED</li>
 *   <li>Any non-terminal status → RECALLED or EXPIRED</li>
 *   <li>RECALLED or EXPIRED → DESTROYED (disposal only)</li>
 * </ul>
 *
 * <h2>Proposal Phases</h2>
 * <p>OPEN → CLOSED_PENDING_EXECUTION → EXECUTED, derived from the deadline and executed flag.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.statemachine;
