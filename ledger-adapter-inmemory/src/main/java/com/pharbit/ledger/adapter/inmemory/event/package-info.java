/**
 * In-memory event feed.
 *
 * <p>Provides {@link com.pharbit.ledger.adapter.inmemory.event.InMemoryEventLog}, an ordered,
 * append-only implementation of {@link com.pharbit.ledger.core.spi.EventLog} with synchronous
 * subscriber notification.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.adapter.inmemory.event;
