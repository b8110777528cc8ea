/**
 * In-memory ledger state storage.
 *
 * <p>Provides {@link com.pharbit.ledger.adapter.inmemory.store.InMemoryLedgerStore}, a
 * read/write-locked implementation of {@link com.pharbit.ledger.core.spi.LedgerStore} suitable for
 * tests, demos and event-replay rebuilds.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.adapter.inmemory.store;
