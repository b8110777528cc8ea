/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that storage adapters implement to host ledger state and
 * the event feed.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.pharbit.ledger.core.spi.LedgerView} - read-only state projections</li>
 *   <li>{@link com.pharbit.ledger.core.spi.LedgerStore} - atomic commit of {@link com.pharbit.ledger.core.spi.StateChange}s</li>
 *   <li>{@link com.pharbit.ledger.core.spi.EventLog} - ordered append-only event log with subscribers</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., ledger-adapter-inmemory) provide concrete implementations.
 * The core never depends on a specific persistence engine.</p>
 *
 * @since 1.0.0
 * @author Pharbit Ledger Team
 */
package com.pharbit.ledger.core.spi;
