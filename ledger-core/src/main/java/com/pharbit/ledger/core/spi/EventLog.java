package com.pharbit.ledger.core.spi;

import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.event.LedgerEvent;

import java.util.List;

/**
 * Append-only, ordered event log.
 *
 * <p>The log assigns gap-free sequence numbers starting at 1. Appending only stores the event;
 * subscribers are notified by {@link #deliverPending()}, which callers invoke after releasing
 * whatever lock guarded the append. Subscriber failures must not affect the log or other
 * subscribers.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface EventLog {

    /**
     * Append one event.
     *
     * @param draft event content from the reducer
     * @param source envelope of the command that produced it
     * @return the stored event with its sequence number
     */
    LedgerEvent append(EventDraft draft, Envelope<?> source);

    /**
     * Notify subscribers of every stored event not yet delivered, in sequence order.
     *
     * <p>Each event is delivered once. When this method returns, every event appended before the
     * call has been delivered, by this thread or a concurrent caller.</p>
     */
    void deliverPending();

    /**
     * Read events in sequence order.
     *
     * @param fromSequence first sequence to include (1-based)
     * @param limit maximum number of events (positive)
     * @return events, empty if none
     */
    List<LedgerEvent> readFrom(long fromSequence, int limit);

    /**
     * @return last assigned sequence, 0 when empty
     */
    long lastSequence();

    void subscribe(EventSubscriber subscriber);

    void unsubscribe(EventSubscriber subscriber);
}
