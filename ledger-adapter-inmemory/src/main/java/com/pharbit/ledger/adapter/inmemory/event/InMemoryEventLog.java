package com.pharbit.ledger.adapter.inmemory.event;

import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.event.LedgerEvent;
import com.pharbit.ledger.core.spi.EventLog;
import com.pharbit.ledger.core.spi.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventLog} SPI.
 *
 * <p>Appends are serialized on the instance monitor so sequence numbers are gap-free and match
 * append order. Delivery runs under a separate lock and advances a cursor, so subscribers see
 * every event once and in sequence order even when several threads deliver concurrently.
 * Subscribers are notified in registration order; a subscriber that throws is logged and
 * skipped.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventLog log = new InMemoryEventLog();
 * log.subscribe(event -&gt; exporter.write(event));
 *
 * LedgerEvent event = log.append(draft, envelope);   // sequence 1
 * log.deliverPending();                               // exporter receives sequence 1
 * List&lt;LedgerEvent&gt; all = log.readFrom(1, Integer.MAX_VALUE);
 * </pre>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final List<LedgerEvent> events = new ArrayList<>();
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Object deliveryLock = new Object();

    private int delivered;

    @Override
    public LedgerEvent append(EventDraft draft, Envelope<?> source) {
        if (draft == null || source == null) {
            throw new IllegalArgumentException("draft and source cannot be null");
        }
        synchronized (this) {
            LedgerEvent event = LedgerEvent.from(events.size() + 1L, draft, source);
            events.add(event);
            return event;
        }
    }

    @Override
    public void deliverPending() {
        synchronized (deliveryLock) {
            LedgerEvent next;
            while ((next = pendingAt(delivered)) != null) {
                delivered++;
                notifySubscribers(next);
            }
        }
    }

    private synchronized LedgerEvent pendingAt(int index) {
        return index < events.size() ? events.get(index) : null;
    }

    @Override
    public synchronized List<LedgerEvent> readFrom(long fromSequence, int limit) {
        if (fromSequence <= 0) {
            throw new IllegalArgumentException("fromSequence must be positive (current: " + fromSequence + ")");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (fromSequence > events.size()) {
            return List.of();
        }
        int from = (int) (fromSequence - 1);
        int to = (int) Math.min((long) from + limit, events.size());
        return List.copyOf(events.subList(from, to));
    }

    @Override
    public synchronized long lastSequence() {
        return events.size();
    }

    @Override
    public void subscribe(EventSubscriber subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        subscribers.add(subscriber);
    }

    @Override
    public void unsubscribe(EventSubscriber subscriber) {
        subscribers.remove(subscriber);
    }

    private void notifySubscribers(LedgerEvent event) {
        for (EventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event subscriber failed: sequence={}, type={}, subscriber={}",
                    event.sequence(), event.type(), subscriber, e);
            }
        }
    }
}
