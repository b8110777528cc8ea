package com.pharbit.ledger.core.spi;

import com.pharbit.ledger.core.event.LedgerEvent;

/**
 * Event feed consumer (audit export, dashboards, compliance reporting).
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(LedgerEvent event);
}
