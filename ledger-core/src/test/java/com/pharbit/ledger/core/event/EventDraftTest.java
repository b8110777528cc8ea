package com.pharbit.ledger.core.event;

import com.pharbit.ledger.core.contract.CommandType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventDraft 테스트.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class EventDraftTest {

    @Test
    void builder_KeepsInsertionOrderAndStringifies() {
        // When
        EventDraft draft = EventDraft.builder(CommandType.TRANSFER_CUSTODY, "B1")
            .with("from", "producer-1")
            .with("to", "distributor-1")
            .with("index", 0)
            .with("note", null)
            .build();

        // Then
        assertEquals(List.of("from", "to", "index", "note"), List.copyOf(draft.delta().keySet()));
        assertEquals("0", draft.delta().get("index"));
        assertEquals("", draft.delta().get("note"));
    }

    @Test
    void constructor_BlankEntityId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new EventDraft(CommandType.VOTE, " ", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new EventDraft(null, "1", Map.of()));
    }

    @Test
    void delta_IsImmutable() {
        EventDraft draft = new EventDraft(CommandType.SET_KYC, "p1", null);

        assertTrue(draft.delta().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> draft.delta().put("k", "v"));
    }
}
