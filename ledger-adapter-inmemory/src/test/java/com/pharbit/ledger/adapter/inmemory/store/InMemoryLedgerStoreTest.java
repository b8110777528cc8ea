package com.pharbit.ledger.adapter.inmemory.store;

import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.ComplianceRecord;
import com.pharbit.ledger.core.model.ComplianceRecordId;
import com.pharbit.ledger.core.model.ComplianceStatus;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.spi.StateChange;
import com.pharbit.ledger.core.statemachine.BatchStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryLedgerStore}.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Committed changes become visible through the view methods</li>
 *   <li>Compliance records are replaced in place by id</li>
 *   <li>Returned collections are immutable snapshots</li>
 * </ul>
 */
class InMemoryLedgerStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Identity PRODUCER = Identity.of("producer-1");
    private static final Identity DISTRIBUTOR = Identity.of("distributor-1");
    private static final Identity INSPECTOR = Identity.of("inspector-1");
    private static final BatchId B1 = BatchId.of("B1");

    private InMemoryLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
    }

    @Test
    void testCommit_WhenBatchAndTransferPut_ThenVisibleInView() {
        // Given
        Batch batch = batch(PRODUCER);
        CustodyTransfer transfer = new CustodyTransfer(B1, PRODUCER, DISTRIBUTOR, "shipment", "Dock 3", NOW);

        // When
        store.commit(List.of(
            new StateChange.PutBatch(batch),
            new StateChange.PutBatch(batch.withCustodian(DISTRIBUTOR, NOW)),
            new StateChange.AppendTransfer(transfer)
        ));

        // Then
        assertThat(store.batch(B1)).hasValueSatisfying(b -> assertThat(b.custodian()).isEqualTo(DISTRIBUTOR));
        assertThat(store.batches()).hasSize(1);
        assertThat(store.transfers(B1)).containsExactly(transfer);
        assertThat(store.transfers(BatchId.of("B2"))).isEmpty();
    }

    @Test
    void testRolesOf_WhenUnknownIdentity_ThenEmpty() {
        assertThat(store.rolesOf(PRODUCER)).isEmpty();

        store.commit(List.of(new StateChange.PutRoles(PRODUCER, Set.of(Role.PRODUCER))));

        assertThat(store.rolesOf(PRODUCER)).containsExactly(Role.PRODUCER);
    }

    @Test
    void testCommit_WhenComplianceRecordUpdated_ThenReplacedInPlace() {
        // Given
        ComplianceRecord first = record(1, ComplianceStatus.PENDING);
        ComplianceRecord second = record(2, ComplianceStatus.PENDING);
        store.commit(List.of(new StateChange.PutComplianceRecord(first), new StateChange.PutComplianceRecord(second)));

        // When
        ComplianceRecord updated = first.withStatus(ComplianceStatus.PASSED, true, "ok", INSPECTOR, NOW);
        store.commit(List.of(new StateChange.PutComplianceRecord(updated)));

        // Then
        assertThat(store.complianceRecords(B1)).containsExactly(updated, second);
    }

    @Test
    void testCommit_WhenSensorUnbound_ThenRemovedFromBindings() {
        Identity sensor = Identity.of("sensor-1");
        store.commit(List.of(new StateChange.PutSensorBinding(B1, sensor, true)));
        assertThat(store.boundSensors(B1)).containsExactly(sensor);

        store.commit(List.of(new StateChange.PutSensorBinding(B1, sensor, false)));
        assertThat(store.boundSensors(B1)).isEmpty();
    }

    @Test
    void testGovernance_WhenNothingCommitted_ThenEmptyState() {
        assertThat(store.governance()).isEqualTo(GovernanceState.empty());
        assertThat(store.defaultBounds()).isEmpty();
    }

    @Test
    void testViews_WhenModified_ThenThrowUnsupportedOperation() {
        store.commit(List.of(new StateChange.PutRoles(PRODUCER, Set.of(Role.PRODUCER)),
            new StateChange.PutBatch(batch(PRODUCER))));

        assertThatThrownBy(() -> store.rolesOf(PRODUCER).add(Role.ADMIN))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> store.batches().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testCommit_WhenNullChanges_ThenRejected() {
        assertThatThrownBy(() -> store.commit(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("changes cannot be null");
    }

    private static Batch batch(Identity custodian) {
        return new Batch(B1, "Amoxicillin 500mg", PRODUCER, 1000,
            NOW.minusSeconds(86_400), NOW.plusSeconds(86_400 * 365L), BatchStatus.PRODUCED, custodian, NOW, NOW);
    }

    private static ComplianceRecord record(int sequence, ComplianceStatus status) {
        return new ComplianceRecord(ComplianceRecordId.of(B1, sequence), "GMP", status, false, INSPECTOR,
            "", "", "", List.of(), NOW, INSPECTOR, NOW);
    }
}
