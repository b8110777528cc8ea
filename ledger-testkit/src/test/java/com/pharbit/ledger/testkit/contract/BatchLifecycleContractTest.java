package com.pharbit.ledger.testkit.contract;

import com.pharbit.ledger.core.contract.CreateBatch;
import com.pharbit.ledger.core.contract.DestroyBatch;
import com.pharbit.ledger.core.contract.UpdateStatus;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.StatusChange;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.outcome.Outcome;
import com.pharbit.ledger.core.statemachine.BatchStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for the batch status graph.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Forward edges only, one step at a time</li>
 *   <li>Terminal statuses reject every further update</li>
 *   <li>Recall and destruction by the regulator</li>
 *   <li>Creation parameter validation</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class BatchLifecycleContractTest extends AbstractLedgerContractTest {

    @Test
    void testStatusGraph_WhenSkippingSteps_InvalidTransition() {
        // Given
        registerSupplyChain();
        BatchId b1 = createBatch("B1");

        // When
        Outcome<Batch> inTransit = submit(PRODUCER, new UpdateStatus(b1, BatchStatus.IN_TRANSIT, "shipped"));
        Outcome<Batch> dispensed = submit(PRODUCER, new UpdateStatus(b1, BatchStatus.DISPENSED, "skip"));

        // Then
        assertThat(inTransit.getOrThrow().status()).isEqualTo(BatchStatus.IN_TRANSIT);
        assertRejected(dispensed, ErrorKind.INVALID_TRANSITION);
        assertThat(engine.getBatch(b1).getOrThrow().status()).isEqualTo(BatchStatus.IN_TRANSIT);
    }

    @Test
    void testStatusGraph_FullForwardPath_RecordsHistory() {
        // Given
        registerSupplyChain();
        BatchId b1 = createBatch("B1");

        // When
        accept(PRODUCER, new UpdateStatus(b1, BatchStatus.IN_TRANSIT, "shipped"));
        accept(DISTRIBUTOR, new UpdateStatus(b1, BatchStatus.AT_DISTRIBUTOR, "received"));
        accept(DISTRIBUTOR, new UpdateStatus(b1, BatchStatus.AT_PHARMACY, "delivered"));
        Batch dispensed = accept(RETAILER, new UpdateStatus(b1, BatchStatus.DISPENSED, "sold"));

        // Then
        assertThat(dispensed.status()).isEqualTo(BatchStatus.DISPENSED);
        List<StatusChange> history = engine.getStatusHistory(b1);
        assertThat(history).extracting(StatusChange::to).containsExactly(
            BatchStatus.IN_TRANSIT, BatchStatus.AT_DISTRIBUTOR, BatchStatus.AT_PHARMACY, BatchStatus.DISPENSED);
        assertThat(history.get(3).changedBy()).isEqualTo(RETAILER);
        assertThat(history.get(0).from()).isEqualTo(BatchStatus.PRODUCED);
    }

    @ParameterizedTest
    @EnumSource(BatchStatus.class)
    void testTerminalStatus_AnyUpdate_InvalidTransition(BatchStatus target) {
        // Given: a recalled batch
        registerSupplyChain();
        BatchId b1 = createBatch("B1");
        accept(REGULATOR, new UpdateStatus(b1, BatchStatus.RECALLED, "contamination"));

        // When
        Outcome<Batch> outcome = submit(PRODUCER, new UpdateStatus(b1, target, "retry"));

        // Then
        assertRejected(outcome, ErrorKind.INVALID_TRANSITION);
    }

    @Test
    void testRegulator_RecallThenDestroy_Destroyed() {
        // Given
        registerSupplyChain();
        BatchId b1 = createBatch("B1");
        accept(PRODUCER, new UpdateStatus(b1, BatchStatus.IN_TRANSIT, "shipped"));

        // When
        accept(REGULATOR, new UpdateStatus(b1, BatchStatus.RECALLED, "contamination"));
        Batch destroyed = accept(REGULATOR, new DestroyBatch(b1, "incinerated"));

        // Then
        assertThat(destroyed.status()).isEqualTo(BatchStatus.DESTROYED);
        assertThat(engine.getStatusHistory(b1)).extracting(StatusChange::to)
            .containsExactly(BatchStatus.IN_TRANSIT, BatchStatus.RECALLED, BatchStatus.DESTROYED);
        assertRejected(submit(REGULATOR, new DestroyBatch(b1, "again")), ErrorKind.INVALID_TRANSITION);
    }

    @Test
    void testDestroy_WhenNotDisposable_InvalidTransition() {
        // Given
        registerSupplyChain();
        BatchId b1 = createBatch("B1");

        // When / Then
        assertRejected(submit(REGULATOR, new DestroyBatch(b1, "early")), ErrorKind.INVALID_TRANSITION);
        assertRejected(submit(PRODUCER, new DestroyBatch(b1, "early")), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void testRegulator_ForwardMove_Unauthorized() {
        // Given
        registerSupplyChain();
        BatchId b1 = createBatch("B1");

        // When
        Outcome<Batch> outcome = submit(REGULATOR, new UpdateStatus(b1, BatchStatus.IN_TRANSIT, "move"));

        // Then
        assertRejected(outcome, ErrorKind.UNAUTHORIZED);
    }

    @Test
    void testUpdateStatus_UnknownBatch_NotFound() {
        registerSupplyChain();

        Outcome<Batch> outcome = submit(PRODUCER, new UpdateStatus(BatchId.of("NOPE"), BatchStatus.IN_TRANSIT, ""));

        assertRejected(outcome, ErrorKind.NOT_FOUND);
        assertRejected(engine.getBatch(BatchId.of("NOPE")), ErrorKind.NOT_FOUND);
    }

    @Test
    void testCreateBatch_InitialState_ProducedAndHeldByCustodian() {
        // Given
        registerSupplyChain();

        // When
        Batch batch = accept(PRODUCER, new CreateBatch(BatchId.of("B1"), "Insulin", PRODUCER, 1000,
            now.minus(Duration.ofDays(2)), now.plus(Duration.ofDays(365)), DISTRIBUTOR));

        // Then
        assertThat(batch.status()).isEqualTo(BatchStatus.PRODUCED);
        assertThat(batch.custodian()).isEqualTo(DISTRIBUTOR);
        assertThat(batch.createdAt()).isEqualTo(now);
        assertThat(engine.getTransferHistory(batch.id())).isEmpty();
        assertThat(engine.getStatusHistory(batch.id())).isEmpty();
    }

    @Test
    void testCreateBatch_InvalidParameters_BadInput() {
        // Given
        registerSupplyChain();
        createBatch("B1");
        BatchId b2 = BatchId.of("B2");

        // When / Then
        assertRejected(submit(PRODUCER, new CreateBatch(BatchId.of("B1"), "Dup", PRODUCER, 10,
            now, now.plus(Duration.ofDays(30)), PRODUCER)), ErrorKind.BAD_INPUT);
        assertRejected(submit(PRODUCER, new CreateBatch(b2, "Zero", PRODUCER, 0,
            now, now.plus(Duration.ofDays(30)), PRODUCER)), ErrorKind.BAD_INPUT);
        assertRejected(submit(PRODUCER, new CreateBatch(b2, " ", PRODUCER, 10,
            now, now.plus(Duration.ofDays(30)), PRODUCER)), ErrorKind.BAD_INPUT);
        assertRejected(submit(PRODUCER, new CreateBatch(b2, "Expired", PRODUCER, 10,
            now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1)), PRODUCER)), ErrorKind.BAD_INPUT);
        assertRejected(submit(PRODUCER, new CreateBatch(b2, "Unknown custodian", PRODUCER, 10,
            now, now.plus(Duration.ofDays(30)), REGULATOR)), ErrorKind.BAD_INPUT);
        assertRejected(submit(PRODUCER, new CreateBatch(b2, "Not a producer", DISTRIBUTOR, 10,
            now, now.plus(Duration.ofDays(30)), PRODUCER)), ErrorKind.BAD_INPUT);
        assertThat(engine.listBatches()).hasSize(1);
    }

    @Test
    void testCreateBatch_CallerWithoutProducerRole_Unauthorized() {
        registerSupplyChain();

        Outcome<Batch> outcome = submit(DISTRIBUTOR, new CreateBatch(BatchId.of("B1"), "Insulin", PRODUCER, 5,
            now, now.plus(Duration.ofDays(30)), PRODUCER));

        assertRejected(outcome, ErrorKind.UNAUTHORIZED);
        assertThat(engine.listBatches()).isEmpty();
    }

    @Test
    void testListBatches_CreationOrder() {
        registerSupplyChain();

        createBatch("B1");
        createBatch("B2");
        createBatch("B3");

        assertThat(engine.listBatches()).extracting(b -> b.id().getValue()).containsExactly("B1", "B2", "B3");
    }
}
