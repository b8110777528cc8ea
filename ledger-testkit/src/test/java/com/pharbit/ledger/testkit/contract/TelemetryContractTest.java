package com.pharbit.ledger.testkit.contract;

import com.pharbit.ledger.core.contract.BindSensor;
import com.pharbit.ledger.core.contract.GrantRole;
import com.pharbit.ledger.core.contract.RecordTelemetry;
import com.pharbit.ledger.core.contract.SetBatchBounds;
import com.pharbit.ledger.core.contract.SetTelemetryBounds;
import com.pharbit.ledger.core.model.BatchId;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for telemetry validation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Readings are judged against the bounds in force when recorded</li>
 *   <li>Later bound changes never flip an existing reading</li>
 *   <li>Timestamp window and humidity range</li>
 *   <li>Sensor binding and gateway authorization</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class TelemetryContractTest extends AbstractLedgerContractTest {

    private static final Identity GATEWAY = Identity.of("gateway-1");
    private static final Identity SENSOR = Identity.of("sensor-1");

    private BatchId b1;

    @BeforeEach
    void setUpTelemetry() {
        registerSupplyChain();
        b1 = createBatch("B1");
        accept(ADMIN, new GrantRole(GATEWAY, Role.IOT_GATEWAY));
        accept(ADMIN, new GrantRole(SENSOR, Role.SENSOR_DEVICE));
    }

    @Test
    void testValidity_FixedAtRecordTime_NotRetroactive() {
        // Given
        accept(REGULATOR, new SetTelemetryBounds(20, 80, 90));

        // When
        TelemetryReading first = accept(GATEWAY, new RecordTelemetry(b1, 50, 40, "X", now));
        accept(REGULATOR, new SetTelemetryBounds(60, 90, 90));
        TelemetryReading second = accept(GATEWAY, new RecordTelemetry(b1, 50, 40, "X", now));

        // Then
        assertThat(first.valid()).isTrue();
        assertThat(second.valid()).isFalse();
        assertThat(engine.readingAt(b1, 0).getOrThrow().valid()).isTrue();
        assertThat(engine.latestReading(b1).getOrThrow()).isEqualTo(second);
        assertThat(engine.telemetryHistory(b1).getOrThrow()).containsExactly(first, second);
    }

    @Test
    void testReading_OutOfRangeHumidityOrTemperature_StoredAsInvalid() {
        // Given
        accept(REGULATOR, new SetTelemetryBounds(20, 80, 60));

        // When
        TelemetryReading humid = accept(GATEWAY, new RecordTelemetry(b1, 50, 75, "X", now));
        TelemetryReading cold = accept(GATEWAY, new RecordTelemetry(b1, 10, 40, "X", now));
        TelemetryReading edge = accept(GATEWAY, new RecordTelemetry(b1, 80, 60, "X", now));

        // Then
        assertThat(humid.valid()).isFalse();
        assertThat(cold.valid()).isFalse();
        assertThat(edge.valid()).isTrue();
        assertThat(engine.telemetryHistory(b1).getOrThrow()).extracting(TelemetryReading::index)
            .containsExactly(0, 1, 2);
    }

    @Test
    void testTimestamp_OutsideWindow_StaleData() {
        // When
        Outcome<TelemetryReading> future =
            submit(GATEWAY, new RecordTelemetry(b1, 50, 40, "X", now.plusSeconds(1)));
        Outcome<TelemetryReading> stale =
            submit(GATEWAY, new RecordTelemetry(b1, 50, 40, "X", now.minus(Duration.ofDays(2))));
        Outcome<TelemetryReading> recent =
            submit(GATEWAY, new RecordTelemetry(b1, 50, 40, "X", now.minus(Duration.ofHours(23))));

        // Then
        assertRejected(future, ErrorKind.STALE_DATA);
        assertRejected(stale, ErrorKind.STALE_DATA);
        assertThat(recent.isOk()).isTrue();
        assertThat(engine.telemetryHistory(b1).getOrThrow()).hasSize(1);
    }

    @Test
    void testInvalidInput_BadInput() {
        assertRejected(submit(GATEWAY, new RecordTelemetry(b1, 50, 101, "X", now)), ErrorKind.BAD_INPUT);
        assertRejected(submit(GATEWAY, new RecordTelemetry(b1, 50, -1, "X", now)), ErrorKind.BAD_INPUT);
        assertRejected(submit(GATEWAY, new RecordTelemetry(b1, 50, 40, "", now)), ErrorKind.BAD_INPUT);
        assertRejected(submit(GATEWAY, new RecordTelemetry(BatchId.of("NOPE"), 50, 40, "X", now)),
            ErrorKind.NOT_FOUND);
    }

    @Test
    void testSensor_OnlyWhenBound_Authorized() {
        // Given: unbound sensor
        assertRejected(submit(SENSOR, new RecordTelemetry(b1, 50, 40, "X", now)), ErrorKind.UNAUTHORIZED);

        // When
        Boolean bound = accept(ADMIN, new BindSensor(b1, SENSOR, true));
        Boolean again = accept(ADMIN, new BindSensor(b1, SENSOR, true));
        TelemetryReading reading = accept(SENSOR, new RecordTelemetry(b1, 50, 40, "Truck 4", now));
        accept(ADMIN, new BindSensor(b1, SENSOR, false));

        // Then
        assertThat(bound).isTrue();
        assertThat(again).isFalse();
        assertThat(reading.device()).isEqualTo(SENSOR);
        assertRejected(submit(SENSOR, new RecordTelemetry(b1, 50, 40, "X", now)), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void testBindSensor_DeviceWithoutSensorRole_BadInput() {
        assertRejected(submit(ADMIN, new BindSensor(b1, GATEWAY, true)), ErrorKind.BAD_INPUT);
        assertRejected(submit(REGULATOR, new BindSensor(b1, SENSOR, true)), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void testBounds_BatchOverrideThenDefaultThenPolicy() {
        // Given
        BatchId b2 = createBatch("B2");

        // Then: policy default before anything is set
        assertThat(engine.telemetryBounds(b1)).isEqualTo(new TelemetryBounds(-200, 400, 90));

        // When
        accept(REGULATOR, new SetTelemetryBounds(20, 80, 70));
        accept(REGULATOR, new SetBatchBounds(b1, 2, 8, 50));

        // Then
        assertThat(engine.telemetryBounds(b1)).isEqualTo(new TelemetryBounds(2, 8, 50));
        assertThat(engine.telemetryBounds(b2)).isEqualTo(new TelemetryBounds(20, 80, 70));
        assertThat(accept(GATEWAY, new RecordTelemetry(b1, 20, 40, "X", now)).valid()).isFalse();
        assertThat(accept(GATEWAY, new RecordTelemetry(b2, 20, 40, "X", now)).valid()).isTrue();
    }

    @Test
    void testSetBounds_InvalidOrUnauthorized_Rejected() {
        assertRejected(submit(REGULATOR, new SetTelemetryBounds(80, 20, 50)), ErrorKind.BAD_INPUT);
        assertRejected(submit(REGULATOR, new SetTelemetryBounds(20, 80, 101)), ErrorKind.BAD_INPUT);
        assertRejected(submit(ADMIN, new SetTelemetryBounds(20, 80, 50)), ErrorKind.UNAUTHORIZED);
        assertRejected(submit(REGULATOR, new SetBatchBounds(BatchId.of("NOPE"), 2, 8, 50)), ErrorKind.NOT_FOUND);
    }

    @Test
    void testQueries_EmptyOrMissing_Failures() {
        assertRejected(engine.latestReading(b1), ErrorKind.NOT_FOUND);
        assertRejected(engine.readingAt(b1, 0), ErrorKind.OUT_OF_BOUNDS);
        assertRejected(engine.telemetryHistory(BatchId.of("NOPE")), ErrorKind.NOT_FOUND);
        assertThat(engine.telemetryHistory(b1).getOrThrow()).isEmpty();
    }
}
