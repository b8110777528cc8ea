package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.BindSensor;
import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.RecordTelemetry;
import com.pharbit.ledger.core.contract.SetBatchBounds;
import com.pharbit.ledger.core.contract.SetTelemetryBounds;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.TelemetryReading;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;

import java.time.Instant;
import java.util.List;

/**
 * Telemetry Validator 명령 처리.
 *
 * <p>측정값의 valid 플래그는 수집 시점의 유효 범위(배치별 범위 → 레저 기본 범위 → 정책 기본값 순)로
 * 한 번만 계산됩니다. 종료 상태 배치도 측정값을 받습니다.</p>
 */
final class TelemetryHandler {

    private final LedgerPolicy policy;

    TelemetryHandler(LedgerPolicy policy) {
        this.policy = policy;
    }

    Transition<TelemetryBounds> setBounds(LedgerView view, Envelope<?> envelope, SetTelemetryBounds command) {
        Guards.authorize(Permissions.canSetBounds(view.rolesOf(envelope.caller())), envelope);
        TelemetryBounds bounds = bounds(command.minTemperature(), command.maxTemperature(), command.maxHumidity());

        EventDraft event = boundsEvent(CommandType.SET_TELEMETRY_BOUNDS, "default", bounds);
        return Transition.accepted(bounds, List.of(new StateChange.PutDefaultBounds(bounds)), event);
    }

    Transition<TelemetryBounds> setBatchBounds(LedgerView view, Envelope<?> envelope, SetBatchBounds command) {
        Guards.authorize(Permissions.canSetBounds(view.rolesOf(envelope.caller())), envelope);
        Batch batch = Guards.batch(view, command.batchId());
        TelemetryBounds bounds = bounds(command.minTemperature(), command.maxTemperature(), command.maxHumidity());

        EventDraft event = boundsEvent(CommandType.SET_BATCH_BOUNDS, batch.id().getValue(), bounds);
        return Transition.accepted(bounds, List.of(new StateChange.PutBatchBounds(batch.id(), bounds)), event);
    }

    Transition<Boolean> bindSensor(LedgerView view, Envelope<?> envelope, BindSensor command) {
        Guards.authorize(Permissions.canBindSensors(view.rolesOf(envelope.caller())), envelope);
        Batch batch = Guards.batch(view, command.batchId());
        if (command.bound()) {
            Guards.require(view.rolesOf(command.device()).contains(Role.SENSOR_DEVICE), ErrorKind.BAD_INPUT,
                "device must hold SENSOR_DEVICE: " + command.device().getValue());
        }

        boolean changed = view.boundSensors(batch.id()).contains(command.device()) != command.bound();
        List<StateChange> changes = changed
            ? List.of(new StateChange.PutSensorBinding(batch.id(), command.device(), command.bound()))
            : List.of();
        EventDraft event = EventDraft.builder(CommandType.BIND_SENSOR, batch.id().getValue())
            .with("device", command.device().getValue())
            .with("bound", command.bound())
            .with("changed", changed)
            .build();
        return Transition.accepted(changed, changes, event);
    }

    Transition<TelemetryReading> record(LedgerView view, Envelope<?> envelope, RecordTelemetry command) {
        Instant now = envelope.issuedAt();
        boolean bound = view.boundSensors(command.batchId()).contains(envelope.caller());
        Guards.authorize(Permissions.canRecordTelemetry(view.rolesOf(envelope.caller()), bound), envelope);
        Batch batch = Guards.batch(view, command.batchId());

        // 1. 파라미터 검증
        String location = Guards.text(command.location(), "location");
        Guards.require(command.humidity() >= 0 && command.humidity() <= 100, ErrorKind.BAD_INPUT,
            "humidity must be within 0..100 (current: " + command.humidity() + ")");

        // 2. 타임스탬프 허용 창: [now - stalenessWindow, now]
        Guards.require(!command.timestamp().isAfter(now), ErrorKind.STALE_DATA,
            "timestamp is in the future (timestamp: " + command.timestamp() + ", now: " + now + ")");
        Guards.require(!command.timestamp().isBefore(now.minus(policy.stalenessWindow())), ErrorKind.STALE_DATA,
            "timestamp is older than " + policy.stalenessWindow() + " (timestamp: " + command.timestamp() + ")");

        // 3. 수집 시점 범위로 판정
        TelemetryBounds bounds = LedgerProjections.effectiveBounds(view, batch.id(), policy);
        boolean valid = bounds.admits(command.temperature(), command.humidity());
        TelemetryReading reading = new TelemetryReading(batch.id(), view.readings(batch.id()).size(),
            command.temperature(), command.humidity(), location, command.timestamp(), envelope.caller(), now, valid);

        EventDraft event = EventDraft.builder(CommandType.RECORD_TELEMETRY, batch.id().getValue())
            .with("index", reading.index())
            .with("temperature", reading.temperature())
            .with("humidity", reading.humidity())
            .with("location", location)
            .with("timestamp", reading.timestamp())
            .with("valid", valid)
            .build();
        return Transition.accepted(reading, List.of(new StateChange.AppendReading(reading)), event);
    }

    private static TelemetryBounds bounds(int minTemperature, int maxTemperature, int maxHumidity) {
        String violation = TelemetryBounds.violation(minTemperature, maxTemperature, maxHumidity);
        Guards.require(violation == null, ErrorKind.BAD_INPUT, violation);
        return new TelemetryBounds(minTemperature, maxTemperature, maxHumidity);
    }

    private static EventDraft boundsEvent(CommandType type, String entityId, TelemetryBounds bounds) {
        return EventDraft.builder(type, entityId)
            .with("minTemperature", bounds.minTemperature())
            .with("maxTemperature", bounds.maxTemperature())
            .with("maxHumidity", bounds.maxHumidity())
            .build();
    }
}
