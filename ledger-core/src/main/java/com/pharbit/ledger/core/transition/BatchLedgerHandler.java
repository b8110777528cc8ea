package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.CreateBatch;
import com.pharbit.ledger.core.contract.DestroyBatch;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.TransferCustody;
import com.pharbit.ledger.core.contract.UpdateStatus;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.Batch;
import com.pharbit.ledger.core.model.CustodyTransfer;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.model.StatusChange;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;
import com.pharbit.ledger.core.statemachine.BatchStatus;
import com.pharbit.ledger.core.statemachine.BatchTransition;

import java.time.Instant;
import java.util.List;

/**
 * Batch Ledger 명령 처리.
 *
 * <p><strong>검증 순서 (보관자 이전):</strong></p>
 * <ol>
 *   <li>배치 존재 (NOT_FOUND)</li>
 *   <li>호출자 = 현재 보관자 (NOT_CUSTODIAN)</li>
 *   <li>배치가 종료 상태가 아님 (INVALID_TRANSITION)</li>
 *   <li>새 보관자: 본인 아님, 등록, 활성, KYC 완료, 수령 역할 보유 (BAD_INPUT)</li>
 * </ol>
 *
 * <p>보관자 유효성은 지정 시점에만 검증합니다. 이후 비활성화되어도 배치는 그대로 남습니다.</p>
 */
final class BatchLedgerHandler {

    Transition<Batch> create(LedgerView view, Envelope<?> envelope, CreateBatch command) {
        Instant now = envelope.issuedAt();
        Guards.authorize(Permissions.canCreateBatch(view.rolesOf(envelope.caller())), envelope);

        // 1. 파라미터 검증
        String productName = Guards.text(command.productName(), "productName");
        Guards.require(view.batch(command.batchId()).isEmpty(), ErrorKind.BAD_INPUT,
            "Batch already exists: " + command.batchId().getValue());
        Guards.require(command.quantity() > 0, ErrorKind.BAD_INPUT,
            "quantity must be positive (current: " + command.quantity() + ")");
        Instant floor = command.manufactureDate().isAfter(now) ? command.manufactureDate() : now;
        Guards.require(command.expiryDate().isAfter(floor), ErrorKind.BAD_INPUT,
            "expiryDate must be after manufactureDate and now (expiry: " + command.expiryDate() + ")");

        // 2. 생산자/보관자 검증
        Guards.require(Permissions.canCreateBatch(view.rolesOf(command.producer())), ErrorKind.BAD_INPUT,
            "producer must hold PRODUCER: " + command.producer().getValue());
        StakeholderRecord custodian = view.stakeholder(command.custodian())
            .orElseThrow(() -> new CommandRejection(ErrorKind.BAD_INPUT,
                "custodian is not registered: " + command.custodian().getValue()));
        Guards.require(custodian.active(), ErrorKind.BAD_INPUT,
            "custodian is inactive: " + command.custodian().getValue());
        Guards.require(Permissions.canHoldCustody(view.rolesOf(command.custodian())), ErrorKind.BAD_INPUT,
            "custodian lacks a custody role: " + command.custodian().getValue());

        Batch batch = new Batch(command.batchId(), productName, command.producer(), command.quantity(),
            command.manufactureDate(), command.expiryDate(), BatchStatus.PRODUCED, command.custodian(), now, now);
        EventDraft event = EventDraft.builder(CommandType.CREATE_BATCH, batch.id().getValue())
            .with("productName", productName)
            .with("producer", batch.producer().getValue())
            .with("quantity", batch.quantity())
            .with("manufactureDate", batch.manufactureDate())
            .with("expiryDate", batch.expiryDate())
            .with("status", batch.status())
            .with("custodian", batch.custodian().getValue())
            .build();
        return Transition.accepted(batch, List.of(new StateChange.PutBatch(batch)), event);
    }

    Transition<Batch> updateStatus(LedgerView view, Envelope<?> envelope, UpdateStatus command) {
        Guards.authorize(Permissions.canUpdateStatus(view.rolesOf(envelope.caller()), command.newStatus()), envelope);
        Batch current = Guards.batch(view, command.batchId());

        Guards.require(BatchTransition.isAllowed(current.status(), command.newStatus()), ErrorKind.INVALID_TRANSITION,
            String.format("Invalid status transition: %s → %s", current.status(), command.newStatus()));

        return statusChanged(envelope, current, command.newStatus(), command.reason(), CommandType.UPDATE_STATUS);
    }

    Transition<Batch> destroy(LedgerView view, Envelope<?> envelope, DestroyBatch command) {
        Guards.authorize(Permissions.canDestroyBatch(view.rolesOf(envelope.caller())), envelope);
        Batch current = Guards.batch(view, command.batchId());

        Guards.require(BatchTransition.isDisposable(current.status()), ErrorKind.INVALID_TRANSITION,
            String.format("Invalid status transition: %s → %s", current.status(), BatchStatus.DESTROYED));

        return statusChanged(envelope, current, BatchStatus.DESTROYED, command.reason(), CommandType.DESTROY_BATCH);
    }

    Transition<CustodyTransfer> transfer(LedgerView view, Envelope<?> envelope, TransferCustody command) {
        Identity caller = envelope.caller();
        Identity next = command.newCustodian();
        Batch current = Guards.batch(view, command.batchId());

        // 1. 현재 보관자 확인
        Guards.require(current.custodian().equals(caller), ErrorKind.NOT_CUSTODIAN,
            caller.getValue() + " is not the custodian of " + current.id().getValue());
        Guards.require(!current.status().isTerminal(), ErrorKind.INVALID_TRANSITION,
            "Cannot transfer a batch in terminal status " + current.status());

        // 2. 새 보관자 검증
        Guards.require(!next.equals(caller), ErrorKind.BAD_INPUT, "Cannot transfer to current custodian");
        String location = Guards.text(command.location(), "location");
        StakeholderRecord receiver = view.stakeholder(next)
            .orElseThrow(() -> new CommandRejection(ErrorKind.BAD_INPUT,
                "new custodian is not registered: " + next.getValue()));
        Guards.require(receiver.active(), ErrorKind.BAD_INPUT, "new custodian is inactive: " + next.getValue());
        Guards.require(receiver.kycCompleted(), ErrorKind.BAD_INPUT,
            "new custodian has not completed KYC: " + next.getValue());
        Guards.require(Permissions.canReceiveCustody(view.rolesOf(next)), ErrorKind.BAD_INPUT,
            "new custodian lacks a receiving role: " + next.getValue());

        // 3. 이력 기록 및 포인터 갱신
        CustodyTransfer transfer = new CustodyTransfer(current.id(), caller, next, command.reason(), location,
            envelope.issuedAt());
        Batch updated = current.withCustodian(next, envelope.issuedAt());
        EventDraft event = EventDraft.builder(CommandType.TRANSFER_CUSTODY, current.id().getValue())
            .with("from", caller.getValue())
            .with("to", next.getValue())
            .with("reason", transfer.reason())
            .with("location", location)
            .build();
        return Transition.accepted(transfer,
            List.of(new StateChange.PutBatch(updated), new StateChange.AppendTransfer(transfer)), event);
    }

    private static Transition<Batch> statusChanged(Envelope<?> envelope, Batch current, BatchStatus target,
                                                   String reason, CommandType type) {
        Batch updated = current.withStatus(target, envelope.issuedAt());
        StatusChange change = new StatusChange(current.id(), current.status(), target, envelope.caller(), reason,
            envelope.issuedAt());
        EventDraft event = EventDraft.builder(type, current.id().getValue())
            .with("from", current.status())
            .with("to", target)
            .with("reason", change.reason())
            .build();
        return Transition.accepted(updated,
            List.of(new StateChange.PutBatch(updated), new StateChange.AppendStatusChange(change)), event);
    }
}
