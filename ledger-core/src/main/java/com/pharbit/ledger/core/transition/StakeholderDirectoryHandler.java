package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.RegisterStakeholder;
import com.pharbit.ledger.core.contract.SetActive;
import com.pharbit.ledger.core.contract.SetKyc;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;

import java.util.ArrayList;
import java.util.List;

/**
 * Stakeholder Directory 명령 처리. 세 명령 모두 REGISTRAR 전용입니다.
 */
final class StakeholderDirectoryHandler {

    Transition<StakeholderRecord> register(LedgerView view, Envelope<?> envelope, RegisterStakeholder command) {
        Guards.authorize(Permissions.canManageStakeholders(view.rolesOf(envelope.caller())), envelope);
        String name = Guards.text(command.name(), "name");
        AccessRegistryHandler.requireDirectlyManaged(command.role());
        Guards.require(view.stakeholder(command.identity()).isEmpty(), ErrorKind.ALREADY_REGISTERED,
            "Stakeholder already registered: " + command.identity().getValue());

        // 1. 조직 기록 생성
        StakeholderRecord record = StakeholderRecord.registered(command.identity(), name, command.role(),
            envelope.issuedAt());

        // 2. 같은 명령 안에서 역할 부여
        List<StateChange> changes = new ArrayList<>();
        changes.add(new StateChange.PutStakeholder(record));
        List<StateChange> grant = AccessRegistryHandler.granting(view, command.identity(), command.role());
        changes.addAll(grant);

        EventDraft event = EventDraft.builder(CommandType.REGISTER_STAKEHOLDER, command.identity().getValue())
            .with("name", name)
            .with("role", command.role())
            .with("roleGranted", !grant.isEmpty())
            .build();
        return Transition.accepted(record, changes, event);
    }

    Transition<StakeholderRecord> setKyc(LedgerView view, Envelope<?> envelope, SetKyc command) {
        Guards.authorize(Permissions.canManageStakeholders(view.rolesOf(envelope.caller())), envelope);
        StakeholderRecord current = registered(view, command.identity());

        StakeholderRecord updated = current.withKyc(command.completed(), command.reference());
        EventDraft event = EventDraft.builder(CommandType.SET_KYC, command.identity().getValue())
            .with("kycCompleted", command.completed())
            .with("kycReference", command.reference())
            .build();
        return Transition.accepted(updated, List.of(new StateChange.PutStakeholder(updated)), event);
    }

    Transition<StakeholderRecord> setActive(LedgerView view, Envelope<?> envelope, SetActive command) {
        Guards.authorize(Permissions.canManageStakeholders(view.rolesOf(envelope.caller())), envelope);
        StakeholderRecord current = registered(view, command.identity());

        StakeholderRecord updated = current.withActive(command.active());
        EventDraft event = EventDraft.builder(CommandType.SET_ACTIVE, command.identity().getValue())
            .with("from", current.active())
            .with("to", command.active())
            .build();
        return Transition.accepted(updated, List.of(new StateChange.PutStakeholder(updated)), event);
    }

    private static StakeholderRecord registered(LedgerView view, Identity identity) {
        return view.stakeholder(identity)
            .orElseThrow(() -> new CommandRejection(ErrorKind.NOT_REGISTERED,
                "Stakeholder not registered: " + identity.getValue()));
    }
}
