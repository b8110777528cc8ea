package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.GrantRole;
import com.pharbit.ledger.core.contract.RevokeRole;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Access Registry 명령 처리.
 *
 * <p>부여/회수는 멱등입니다. 이미 보유한 역할 부여나 보유하지 않은 역할 회수는
 * 상태 변경 없이 성공하며, 이벤트에는 {@code changed=false}가 기록됩니다.</p>
 *
 * <p>GOVERNANCE_OWNER는 Owner 집합과 동기화되므로 이 명령으로 직접 다룰 수 없습니다.</p>
 */
final class AccessRegistryHandler {

    Transition<Boolean> grant(LedgerView view, Envelope<?> envelope, GrantRole command) {
        Guards.authorize(Permissions.canManageRoles(view.rolesOf(envelope.caller())), envelope);
        requireDirectlyManaged(command.role());

        List<StateChange> changes = granting(view, command.identity(), command.role());
        return Transition.accepted(!changes.isEmpty(), changes,
            roleEvent(CommandType.GRANT_ROLE, command.identity(), command.role(), !changes.isEmpty()));
    }

    Transition<Boolean> revoke(LedgerView view, Envelope<?> envelope, RevokeRole command) {
        Guards.authorize(Permissions.canManageRoles(view.rolesOf(envelope.caller())), envelope);
        requireDirectlyManaged(command.role());

        List<StateChange> changes = revoking(view, command.identity(), command.role());
        return Transition.accepted(!changes.isEmpty(), changes,
            roleEvent(CommandType.REVOKE_ROLE, command.identity(), command.role(), !changes.isEmpty()));
    }

    /**
     * 역할 부여 변경. 이미 보유 중이면 빈 목록.
     */
    static List<StateChange> granting(LedgerView view, Identity identity, Role role) {
        Set<Role> held = roleSet(view.rolesOf(identity));
        if (!held.add(role)) {
            return List.of();
        }
        return List.of(new StateChange.PutRoles(identity, held));
    }

    /**
     * 역할 회수 변경. 보유하지 않았으면 빈 목록.
     */
    static List<StateChange> revoking(LedgerView view, Identity identity, Role role) {
        Set<Role> held = roleSet(view.rolesOf(identity));
        if (!held.remove(role)) {
            return List.of();
        }
        return List.of(new StateChange.PutRoles(identity, held));
    }

    static void requireDirectlyManaged(Role role) {
        Guards.require(role != Role.GOVERNANCE_OWNER, ErrorKind.BAD_INPUT,
            "GOVERNANCE_OWNER is managed through owner commands");
    }

    private static Set<Role> roleSet(Set<Role> roles) {
        return roles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles);
    }

    private static EventDraft roleEvent(CommandType type, Identity identity, Role role, boolean changed) {
        return EventDraft.builder(type, identity.getValue())
            .with("role", role)
            .with("changed", changed)
            .build();
    }
}
