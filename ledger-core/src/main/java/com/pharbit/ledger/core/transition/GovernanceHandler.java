package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.contract.AddOwner;
import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.CreateProposal;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.ExecuteProposal;
import com.pharbit.ledger.core.contract.RemoveOwner;
import com.pharbit.ledger.core.contract.SetQuorum;
import com.pharbit.ledger.core.contract.Vote;
import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.model.GovernanceProposal;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.GrantRoleAction;
import com.pharbit.ledger.core.model.ProposalAction;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.RevokeRoleAction;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.TelemetryBounds;
import com.pharbit.ledger.core.model.UpdateBoundsAction;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.spi.LedgerView;
import com.pharbit.ledger.core.spi.StateChange;
import com.pharbit.ledger.core.statemachine.ProposalPhase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Governance Module 명령 처리.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>마감 전 실행 시도: VOTING_CLOSED</li>
 *   <li>이미 실행된 제안: VOTING_CLOSED</li>
 *   <li>passed = yesVotes ≥ quorum AND yesVotes &gt; noVotes (실행 시점 정족수 기준, 한 번만 계산)</li>
 *   <li>통과 시 제안의 관리 작업을 같은 명령 안에서 적용</li>
 * </ul>
 */
final class GovernanceHandler {

    private final LedgerPolicy policy;

    GovernanceHandler(LedgerPolicy policy) {
        this.policy = policy;
    }

    Transition<GovernanceState> addOwner(LedgerView view, Envelope<?> envelope, AddOwner command) {
        Guards.authorize(Permissions.canManageOwners(view.rolesOf(envelope.caller())), envelope);
        GovernanceState current = view.governance();
        Guards.require(!current.isOwner(command.owner()), ErrorKind.INVALID_OWNER,
            "Already an owner: " + command.owner().getValue());

        GovernanceState next = current.withOwner(command.owner());
        List<StateChange> changes = new ArrayList<>();
        changes.add(new StateChange.PutGovernance(next));
        changes.addAll(AccessRegistryHandler.granting(view, command.owner(), Role.GOVERNANCE_OWNER));
        return Transition.accepted(next, changes, ownersEvent(CommandType.ADD_OWNER, command.owner().getValue(), next));
    }

    Transition<GovernanceState> removeOwner(LedgerView view, Envelope<?> envelope, RemoveOwner command) {
        Guards.authorize(Permissions.canManageOwners(view.rolesOf(envelope.caller())), envelope);
        GovernanceState current = view.governance();
        Guards.require(current.isOwner(command.owner()), ErrorKind.INVALID_OWNER,
            "Not an owner: " + command.owner().getValue());
        Guards.require(current.owners().size() > 1, ErrorKind.INVALID_OWNER, "Cannot remove the last owner");

        GovernanceState next = current.withoutOwner(command.owner());
        List<StateChange> changes = new ArrayList<>();
        changes.add(new StateChange.PutGovernance(next));
        changes.addAll(AccessRegistryHandler.revoking(view, command.owner(), Role.GOVERNANCE_OWNER));
        return Transition.accepted(next, changes,
            ownersEvent(CommandType.REMOVE_OWNER, command.owner().getValue(), next));
    }

    Transition<GovernanceState> setQuorum(LedgerView view, Envelope<?> envelope, SetQuorum command) {
        Guards.authorize(Permissions.canManageOwners(view.rolesOf(envelope.caller())), envelope);
        GovernanceState current = view.governance();
        Guards.require(command.quorum() >= 1 && command.quorum() <= current.owners().size(),
            ErrorKind.INVALID_QUORUM,
            "quorum must be within 1.." + current.owners().size() + " (current: " + command.quorum() + ")");

        GovernanceState next = current.withQuorum(command.quorum());
        return Transition.accepted(next, List.of(new StateChange.PutGovernance(next)),
            ownersEvent(CommandType.SET_QUORUM, "governance", next));
    }

    Transition<GovernanceProposal> createProposal(LedgerView view, Envelope<?> envelope, CreateProposal command) {
        GovernanceState current = view.governance();
        requireOwner(current, envelope);
        String description = Guards.text(command.description(), "description");
        Guards.require(policy.isVotingPeriodAllowed(command.votingPeriod()), ErrorKind.BAD_INPUT,
            "votingPeriod must be within " + policy.minVotingPeriod() + ".." + policy.maxVotingPeriod()
                + " (current: " + command.votingPeriod() + ")");
        validateAction(command.action());

        Instant now = envelope.issuedAt();
        ProposalId id = current.nextProposalId();
        GovernanceProposal proposal = GovernanceProposal.open(id, description, envelope.caller(), now,
            now.plus(command.votingPeriod()), command.action());

        EventDraft event = EventDraft.builder(CommandType.CREATE_PROPOSAL, String.valueOf(id.getValue()))
            .with("description", description)
            .with("deadline", proposal.deadline())
            .with("action", proposal.action().summary())
            .build();
        return Transition.accepted(proposal,
            List.of(new StateChange.PutGovernance(current.withProposalCreated()), new StateChange.PutProposal(proposal)),
            event);
    }

    Transition<GovernanceProposal> vote(LedgerView view, Envelope<?> envelope, Vote command) {
        requireOwner(view.governance(), envelope);
        GovernanceProposal current = proposal(view, command.proposalId());
        Guards.require(current.phaseAt(envelope.issuedAt()) == ProposalPhase.OPEN, ErrorKind.VOTING_CLOSED,
            "Voting closed for proposal " + command.proposalId().getValue());
        Guards.require(!current.hasVoted(envelope.caller()), ErrorKind.ALREADY_VOTED,
            envelope.caller().getValue() + " already voted on proposal " + command.proposalId().getValue());

        GovernanceProposal updated = current.withVote(envelope.caller(), command.support());
        EventDraft event = EventDraft.builder(CommandType.VOTE, String.valueOf(command.proposalId().getValue()))
            .with("support", command.support())
            .with("yesVotes", updated.yesVotes())
            .with("noVotes", updated.noVotes())
            .build();
        return Transition.accepted(updated, List.of(new StateChange.PutProposal(updated)), event);
    }

    Transition<Boolean> execute(LedgerView view, Envelope<?> envelope, ExecuteProposal command) {
        GovernanceState governance = view.governance();
        requireOwner(governance, envelope);
        GovernanceProposal current = proposal(view, command.proposalId());
        ProposalPhase phase = current.phaseAt(envelope.issuedAt());
        Guards.require(phase != ProposalPhase.EXECUTED, ErrorKind.VOTING_CLOSED,
            "Proposal already executed: " + command.proposalId().getValue());
        Guards.require(phase != ProposalPhase.OPEN, ErrorKind.VOTING_CLOSED,
            "Voting period not ended for proposal " + command.proposalId().getValue());

        // 1. 결과 고정
        boolean passed = current.yesVotes() >= governance.quorum() && current.yesVotes() > current.noVotes();
        List<StateChange> changes = new ArrayList<>();
        changes.add(new StateChange.PutProposal(current.executedWith(passed)));

        // 2. 통과 시 관리 작업 적용
        if (passed) {
            changes.addAll(applying(view, current.action()));
        }

        EventDraft event = EventDraft.builder(CommandType.EXECUTE_PROPOSAL,
                String.valueOf(command.proposalId().getValue()))
            .with("passed", passed)
            .with("yesVotes", current.yesVotes())
            .with("noVotes", current.noVotes())
            .with("quorum", governance.quorum())
            .with("action", current.action().summary())
            .with("actionApplied", passed && changes.size() > 1)
            .build();
        return Transition.accepted(passed, changes, event);
    }

    private static void validateAction(ProposalAction action) {
        if (action instanceof GrantRoleAction grant) {
            AccessRegistryHandler.requireDirectlyManaged(grant.role());
        } else if (action instanceof RevokeRoleAction revoke) {
            AccessRegistryHandler.requireDirectlyManaged(revoke.role());
        } else if (action instanceof UpdateBoundsAction update) {
            String violation = TelemetryBounds.violation(update.minTemperature(), update.maxTemperature(),
                update.maxHumidity());
            Guards.require(violation == null, ErrorKind.BAD_INPUT, violation);
        }
    }

    private static List<StateChange> applying(LedgerView view, ProposalAction action) {
        if (action instanceof GrantRoleAction grant) {
            return AccessRegistryHandler.granting(view, grant.grantee(), grant.role());
        }
        if (action instanceof RevokeRoleAction revoke) {
            return AccessRegistryHandler.revoking(view, revoke.holder(), revoke.role());
        }
        if (action instanceof UpdateBoundsAction update) {
            return List.of(new StateChange.PutDefaultBounds(update.toBounds()));
        }
        return List.of();
    }

    private static void requireOwner(GovernanceState governance, Envelope<?> envelope) {
        Guards.require(governance.isOwner(envelope.caller()), ErrorKind.UNAUTHORIZED,
            envelope.caller().getValue() + " is not a governance owner");
    }

    private static GovernanceProposal proposal(LedgerView view, ProposalId id) {
        return view.proposal(id)
            .orElseThrow(() -> new CommandRejection(ErrorKind.PROPOSAL_NOT_FOUND,
                "Proposal not found: " + id.getValue()));
    }

    private static EventDraft ownersEvent(CommandType type, String entityId, GovernanceState next) {
        return EventDraft.builder(type, entityId)
            .with("owners", next.owners().size())
            .with("quorum", next.quorum())
            .build();
    }
}
