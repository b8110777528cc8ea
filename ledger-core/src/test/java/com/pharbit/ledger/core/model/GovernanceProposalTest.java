package com.pharbit.ledger.core.model;

import com.pharbit.ledger.core.statemachine.ProposalPhase;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GovernanceProposal 테스트.
 *
 * <ul>
 *   <li>마감 전 OPEN, 마감 시각부터 CLOSED_PENDING_EXECUTION</li>
 *   <li>실행 후 EXECUTED</li>
 *   <li>투표 집계</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class GovernanceProposalTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant DEADLINE = Instant.parse("2026-03-02T00:00:00Z");
    private static final Identity PROPOSER = Identity.of("owner-1");

    private GovernanceProposal open() {
        return GovernanceProposal.open(ProposalId.of(1), "Raise humidity ceiling", PROPOSER,
            CREATED, DEADLINE, ProposalAction.none());
    }

    @Test
    void phaseAt_BeforeDeadline_Open() {
        assertEquals(ProposalPhase.OPEN, open().phaseAt(DEADLINE.minusMillis(1)));
    }

    @Test
    void phaseAt_AtDeadline_ClosedPendingExecution() {
        assertEquals(ProposalPhase.CLOSED_PENDING_EXECUTION, open().phaseAt(DEADLINE));
    }

    @Test
    void phaseAt_Executed_Executed() {
        GovernanceProposal executed = open().executedWith(true);

        assertEquals(ProposalPhase.EXECUTED, executed.phaseAt(CREATED));
        assertTrue(executed.passed());
        assertTrue(ProposalPhase.EXECUTED.isTerminal());
    }

    @Test
    void withVote_CountsSupportAndRecordsVoter() {
        // When
        GovernanceProposal voted = open()
            .withVote(Identity.of("owner-1"), true)
            .withVote(Identity.of("owner-2"), false);

        // Then
        assertEquals(1, voted.yesVotes());
        assertEquals(1, voted.noVotes());
        assertTrue(voted.hasVoted(Identity.of("owner-2")));
        assertFalse(voted.hasVoted(Identity.of("owner-3")));
    }

    @Test
    void constructor_PassedWithoutExecution_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new GovernanceProposal(
            ProposalId.of(1), "x", PROPOSER, CREATED, DEADLINE, 0, 0, null, false, true, null));
    }

    @Test
    void constructor_NullAction_DefaultsToNone() {
        GovernanceProposal proposal = new GovernanceProposal(
            ProposalId.of(1), "x", PROPOSER, CREATED, DEADLINE, 0, 0, null, false, false, null);

        assertEquals(ProposalAction.none(), proposal.action());
        assertTrue(proposal.voters().isEmpty());
    }
}
