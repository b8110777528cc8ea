package com.pharbit.ledger.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static com.pharbit.ledger.core.statemachine.BatchStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchTransition 테스트.
 *
 * <ul>
 *   <li>정상 흐름: PRODUCED → IN_TRANSIT → AT_DISTRIBUTOR → AT_PHARMACY → DISPENSED</li>
 *   <li>비종료 상태에서 RECALLED/EXPIRED 허용</li>
 *   <li>종료 상태에서는 모든 전이 거부</li>
 *   <li>DESTROYED는 RECALLED/EXPIRED에서만 (폐기 경로)</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class BatchTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void isAllowed_FullForwardFlow_EachStepAllowed() {
        // Given
        BatchStatus[] flow = {PRODUCED, IN_TRANSIT, AT_DISTRIBUTOR, AT_PHARMACY, DISPENSED};

        // When / Then
        for (int i = 1; i < flow.length; i++) {
            assertTrue(BatchTransition.isAllowed(flow[i - 1], flow[i]), flow[i - 1] + " -> " + flow[i]);
        }
        assertTrue(DISPENSED.isTerminal());
    }

    @Test
    void allowedTargets_Produced_ForwardEdgeAndDisposals() {
        assertEquals(EnumSet.of(IN_TRANSIT, RECALLED, EXPIRED), BatchTransition.allowedTargets(PRODUCED));
    }

    @Test
    void allowedTargets_AtPharmacy_DispensedAndDisposals() {
        assertEquals(EnumSet.of(DISPENSED, RECALLED, EXPIRED), BatchTransition.allowedTargets(AT_PHARMACY));
    }

    @ParameterizedTest
    @EnumSource(value = BatchStatus.class, names = {"PRODUCED", "IN_TRANSIT", "AT_DISTRIBUTOR", "AT_PHARMACY"})
    void isAllowed_NonTerminalToRecalledOrExpired_True(BatchStatus from) {
        assertTrue(BatchTransition.isAllowed(from, RECALLED));
        assertTrue(BatchTransition.isAllowed(from, EXPIRED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void isAllowed_SkippingStep_False() {
        assertFalse(BatchTransition.isAllowed(IN_TRANSIT, DISPENSED));
        assertFalse(BatchTransition.isAllowed(PRODUCED, AT_PHARMACY));
    }

    @Test
    void isAllowed_BackwardsOrSame_False() {
        assertFalse(BatchTransition.isAllowed(AT_DISTRIBUTOR, IN_TRANSIT));
        assertFalse(BatchTransition.isAllowed(IN_TRANSIT, PRODUCED));
        assertFalse(BatchTransition.isAllowed(PRODUCED, PRODUCED));
    }

    @ParameterizedTest
    @EnumSource(value = BatchStatus.class, names = {"DISPENSED", "RECALLED", "EXPIRED", "DESTROYED"})
    void allowedTargets_FromTerminal_Empty(BatchStatus terminal) {
        assertTrue(BatchTransition.allowedTargets(terminal).isEmpty());
        for (BatchStatus target : BatchStatus.values()) {
            assertFalse(BatchTransition.isAllowed(terminal, target), terminal + " -> " + target);
        }
    }

    @Test
    void isAllowed_NullStatus_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> BatchTransition.allowedTargets(null));
        assertThrows(IllegalArgumentException.class, () -> BatchTransition.isAllowed(null, IN_TRANSIT));
        assertThrows(IllegalArgumentException.class, () -> BatchTransition.isAllowed(PRODUCED, null));
    }

    // ========== 폐기 경로 ==========

    @Test
    void isDisposable_OnlyRecalledOrExpired() {
        assertTrue(BatchTransition.isDisposable(RECALLED));
        assertTrue(BatchTransition.isDisposable(EXPIRED));
        assertFalse(BatchTransition.isDisposable(DISPENSED));
        assertFalse(BatchTransition.isDisposable(PRODUCED));
    }

    @Test
    void isStructurallyValid_IncludesDestructionAndUnchanged() {
        assertTrue(BatchTransition.isStructurallyValid(RECALLED, DESTROYED));
        assertTrue(BatchTransition.isStructurallyValid(DISPENSED, DISPENSED));
        assertTrue(BatchTransition.isStructurallyValid(PRODUCED, IN_TRANSIT));
        assertFalse(BatchTransition.isStructurallyValid(PRODUCED, DESTROYED));
        assertFalse(BatchTransition.isStructurallyValid(DISPENSED, PRODUCED));
        assertFalse(BatchTransition.isAllowed(RECALLED, DESTROYED));
    }
}
