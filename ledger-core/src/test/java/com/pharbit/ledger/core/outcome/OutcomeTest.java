package com.pharbit.ledger.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome (Ok / Fail) 테스트.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_ExposesValue() {
        Outcome<String> outcome = Outcome.ok("B1");

        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertEquals("B1", outcome.getOrThrow());
        assertNull(outcome.errorKind());
    }

    @Test
    void ok_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Ok<>(null));
    }

    @Test
    void fail_GetOrThrow_ThrowsWithKindAndMessage() {
        Outcome<String> outcome = Outcome.fail(ErrorKind.NOT_FOUND, "Batch not found: B9");

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, outcome::getOrThrow);
        assertEquals("Outcome is a failure: NOT_FOUND - Batch not found: B9", exception.getMessage());
        assertEquals(ErrorKind.NOT_FOUND, outcome.errorKind());
    }

    @Test
    void fail_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(ErrorKind.BAD_INPUT, " "));
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null, "message"));
    }

    @Test
    void recast_KeepsKindAndMessage() {
        Fail<String> fail = Fail.of(ErrorKind.STALE_DATA, "Reading too old");

        Fail<Integer> recast = fail.recast();

        assertEquals(ErrorKind.STALE_DATA, recast.kind());
        assertEquals("Reading too old", recast.message());
    }

    @Test
    void isRetryable_FollowsErrorKind() {
        assertTrue(Fail.of(ErrorKind.UNAUTHORIZED, "no role").isRetryable());
        assertTrue(Fail.of(ErrorKind.VOTING_CLOSED, "closed").isRetryable());
        assertFalse(Fail.of(ErrorKind.INVALID_TRANSITION, "bad edge").isRetryable());
        assertFalse(Fail.of(ErrorKind.ALREADY_VOTED, "twice").isRetryable());
    }

    @Test
    void invariantViolation_CarriesInvariantName() {
        LedgerInvariantViolation violation = new LedgerInvariantViolation("batch.initial-status", "must be PRODUCED");

        assertEquals("batch.initial-status", violation.getInvariant());
        assertEquals("batch.initial-status: must be PRODUCED", violation.getMessage());
    }
}
