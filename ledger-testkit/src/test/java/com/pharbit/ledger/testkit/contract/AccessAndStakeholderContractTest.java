package com.pharbit.ledger.testkit.contract;

import com.pharbit.ledger.core.contract.GrantRole;
import com.pharbit.ledger.core.contract.RegisterStakeholder;
import com.pharbit.ledger.core.contract.RevokeRole;
import com.pharbit.ledger.core.contract.SetActive;
import com.pharbit.ledger.core.contract.SetKyc;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.model.StakeholderRecord;
import com.pharbit.ledger.core.outcome.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for the access registry and stakeholder directory.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class AccessAndStakeholderContractTest extends AbstractLedgerContractTest {

    private static final Identity ALICE = Identity.of("alice");

    @Test
    void testGenesis_RolesAndOwnersInstalled() {
        assertThat(engine.hasRole(ADMIN, Role.ADMIN)).isTrue();
        assertThat(engine.hasRole(REGISTRAR, Role.REGISTRAR)).isTrue();
        assertThat(engine.rolesOf(OWNER_2)).containsExactly(Role.GOVERNANCE_OWNER);
        assertThat(engine.owners()).containsExactly(OWNER_1, OWNER_2, OWNER_3);
        assertThat(engine.quorum()).isEqualTo(2);
        assertThat(engine.lastSequence()).isZero();
    }

    @Test
    void testGrantAndRevoke_Idempotent() {
        // When
        Boolean granted = accept(ADMIN, new GrantRole(ALICE, Role.INSPECTOR));
        Boolean grantedAgain = accept(ADMIN, new GrantRole(ALICE, Role.INSPECTOR));

        // Then
        assertThat(granted).isTrue();
        assertThat(grantedAgain).isFalse();
        assertThat(engine.hasRole(ALICE, Role.INSPECTOR)).isTrue();
        assertThat(engine.hasAnyRole(ALICE, Role.AUDITOR, Role.INSPECTOR)).isTrue();
        assertThat(engine.hasAnyRole(ALICE, Role.AUDITOR, Role.REGULATOR)).isFalse();

        // When
        Boolean revoked = accept(ADMIN, new RevokeRole(ALICE, Role.INSPECTOR));
        Boolean revokedAgain = accept(ADMIN, new RevokeRole(ALICE, Role.INSPECTOR));

        // Then
        assertThat(revoked).isTrue();
        assertThat(revokedAgain).isFalse();
        assertThat(engine.rolesOf(ALICE)).isEmpty();
    }

    @Test
    void testRoleManagement_NonAdmin_Unauthorized() {
        assertRejected(submit(REGISTRAR, new GrantRole(ALICE, Role.PRODUCER)), ErrorKind.UNAUTHORIZED);
        assertRejected(submit(ALICE, new RevokeRole(ADMIN, Role.ADMIN)), ErrorKind.UNAUTHORIZED);
        assertThat(engine.rolesOf(ALICE)).isEmpty();
        assertThat(engine.hasRole(ADMIN, Role.ADMIN)).isTrue();
    }

    @Test
    void testRegister_ActiveWithoutKycAndRoleGranted() {
        // When
        StakeholderRecord record = accept(REGISTRAR, new RegisterStakeholder(ALICE, "Alice Pharma", Role.PRODUCER));

        // Then
        assertThat(record.active()).isTrue();
        assertThat(record.kycCompleted()).isFalse();
        assertThat(record.registeredAt()).isEqualTo(now);
        assertThat(engine.hasRole(ALICE, Role.PRODUCER)).isTrue();
        assertThat(engine.getStakeholder(ALICE).getOrThrow()).isEqualTo(record);
    }

    @Test
    void testRegister_InvalidRequests_Rejected() {
        accept(REGISTRAR, new RegisterStakeholder(ALICE, "Alice Pharma", Role.PRODUCER));

        assertRejected(submit(REGISTRAR, new RegisterStakeholder(ALICE, "Again", Role.RETAILER)),
            ErrorKind.ALREADY_REGISTERED);
        assertRejected(submit(REGISTRAR, new RegisterStakeholder(Identity.of("bob"), " ", Role.RETAILER)),
            ErrorKind.BAD_INPUT);
        assertRejected(submit(REGISTRAR, new RegisterStakeholder(Identity.of("bob"), "Bob", Role.GOVERNANCE_OWNER)),
            ErrorKind.BAD_INPUT);
        assertRejected(submit(ADMIN, new RegisterStakeholder(Identity.of("bob"), "Bob", Role.RETAILER)),
            ErrorKind.UNAUTHORIZED);
        assertThat(engine.hasRole(ALICE, Role.RETAILER)).isFalse();
        assertThat(engine.listStakeholders()).hasSize(1);
    }

    @Test
    void testKycAndActivation_UpdatedInPlace() {
        // Given
        accept(REGISTRAR, new RegisterStakeholder(ALICE, "Alice Pharma", Role.DISTRIBUTOR));

        // When
        accept(REGISTRAR, new SetKyc(ALICE, true, "KYC-001"));
        StakeholderRecord deactivated = accept(REGISTRAR, new SetActive(ALICE, false));

        // Then
        assertThat(deactivated.kycCompleted()).isTrue();
        assertThat(deactivated.kycReference()).isEqualTo("KYC-001");
        assertThat(deactivated.active()).isFalse();
        assertThat(deactivated.role()).isEqualTo(Role.DISTRIBUTOR);
    }

    @Test
    void testUnknownStakeholder_NotRegistered() {
        assertRejected(submit(REGISTRAR, new SetKyc(ALICE, true, "x")), ErrorKind.NOT_REGISTERED);
        assertRejected(submit(REGISTRAR, new SetActive(ALICE, false)), ErrorKind.NOT_REGISTERED);
        assertRejected(engine.getStakeholder(ALICE), ErrorKind.NOT_REGISTERED);
    }

    @Test
    void testListStakeholders_RegistrationOrder() {
        registerSupplyChain();

        assertThat(engine.listStakeholders()).extracting(StakeholderRecord::identity)
            .containsExactly(PRODUCER, DISTRIBUTOR, RETAILER);
    }
}
