package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.statemachine.BatchStatus;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Permissions 테스트.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class PermissionsTest {

    @Test
    void canUpdateStatus_RegulatorOnlyForRecallOrExpiry() {
        Set<Role> regulator = Set.of(Role.REGULATOR);

        assertTrue(Permissions.canUpdateStatus(regulator, BatchStatus.RECALLED));
        assertTrue(Permissions.canUpdateStatus(regulator, BatchStatus.EXPIRED));
        assertFalse(Permissions.canUpdateStatus(regulator, BatchStatus.IN_TRANSIT));
    }

    @Test
    void canUpdateStatus_CustodyRolesForAnyTarget() {
        assertTrue(Permissions.canUpdateStatus(Set.of(Role.DISTRIBUTOR), BatchStatus.AT_PHARMACY));
        assertFalse(Permissions.canUpdateStatus(Set.of(Role.AUDITOR), BatchStatus.RECALLED));
    }

    @Test
    void canReceiveCustody_ProducerExcluded() {
        assertTrue(Permissions.canHoldCustody(Set.of(Role.PRODUCER)));
        assertFalse(Permissions.canReceiveCustody(Set.of(Role.PRODUCER)));
        assertTrue(Permissions.canReceiveCustody(Set.of(Role.RETAILER)));
    }

    @Test
    void canRecordTelemetry_SensorNeedsBinding() {
        assertTrue(Permissions.canRecordTelemetry(Set.of(Role.IOT_GATEWAY), false));
        assertTrue(Permissions.canRecordTelemetry(Set.of(Role.SENSOR_DEVICE), true));
        assertFalse(Permissions.canRecordTelemetry(Set.of(Role.SENSOR_DEVICE), false));
        assertFalse(Permissions.canRecordTelemetry(Set.of(), true));
    }

    @Test
    void complianceAndAudit_RoleSplit() {
        assertTrue(Permissions.canAddComplianceCheck(Set.of(Role.INSPECTOR)));
        assertFalse(Permissions.canAddComplianceCheck(Set.of(Role.REGULATOR)));
        assertTrue(Permissions.canUpdateCompliance(Set.of(Role.REGULATOR)));
        assertFalse(Permissions.canRecordAudit(Set.of(Role.INSPECTOR)));
        assertTrue(Permissions.canRecordAudit(Set.of(Role.AUDITOR)));
    }
}
