package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.statemachine.BatchStatus;

import java.util.Set;

/**
 * 명령별 권한 판정.
 *
 * <p>모든 메서드는 보유 역할만으로 결정되는 순수 함수이며 저장소에 접근하지 않습니다.
 * 리듀서는 호출자의 역할을 조회한 뒤 이 판정을 적용합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class Permissions {

    private Permissions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean canManageRoles(Set<Role> held) {
        return held.contains(Role.ADMIN);
    }

    public static boolean canManageStakeholders(Set<Role> held) {
        return held.contains(Role.REGISTRAR);
    }

    public static boolean canCreateBatch(Set<Role> held) {
        return held.contains(Role.PRODUCER);
    }

    /**
     * 상태 변경 권한.
     *
     * <p>PRODUCER, DISTRIBUTOR, RETAILER는 모든 대상 상태로 변경을 요청할 수 있고,
     * REGULATOR는 RECALLED, EXPIRED로만 변경할 수 있습니다.
     * 간선 자체의 유효성은 별도로 검증됩니다.</p>
     */
    public static boolean canUpdateStatus(Set<Role> held, BatchStatus target) {
        if (held.contains(Role.PRODUCER) || held.contains(Role.DISTRIBUTOR) || held.contains(Role.RETAILER)) {
            return true;
        }
        return held.contains(Role.REGULATOR)
            && (target == BatchStatus.RECALLED || target == BatchStatus.EXPIRED);
    }

    public static boolean canDestroyBatch(Set<Role> held) {
        return held.contains(Role.REGULATOR);
    }

    public static boolean canHoldCustody(Set<Role> held) {
        return held.stream().anyMatch(Role::isCustodyRole);
    }

    public static boolean canReceiveCustody(Set<Role> held) {
        return held.stream().anyMatch(Role::isReceivingRole);
    }

    public static boolean canSetBounds(Set<Role> held) {
        return held.contains(Role.REGULATOR);
    }

    public static boolean canBindSensors(Set<Role> held) {
        return held.contains(Role.ADMIN);
    }

    /**
     * 텔레메트리 기록 권한.
     *
     * @param held 호출자 역할
     * @param boundToBatch 호출자가 대상 배치에 바인딩된 센서인지
     * @return IOT_GATEWAY이거나, SENSOR_DEVICE이면서 바인딩된 경우 true
     */
    public static boolean canRecordTelemetry(Set<Role> held, boolean boundToBatch) {
        return held.contains(Role.IOT_GATEWAY) || (held.contains(Role.SENSOR_DEVICE) && boundToBatch);
    }

    public static boolean canAddComplianceCheck(Set<Role> held) {
        return held.contains(Role.INSPECTOR) || held.contains(Role.AUDITOR);
    }

    public static boolean canUpdateCompliance(Set<Role> held) {
        return held.contains(Role.INSPECTOR) || held.contains(Role.AUDITOR) || held.contains(Role.REGULATOR);
    }

    public static boolean canRecordAudit(Set<Role> held) {
        return held.contains(Role.AUDITOR);
    }

    public static boolean canManageApprovals(Set<Role> held) {
        return held.contains(Role.REGULATOR);
    }

    public static boolean canManageOwners(Set<Role> held) {
        return held.contains(Role.ADMIN);
    }
}
