package com.pharbit.ledger.core.model;

/**
 * Access Registry에서 부여/회수되는 권한 레이블.
 *
 * <p>역할은 서로 배타적이지 않으며, 하나의 Identity가 여러 역할을 동시에 보유할 수 있습니다.</p>
 *
 * <p><strong>역할 분류:</strong></p>
 * <ul>
 *   <li>관리: ADMIN, REGISTRAR</li>
 *   <li>공급망 보관: PRODUCER, DISTRIBUTOR, RETAILER</li>
 *   <li>텔레메트리: SENSOR_DEVICE (배치 바인딩 필요), IOT_GATEWAY (바인딩 불필요)</li>
 *   <li>규정 준수: INSPECTOR, AUDITOR, REGULATOR</li>
 *   <li>거버넌스: GOVERNANCE_OWNER (Owner 집합과 동기화)</li>
 * </ul>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public enum Role {

    ADMIN,
    REGISTRAR,
    PRODUCER,
    DISTRIBUTOR,
    RETAILER,
    SENSOR_DEVICE,
    IOT_GATEWAY,
    INSPECTOR,
    AUDITOR,
    REGULATOR,
    GOVERNANCE_OWNER;

    /**
     * 배치 보관자(custodian)가 될 수 있는 역할인지 확인.
     *
     * @return PRODUCER, DISTRIBUTOR, RETAILER 중 하나이면 true
     */
    public boolean isCustodyRole() {
        return this == PRODUCER || this == DISTRIBUTOR || this == RETAILER;
    }

    /**
     * 보관 이전을 받을 수 있는 역할인지 확인.
     *
     * @return DISTRIBUTOR 또는 RETAILER이면 true
     */
    public boolean isReceivingRole() {
        return this == DISTRIBUTOR || this == RETAILER;
    }
}
