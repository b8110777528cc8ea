package com.pharbit.ledger.core.model;

import com.pharbit.ledger.core.statemachine.BatchStatus;

import java.time.Instant;

/**
 * 의약품 배치.
 *
 * <p>생성 이후 변경 가능한 필드는 status, custodian (및 갱신 시각) 뿐입니다.
 * 나머지 필드는 생성 시점에 고정됩니다.</p>
 *
 * @param id 배치 식별자
 * @param productName 제품명
 * @param producer 생산자 Identity
 * @param quantity 수량 (양수)
 * @param manufactureDate 제조일
 * @param expiryDate 유효기간 만료일
 * @param status 현재 상태
 * @param custodian 현재 보관자
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 상태/보관자 변경 시각
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Batch(
    BatchId id,
    String productName,
    Identity producer,
    long quantity,
    Instant manufactureDate,
    Instant expiryDate,
    BatchStatus status,
    Identity custodian,
    Instant createdAt,
    Instant updatedAt
) {

    public Batch {
        if (id == null || producer == null || custodian == null || status == null) {
            throw new IllegalArgumentException(
                "id, producer, custodian and status cannot be null (id: " + id + ")"
            );
        }
        if (productName == null || productName.isBlank()) {
            throw new IllegalArgumentException("productName cannot be null or blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive (current: " + quantity + ")");
        }
        if (manufactureDate == null || expiryDate == null || createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("Batch timestamps cannot be null (id: " + id + ")");
        }
    }

    public Batch withStatus(BatchStatus next, Instant at) {
        return new Batch(id, productName, producer, quantity, manufactureDate, expiryDate,
            next, custodian, createdAt, at);
    }

    public Batch withCustodian(Identity next, Instant at) {
        return new Batch(id, productName, producer, quantity, manufactureDate, expiryDate,
            status, next, createdAt, at);
    }

    /**
     * 생성 이후 불변이어야 하는 필드가 동일한지 확인.
     *
     * @param other 비교 대상
     * @return 동일 배치의 생성 정보가 같으면 true
     */
    public boolean sameOrigin(Batch other) {
        return id.equals(other.id)
            && productName.equals(other.productName)
            && producer.equals(other.producer)
            && quantity == other.quantity
            && manufactureDate.equals(other.manufactureDate)
            && expiryDate.equals(other.expiryDate)
            && createdAt.equals(other.createdAt);
    }
}
