package com.pharbit.ledger.core.event;

import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.model.CommandId;
import com.pharbit.ledger.core.model.Identity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공한 명령 하나가 남기는 불변 이벤트.
 *
 * <p>sequence는 1부터 시작하여 간격 없이 증가하며, 저장소 커밋 순서와 일치합니다.
 * {@code source}는 원본 Envelope로, 빈 엔진에 다시 제출하여 상태를 재구성할 때 사용됩니다.</p>
 *
 * @param sequence 전역 순번
 * @param commandId 원본 제출 식별자
 * @param type 명령 종류
 * @param entityId 영향받은 엔티티 식별자 (예: 배치 번호, 제안 번호)
 * @param actor 호출자
 * @param delta 결과 상태 변화 (키 순서 유지)
 * @param occurredAt 논리 시각
 * @param source 원본 Envelope
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record LedgerEvent(
    long sequence,
    CommandId commandId,
    CommandType type,
    String entityId,
    Identity actor,
    Map<String, String> delta,
    Instant occurredAt,
    Envelope<?> source
) {

    public LedgerEvent {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (commandId == null || type == null || actor == null || occurredAt == null || source == null) {
            throw new IllegalArgumentException("LedgerEvent fields cannot be null (sequence: " + sequence + ")");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        delta = delta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(delta));
    }

    /**
     * 초안과 Envelope로부터 이벤트 생성.
     */
    public static LedgerEvent from(long sequence, EventDraft draft, Envelope<?> source) {
        return new LedgerEvent(sequence, source.commandId(), draft.type(), draft.entityId(),
            source.caller(), draft.delta(), source.issuedAt(), source);
    }
}
