package com.pharbit.ledger.core.event;

import com.pharbit.ledger.core.contract.CommandType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 리듀서가 만드는 이벤트 초안. 순번과 호출자 정보는 엔진이 커밋 시점에 채웁니다.
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record EventDraft(
    CommandType type,
    String entityId,
    Map<String, String> delta
) {

    public EventDraft {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        delta = delta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(delta));
    }

    public static Builder builder(CommandType type, String entityId) {
        return new Builder(type, entityId);
    }

    /**
     * delta 키 순서를 유지하는 빌더.
     */
    public static final class Builder {

        private final CommandType type;
        private final String entityId;
        private final Map<String, String> delta = new LinkedHashMap<>();

        private Builder(CommandType type, String entityId) {
            this.type = type;
            this.entityId = entityId;
        }

        public Builder with(String key, Object value) {
            delta.put(key, Objects.toString(value, ""));
            return this;
        }

        public EventDraft build() {
            return new EventDraft(type, entityId, delta);
        }
    }
}
