package com.pharbit.ledger.core.model;

import java.util.UUID;

/**
 * 명령 제출 단위의 고유 식별자.
 *
 * <p>이벤트 피드의 각 이벤트는 자신을 만든 CommandId를 함께 기록하므로,
 * 외부 소비자는 이를 상관관계 키로 사용할 수 있습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public final class CommandId {

    private final String value;

    private CommandId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CommandId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CommandId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * CommandId 생성.
     *
     * @param value CommandId 값
     * @return CommandId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CommandId of(String value) {
        return new CommandId(value);
    }

    /**
     * 무작위 UUID 기반 CommandId 생성.
     *
     * @return 새 CommandId
     */
    public static CommandId random() {
        return new CommandId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandId commandId = (CommandId) o;
        return value.equals(commandId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CommandId{" + value + '}';
    }
}
