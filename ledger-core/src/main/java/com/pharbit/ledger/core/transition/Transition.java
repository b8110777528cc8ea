package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.event.EventDraft;
import com.pharbit.ledger.core.outcome.ErrorKind;
import com.pharbit.ledger.core.outcome.Fail;
import com.pharbit.ledger.core.outcome.Ok;
import com.pharbit.ledger.core.outcome.Outcome;
import com.pharbit.ledger.core.spi.StateChange;

import java.util.List;

/**
 * 리듀서 평가 결과: 결과 값, 저장할 변경 목록, 이벤트 초안.
 *
 * <p>거부된 명령은 변경 목록이 비어 있고 이벤트 초안이 없습니다.</p>
 *
 * @param outcome 호출자에게 돌려줄 결과
 * @param changes 한 번에 커밋할 상태 변경
 * @param event 이벤트 초안 (거부 시 null)
 * @param <R> 결과 값 타입
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record Transition<R>(
    Outcome<R> outcome,
    List<StateChange> changes,
    EventDraft event
) {

    public Transition {
        if (outcome == null || changes == null) {
            throw new IllegalArgumentException("outcome and changes cannot be null");
        }
        if (outcome instanceof Ok && event == null) {
            throw new IllegalArgumentException("accepted transition requires an event");
        }
        if (outcome instanceof Fail && (!changes.isEmpty() || event != null)) {
            throw new IllegalArgumentException("rejected transition cannot carry changes or an event");
        }
        changes = List.copyOf(changes);
    }

    public static <R> Transition<R> accepted(R value, List<StateChange> changes, EventDraft event) {
        return new Transition<>(new Ok<>(value), changes, event);
    }

    public static <R> Transition<R> rejected(ErrorKind kind, String message) {
        return new Transition<>(new Fail<>(kind, message), List.of(), null);
    }

    public boolean isAccepted() {
        return outcome.isOk();
    }
}
