package com.pharbit.ledger.application.feed;

import com.pharbit.ledger.core.event.LedgerEvent;
import com.pharbit.ledger.core.spi.EventSubscriber;

import java.util.List;

/**
 * 이벤트 피드.
 *
 * <p>성공한 명령마다 정확히 하나의 이벤트가 순서대로 기록됩니다. 외부 소비자(감사 내보내기,
 * 대시보드, 규정 준수 보고)는 구독하거나 처음부터 다시 읽을 수 있습니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface EventFeed {

    /**
     * 이후 기록되는 이벤트 구독.
     *
     * @param subscriber 구독자 (예외를 던져도 다른 구독자와 명령 처리에 영향 없음)
     */
    void subscribe(EventSubscriber subscriber);

    void unsubscribe(EventSubscriber subscriber);

    /**
     * 저장된 이벤트 재조회.
     *
     * @param fromSequence 시작 순번 (1부터)
     * @return fromSequence 이후 모든 이벤트 (순번 순)
     */
    List<LedgerEvent> replay(long fromSequence);

    long lastSequence();
}
