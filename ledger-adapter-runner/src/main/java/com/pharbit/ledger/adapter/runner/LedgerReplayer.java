package com.pharbit.ledger.adapter.runner;

import com.pharbit.ledger.application.feed.EventFeed;
import com.pharbit.ledger.application.gateway.LedgerGateway;
import com.pharbit.ledger.core.event.LedgerEvent;
import com.pharbit.ledger.core.outcome.Fail;
import com.pharbit.ledger.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 이벤트 기록을 다른 엔진에 다시 적용하여 결정성을 검증.
 *
 * <p>각 이벤트가 담고 있는 원본 Envelope을 대상 게이트웨이에 순서대로 제출하고,
 * 대상 엔진이 만든 이벤트의 type, entityId, delta가 원본과 같은지 비교합니다.
 * 같은 genesis로 시작한 빈 엔진에 전체 기록을 재적용하면 divergence가 없어야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SerializingLedgerEngine fresh = new SerializingLedgerEngine(
 *     new InMemoryLedgerStore(), new InMemoryEventLog(), genesis, config);
 * ReplayResult result = new LedgerReplayer(fresh, fresh).replay(source.replay(1));
 * assert result.isDeterministic();
 * </pre>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public class LedgerReplayer {

    private static final Logger log = LoggerFactory.getLogger(LedgerReplayer.class);

    private final LedgerGateway gateway;
    private final EventFeed feed;

    /**
     * 생성자.
     *
     * @param gateway 재적용 대상 게이트웨이
     * @param feed 재적용 대상의 이벤트 피드
     */
    public LedgerReplayer(LedgerGateway gateway, EventFeed feed) {
        if (gateway == null || feed == null) {
            throw new IllegalArgumentException("gateway and feed cannot be null");
        }
        this.gateway = gateway;
        this.feed = feed;
    }

    /**
     * 이벤트 기록 재적용.
     *
     * @param history 원본 이벤트 (sequence 오름차순)
     * @return 재적용 결과
     */
    public ReplayResult replay(List<LedgerEvent> history) {
        log.info("Replay started: {} events", history.size());
        List<String> divergences = new ArrayList<>();

        for (LedgerEvent original : history) {
            long before = feed.lastSequence();
            Outcome<?> outcome = gateway.submit(original.source());

            if (outcome instanceof Fail<?> fail) {
                divergences.add("seq " + original.sequence() + " rejected on replay: "
                    + fail.kind() + " " + fail.message());
                continue;
            }
            List<LedgerEvent> produced = feed.replay(before + 1);
            if (produced.isEmpty()) {
                divergences.add("seq " + original.sequence() + " produced no event on replay");
                continue;
            }
            LedgerEvent replayed = produced.get(0);
            if (!sameContent(original, replayed)) {
                divergences.add("seq " + original.sequence() + " diverged: expected "
                    + original.delta() + " but was " + replayed.delta());
            }
        }

        if (divergences.isEmpty()) {
            log.info("Replay completed: {} events, deterministic", history.size());
        } else {
            log.warn("Replay completed: {} events, {} divergences", history.size(), divergences.size());
        }
        return new ReplayResult(history.size(), divergences);
    }

    private static boolean sameContent(LedgerEvent original, LedgerEvent replayed) {
        return original.type() == replayed.type()
            && original.entityId().equals(replayed.entityId())
            && original.actor().equals(replayed.actor())
            && original.delta().equals(replayed.delta());
    }
}
