package com.pharbit.ledger.adapter.runner;

import com.pharbit.ledger.adapter.inmemory.event.InMemoryEventLog;
import com.pharbit.ledger.adapter.inmemory.store.InMemoryLedgerStore;
import com.pharbit.ledger.core.contract.CommandType;
import com.pharbit.ledger.core.contract.CreateProposal;
import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.contract.ExecuteProposal;
import com.pharbit.ledger.core.contract.SetQuorum;
import com.pharbit.ledger.core.contract.Vote;
import com.pharbit.ledger.core.event.LedgerEvent;
import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.ProposalId;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.outcome.Outcome;
import com.pharbit.ledger.core.transition.LedgerGenesis;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SerializingLedgerEngine 동시성 테스트.
 *
 * <p>제안 실행이 정족수를 읽은 뒤 커밋하기 전에 정족수 변경이 끼어들 수 없는지 검증합니다.
 * 실행 스레드를 리듀서 안에서 멈춰 두고 다른 스레드에서 SetQuorum을 제출합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
class LedgerEngineConcurrencyTest {

    private static final Identity ADMIN = Identity.of("admin");
    private static final Identity OWNER_1 = Identity.of("owner-1");
    private static final Identity OWNER_2 = Identity.of("owner-2");
    private static final Identity OWNER_3 = Identity.of("owner-3");
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private LedgerGenesis genesis;
    private PausingLedgerStore store;
    private SerializingLedgerEngine engine;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        genesis = LedgerGenesis.builder()
            .grant(ADMIN, Role.ADMIN)
            .owner(OWNER_1)
            .owner(OWNER_2)
            .owner(OWNER_3)
            .quorum(2)
            .build();
        store = new PausingLedgerStore();
        engine = new SerializingLedgerEngine(store, new InMemoryEventLog(), genesis, new LedgerEngineConfig());
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        store.release.countDown();
        pool.shutdownNow();
    }

    @Test
    void executeProposal_판정중에는_정족수_변경이_대기() throws Exception {
        // given: 정족수 2에서 찬성 2표
        ProposalId id = engine.submit(Envelope.of(OWNER_1, new CreateProposal("raise limits", ONE_HOUR, null), NOW))
            .getOrThrow().id();
        engine.submit(Envelope.of(OWNER_1, new Vote(id, true), NOW)).getOrThrow();
        engine.submit(Envelope.of(OWNER_2, new Vote(id, true), NOW)).getOrThrow();
        Instant afterDeadline = NOW.plus(ONE_HOUR);

        // when: 실행 스레드가 정족수를 읽는 지점에서 멈춘 동안 정족수 변경 제출
        Future<Outcome<Boolean>> execute = pool.submit(() -> {
            store.pauseOn(Thread.currentThread());
            return engine.submit(Envelope.of(OWNER_3, new ExecuteProposal(id), afterDeadline));
        });
        assertThat(store.entered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Outcome<GovernanceState>> setQuorum =
            pool.submit(() -> engine.submit(Envelope.of(ADMIN, new SetQuorum(3), afterDeadline)));

        // then: 실행이 커밋될 때까지 정족수 변경은 진행되지 않음
        assertThatThrownBy(() -> setQuorum.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        store.release.countDown();

        assertThat(execute.get(5, TimeUnit.SECONDS).getOrThrow()).isTrue();
        assertThat(setQuorum.get(5, TimeUnit.SECONDS).getOrThrow().quorum()).isEqualTo(3);

        List<LedgerEvent> history = engine.replay(1);
        assertThat(history).extracting(LedgerEvent::type).endsWith(
            CommandType.EXECUTE_PROPOSAL, CommandType.SET_QUORUM);
        assertThat(history.get(history.size() - 2).delta())
            .containsEntry("quorum", "2")
            .containsEntry("passed", "true");
    }

    @Test
    void executeProposal_정족수_변경과_경합해도_재적용_결과_동일() throws Exception {
        // given
        ProposalId id = engine.submit(Envelope.of(OWNER_1, new CreateProposal("raise limits", ONE_HOUR, null), NOW))
            .getOrThrow().id();
        engine.submit(Envelope.of(OWNER_1, new Vote(id, true), NOW)).getOrThrow();
        engine.submit(Envelope.of(OWNER_2, new Vote(id, true), NOW)).getOrThrow();
        Instant afterDeadline = NOW.plus(ONE_HOUR);

        Future<Outcome<Boolean>> execute = pool.submit(() -> {
            store.pauseOn(Thread.currentThread());
            return engine.submit(Envelope.of(OWNER_3, new ExecuteProposal(id), afterDeadline));
        });
        assertThat(store.entered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Outcome<GovernanceState>> setQuorum =
            pool.submit(() -> engine.submit(Envelope.of(ADMIN, new SetQuorum(3), afterDeadline)));
        store.release.countDown();
        execute.get(5, TimeUnit.SECONDS);
        setQuorum.get(5, TimeUnit.SECONDS);

        // when
        SerializingLedgerEngine fresh = new SerializingLedgerEngine(
            new InMemoryLedgerStore(), new InMemoryEventLog(), genesis, new LedgerEngineConfig());
        ReplayResult result = new LedgerReplayer(fresh, fresh).replay(engine.replay(1));

        // then
        assertThat(result.isDeterministic()).isTrue();
        assertThat(fresh.getProposal(id).getOrThrow().passed()).isTrue();
    }

    /**
     * 지정한 스레드가 governance()를 처음 읽을 때 한 번 멈추는 저장소.
     */
    private static final class PausingLedgerStore extends InMemoryLedgerStore {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile Thread pausedThread;

        void pauseOn(Thread thread) {
            this.pausedThread = thread;
        }

        @Override
        public GovernanceState governance() {
            if (Thread.currentThread() == pausedThread) {
                pausedThread = null;
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return super.governance();
        }
    }
}
