package com.pharbit.ledger.application.gateway;

import com.pharbit.ledger.core.contract.Envelope;
import com.pharbit.ledger.core.outcome.Outcome;

/**
 * 레저 명령 제출 창구 (command surface).
 *
 * <p>명령 하나는 원자적이고 직렬화 가능한 트랜잭션으로 적용됩니다.
 * 같은 엔티티를 대상으로 하는 동시 명령은 순서대로 적용되어, 뒤에 적용되는 명령은
 * 앞 명령의 결과 상태를 보고 전제 조건을 다시 검사합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Envelope&lt;CustodyTransfer&gt; envelope = Envelope.of(producer,
 *     new TransferCustody(batchId, distributor, "ship", "Warehouse A"), clock.instant());
 * Outcome&lt;CustodyTransfer&gt; outcome = gateway.submit(envelope);
 *
 * if (outcome.isOk()) {
 *     // 상태 커밋 + 이벤트 1건 기록 완료
 * } else {
 *     // 상태 변경 없음
 *     ErrorKind kind = outcome.errorKind();
 * }
 * </pre>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public interface LedgerGateway {

    /**
     * 명령 제출.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>명령이 읽고 쓰는 엔티티 잠금 획득 (고정 순서)</li>
     *   <li>리듀서로 평가</li>
     *   <li>구조적 불변식 검사</li>
     *   <li>상태 커밋 + 이벤트 추가</li>
     * </ol>
     *
     * @param envelope 명령 Envelope
     * @param <R> 결과 값 타입
     * @return 성공 시 {@code Ok}, 거부 시 {@code Fail}
     * @throws IllegalArgumentException envelope가 null인 경우
     * @throws IllegalStateException 엔진이 불변식 위반으로 정지된 경우
     */
    <R> Outcome<R> submit(Envelope<R> envelope);
}
