/**
 * 원장 엔진 구현 패키지.
 *
 * <p>SerializingLedgerEngine은 명령별 엔티티 잠금으로 충돌하는 명령만 직렬화하고,
 * 불변식 검사와 커밋, 이벤트 추가를 하나의 커밋 모니터 안에서 수행합니다.
 * LedgerReplayer는 이벤트 기록을 새 엔진에 재적용하여 같은 결과가 나오는지 검증합니다.</p>
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
package com.pharbit.ledger.adapter.runner;
