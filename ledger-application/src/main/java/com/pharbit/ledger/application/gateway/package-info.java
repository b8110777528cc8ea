/**
 * 명령 제출 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.pharbit.ledger.application.gateway.LedgerGateway} - Envelope 제출, Outcome 반환</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code SerializingLedgerEngine}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.pharbit.ledger.application.gateway;
