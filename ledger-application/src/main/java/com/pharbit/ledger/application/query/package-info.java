/**
 * 조회 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.pharbit.ledger.application.query.LedgerQueries} - 컴포넌트별 읽기 전용 투영</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pharbit.ledger.application.query;
