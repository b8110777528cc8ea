/**
 * 이벤트 피드 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.pharbit.ledger.application.feed.EventFeed} - 구독 및 재조회</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pharbit.ledger.application.feed;
