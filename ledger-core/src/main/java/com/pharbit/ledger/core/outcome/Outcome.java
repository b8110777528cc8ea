package com.pharbit.ledger.core.outcome;

/**
 * 명령 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 명령이 적용되고 이벤트가 기록됨</li>
 *   <li>{@link Fail}: 명령이 거부됨, 상태 변경 및 이벤트 없음</li>
 * </ul>
 *
 * <p>레저 코어에는 재시도 정책이 없습니다. 재제출 여부는 호출자가
 * {@link ErrorKind#isRetryable()}를 참고해 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Batch&gt; outcome = gateway.submit(envelope);
 * if (outcome instanceof Fail&lt;Batch&gt; fail) {
 *     log.warn("rejected: {} {}", fail.kind(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 시 반환 값 타입
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(ErrorKind kind, String message) {
        return new Fail<>(kind, message);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 값
     * @throws IllegalStateException 실패 결과인 경우
     */
    default T getOrThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Fail<T> fail = (Fail<T>) this;
        throw new IllegalStateException("Outcome is a failure: " + fail.kind() + " - " + fail.message());
    }

    /**
     * 실패 종류 조회.
     *
     * @return 실패 종류, 성공이면 null
     */
    default ErrorKind errorKind() {
        return this instanceof Fail<T> fail ? fail.kind() : null;
    }
}
