package com.ryuqq.conductor.core.outcome;

/**
 * Stage 시도 하나의 실행 결과.
 *
 * <p>StageOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 출력과 함께 완료됨</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 정책에 따라 다시 시도</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 *   <li>{@link AwaitFeedback}: 후보를 만들었고 사용자 선택을 기다림</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 새로운 결과 종류가 추가되면 모든 처리 지점이
 * 컴파일 타임에 드러납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StageOutcome permits Ok, Retry, Fail, AwaitFeedback {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 사용자 선택을 기다리는지 확인.
     *
     * @return 대기 여부
     */
    default boolean isAwaitingFeedback() {
        return this instanceof AwaitFeedback;
    }
}
