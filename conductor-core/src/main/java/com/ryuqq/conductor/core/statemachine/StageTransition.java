package com.ryuqq.conductor.core.statemachine;

/**
 * Stage 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>WAITING → RUNNING, SKIPPED, CANCELLED</li>
 *   <li>RUNNING → COMPLETED, FAILED, AWAITING_FEEDBACK, CANCELLED</li>
 *   <li>AWAITING_FEEDBACK → COMPLETED, SKIPPED, CANCELLED</li>
 *   <li>FAILED → RUNNING (재시도), CANCELLED (재시도 대기 중 Run 종료)</li>
 * </ul>
 *
 * <p>FAILED에서 나가는 전이는 재시도가 예약된 경우에만 허용됩니다.
 * 예약 여부는 호출 측({@code RunStateProjector})이 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageTransition {

    // Utility class - prevent instantiation
    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(StageStatus from, StageStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid;
        switch (from) {
            case WAITING:
                valid = to == StageStatus.RUNNING || to == StageStatus.SKIPPED || to == StageStatus.CANCELLED;
                break;
            case RUNNING:
                valid = to == StageStatus.COMPLETED || to == StageStatus.FAILED
                    || to == StageStatus.AWAITING_FEEDBACK || to == StageStatus.CANCELLED;
                break;
            case AWAITING_FEEDBACK:
                valid = to == StageStatus.COMPLETED || to == StageStatus.SKIPPED || to == StageStatus.CANCELLED;
                break;
            case FAILED:
                valid = to == StageStatus.RUNNING || to == StageStatus.CANCELLED;
                break;
            default:
                // COMPLETED, SKIPPED, CANCELLED
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static StageStatus transition(StageStatus current, StageStatus next) {
        validate(current, next);
        return next;
    }
}
