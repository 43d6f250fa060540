package com.ryuqq.conductor.core.statemachine;

/**
 * Run 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, FAILED, CANCELLED</li>
 *   <li>RUNNING → PAUSED, COMPLETED, FAILED, CANCELLED</li>
 *   <li>PAUSED → RUNNING, FAILED, CANCELLED</li>
 * </ul>
 *
 * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunTransition {

    // Utility class - prevent instantiation
    private RunTransition() {
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
    public static void validate(RunStatus from, RunStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition run from terminal state: %s → %s", from, to)
            );
        }

        boolean valid;
        switch (from) {
            case PENDING:
                valid = to == RunStatus.RUNNING || to == RunStatus.FAILED || to == RunStatus.CANCELLED;
                break;
            case RUNNING:
                valid = to == RunStatus.PAUSED || to == RunStatus.COMPLETED
                    || to == RunStatus.FAILED || to == RunStatus.CANCELLED;
                break;
            case PAUSED:
                valid = to == RunStatus.RUNNING || to == RunStatus.FAILED || to == RunStatus.CANCELLED;
                break;
            default:
                valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid run transition: %s → %s", from, to)
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
    public static RunStatus transition(RunStatus current, RunStatus next) {
        validate(current, next);
        return next;
    }
}
