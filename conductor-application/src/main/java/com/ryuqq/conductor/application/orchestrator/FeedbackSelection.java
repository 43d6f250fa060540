package com.ryuqq.conductor.application.orchestrator;

import java.util.List;

/**
 * 사용자 선택 Stage에 전달하는 선택 결과 (불변).
 *
 * <p>후보 중 하나를 고르거나({@link #candidate(int)}), 후보 대신 직접 입력한
 * 텍스트를 쓸 수 있습니다({@link #custom(String)}).</p>
 *
 * @param candidateIndex 후보 인덱스 (직접 입력이면 -1)
 * @param customText 직접 입력 텍스트 (후보 선택이면 null)
 * @param comment 선택 사유 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FeedbackSelection(int candidateIndex, String customText, String comment) {

    /**
     * 직접 입력을 나타내는 후보 인덱스.
     */
    public static final int CUSTOM = -1;

    public FeedbackSelection {
        if (candidateIndex < CUSTOM) {
            throw new IllegalArgumentException("candidateIndex must be >= -1 (current: " + candidateIndex + ")");
        }
        if (candidateIndex == CUSTOM && (customText == null || customText.isBlank())) {
            throw new IllegalArgumentException("customText is required for a custom selection");
        }
        if (candidateIndex != CUSTOM && customText != null) {
            throw new IllegalArgumentException("customText must be null when a candidate is selected");
        }
    }

    /**
     * 후보 선택.
     *
     * @param index 0부터 시작하는 후보 인덱스
     * @return FeedbackSelection
     */
    public static FeedbackSelection candidate(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        return new FeedbackSelection(index, null, null);
    }

    /**
     * 직접 입력.
     *
     * @param text 사용할 텍스트
     * @return FeedbackSelection
     */
    public static FeedbackSelection custom(String text) {
        return new FeedbackSelection(CUSTOM, text, null);
    }

    public FeedbackSelection withComment(String comment) {
        return new FeedbackSelection(candidateIndex, customText, comment);
    }

    public boolean isCustom() {
        return candidateIndex == CUSTOM;
    }

    /**
     * 후보 목록에 대해 선택된 텍스트를 결정.
     *
     * @param candidates Stage가 제시한 후보
     * @return 선택된 텍스트
     * @throws IllegalArgumentException 후보 인덱스가 범위를 벗어난 경우
     */
    public String resolve(List<String> candidates) {
        if (isCustom()) {
            return customText;
        }
        if (candidates == null || candidateIndex >= candidates.size()) {
            throw new IllegalArgumentException(
                "candidateIndex out of range (index: " + candidateIndex
                    + ", candidates: " + (candidates == null ? 0 : candidates.size()) + ")"
            );
        }
        return candidates.get(candidateIndex);
    }
}
