package com.ryuqq.conductor.core.model;

/**
 * 파이프라인 템플릿 내 Stage 식별자.
 *
 * <p>템플릿 안에서 고유하며, 프롬프트 템플릿의 {@code {{ steps.<id> }}}
 * 참조와 의존성 선언에 그대로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageId {

    private final String value;

    private StageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StageId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("StageId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("StageId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * StageId 생성.
     *
     * @param value 식별자 값
     * @return StageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StageId of(String value) {
        return new StageId(value);
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageId that = (StageId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "StageId{" + value + '}';
    }
}
