package com.ryuqq.conductor.core.model;

/**
 * 격리 범위(isolation scope) 식별자.
 *
 * <p>캐시 항목과 데이터가 분리되는 경계입니다 (예: workspace).
 * 같은 ScopeId를 공유하는 Run들은 응답 캐시를 공유합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScopeId {

    private final String value;

    private ScopeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ScopeId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ScopeId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("ScopeId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * ScopeId 생성.
     *
     * @param value 식별자 값
     * @return ScopeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ScopeId of(String value) {
        return new ScopeId(value);
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
        ScopeId that = (ScopeId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ScopeId{" + value + '}';
    }
}
