package com.ryuqq.conductor.core.model;

/**
 * Pipeline Template 식별자.
 *
 * <p>버전과 함께 템플릿을 식별합니다. 동일 TemplateId 아래 여러 버전이
 * 등록될 수 있습니다.</p>
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
public final class TemplateId {

    private final String value;

    private TemplateId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TemplateId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TemplateId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("TemplateId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * TemplateId 생성.
     *
     * @param value 식별자 값
     * @return TemplateId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TemplateId of(String value) {
        return new TemplateId(value);
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
        TemplateId that = (TemplateId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TemplateId{" + value + '}';
    }
}
