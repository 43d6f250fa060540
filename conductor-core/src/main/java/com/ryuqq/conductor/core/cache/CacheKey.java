package com.ryuqq.conductor.core.cache;

import com.ryuqq.conductor.core.model.ScopeId;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * 응답 캐시 키.
 *
 * <p>(정규화된 프롬프트, 모델 식별자, 정렬된 컨텍스트 쌍, 격리 범위)에 대한
 * SHA-256 다이제스트의 16진수 표현입니다. 같은 튜플은 항상 같은 키를 만듭니다.</p>
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>CRLF/CR → LF</li>
 *   <li>각 줄 끝 공백 제거</li>
 *   <li>전체 앞뒤 공백 제거</li>
 *   <li>컨텍스트 쌍은 키 기준 정렬</li>
 * </ul>
 *
 * <p>각 필드는 길이 접두어와 함께 다이제스트에 들어가므로 필드 경계가 모호해지지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheKey {

    private final String value;

    private CacheKey(String value) {
        if (value == null || !value.matches("^[0-9a-f]{64}$")) {
            throw new IllegalArgumentException("CacheKey must be 64 lowercase hex characters (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 이미 계산된 키 값으로 생성 (저장소에서 복원할 때 사용).
     *
     * @param value 64자리 16진수
     * @return CacheKey
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * 캐시 키 유도.
     *
     * @param prompt 렌더링된 프롬프트
     * @param model 모델 식별자
     * @param context 관련 컨텍스트 쌍 (nullable)
     * @param scope 격리 범위
     * @return 결정적 CacheKey
     */
    public static CacheKey derive(String prompt, String model, Map<String, String> context, ScopeId scope) {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt cannot be null");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }

        MessageDigest digest = sha256();
        update(digest, normalize(prompt));
        update(digest, model);
        Map<String, String> ordered = context == null ? new TreeMap<>() : new TreeMap<>(context);
        update(digest, Integer.toString(ordered.size()));
        for (Map.Entry<String, String> entry : ordered.entrySet()) {
            update(digest, entry.getKey());
            update(digest, entry.getValue() == null ? "" : entry.getValue());
        }
        update(digest, scope.getValue());
        return new CacheKey(toHex(digest.digest()));
    }

    /**
     * 프롬프트 정규화.
     *
     * @param prompt 원문
     * @return 정규화된 프롬프트
     */
    public static String normalize(String prompt) {
        String unified = prompt.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder out = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line.stripTrailing());
        }
        return out.toString().strip();
    }

    private static void update(MessageDigest digest, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(Character.forDigit((b >> 4) & 0xF, 16));
            hex.append(Character.forDigit(b & 0xF, 16));
        }
        return hex.toString();
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey{" + value.substring(0, 16) + '}';
    }
}
