package com.ryuqq.conductor.core.cache;

/**
 * 응답 캐시 통계 (관측 용도).
 *
 * @param hits 적중 수 (Tier 1 + Tier 2)
 * @param tier2Hits Tier 2 적중 수 (Tier 1로 승격된 것)
 * @param misses 미스 수
 * @param evictions 용량 초과로 Tier 1에서 밀려난 수
 * @param tier2Errors Tier 2 장애 수
 * @param size 현재 Tier 1 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheStats(long hits, long tier2Hits, long misses, long evictions, long tier2Errors, long size) {

    /**
     * 적중률.
     *
     * @return hits / (hits + misses), 요청이 없으면 0.0
     */
    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
