package com.lgcns.sdp.dkg.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 관계 질의 / 렉시컬 추출 설정 (dkg.query.*)
 *
 * @param defaultLimit       limit 미지정 시 사용 값
 * @param maxLimit           허용되는 최대 limit
 * @param maxHops            경로 길이 상한 (UNBOUNDED 및 큰 FIXED(k)에 적용)
 * @param distinctOverfetch  distinct 요청 시 offset + limit 에 곱하는 배수
 * @param maxFetch           요청 1건당 가져올 후보 경로 최대 개수
 * @param timeout            패턴 매칭 트랜잭션 제한 시간
 * @param exportTimeout      전체 노드 스캔 제한 시간 (0 이면 제한 없음)
 */
@ConfigurationProperties("dkg.query")
public record DkgQueryProperties(
        @DefaultValue("10") int defaultLimit,
        @DefaultValue("1000") int maxLimit,
        @DefaultValue("15") int maxHops,
        @DefaultValue("10") int distinctOverfetch,
        @DefaultValue("10000") int maxFetch,
        @DefaultValue("30s") Duration timeout,
        @DefaultValue("0s") Duration exportTimeout) {
}
