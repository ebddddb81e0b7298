package com.lgcns.sdp.dkg.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 투영된 결과 한 행 (source, relation, target).
 * full = false 이면 T 는 CURIE/라벨 문자열, full = true 이면 속성 레코드(Map) 이다.
 * 동등성은 record 의 구조적 equals 를 따르며 distinct 처리에 그대로 사용된다.
 */
public record RelationResultDto<T>(
        @JsonProperty("source") T source,
        @JsonProperty("relation") RelationElement<T> relation,
        @JsonProperty("target") T target) {
}
