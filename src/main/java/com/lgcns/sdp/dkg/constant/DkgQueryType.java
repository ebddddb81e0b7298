package com.lgcns.sdp.dkg.constant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DkgQueryType {

    // 1. 전체 노드 스캔 (렉시컬 추출용, 노드당 1행)
    LEXICAL_SCAN("""
            MATCH (n)
            RETURN n
            """),

    // 2. 독립적인 노드 개수 (추출 결과 검증용)
    NODE_COUNT("""
            MATCH (n)
            RETURN count(n) AS count
            """),

    // 3. CURIE 목록으로 노드 조회
    ENTITIES_BY_CURIE("""
            MATCH (n)
            WHERE n.id IN $curies
            RETURN n
            """);

    private final String query;
}
