package com.lgcns.sdp.dkg.query;

import java.util.Map;

/**
 * 컴파일된 탐색 패턴. cypher 는 렌더링된 MATCH 문, parameters 는 바인딩 값이다.
 * fetchLimit 는 저장소에 요청할 후보 경로 수이며 distinct / offset / limit 적용은 투영 단계에서 한다.
 */
public record CompiledRelationQuery(
        String cypher,
        Map<String, Object> parameters,
        RelationShape shape,
        HopMode hopMode,
        int maxHops,
        int fetchLimit,
        int offset,
        int limit,
        boolean distinct,
        boolean full) {

    public CompiledRelationQuery {
        parameters = Map.copyOf(parameters);
    }
}
