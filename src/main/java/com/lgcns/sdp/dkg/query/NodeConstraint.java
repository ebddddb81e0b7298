package com.lgcns.sdp.dkg.query;

/**
 * 소스/타겟 노드 조건. curie 와 type 이 모두 주어지면 두 조건을 모두 만족해야 한다.
 *
 * @param curie 노드 id 속성 일치 조건 (null 이면 없음)
 * @param type  네임스페이스(노드 라벨) 조건 (null 이면 없음)
 */
public record NodeConstraint(String curie, String type) {

    public static final NodeConstraint ANY = new NodeConstraint(null, null);

    public boolean hasCurie() {
        return curie != null;
    }

    public boolean hasType() {
        return type != null;
    }

    public boolean isAny() {
        return !hasCurie() && !hasType();
    }
}
