package com.lgcns.sdp.dkg.constant;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 소스 노드 기준 간선 방향. right: (s)-[]->(t), left: (s)<-[]-(t), both: 방향 무시
 */
public enum RelationDirection {
    RIGHT,
    LEFT,
    BOTH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RelationDirection> find(String value) {
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
