package com.lgcns.sdp.dkg.query;

/**
 * 결과 relation 항목의 형태. 컴파일 시점에 한 번 정해지고 투영 단계까지 그대로 전달된다.
 */
public enum RelationShape {
    SINGLE,
    PATH;

    public static RelationShape of(HopMode hopMode) {
        return hopMode.isSingleEdge() ? SINGLE : PATH;
    }
}
