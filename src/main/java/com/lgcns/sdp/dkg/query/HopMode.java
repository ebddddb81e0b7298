package com.lgcns.sdp.dkg.query;

/**
 * 홉 모드. FIXED(k) 는 1..k 개의 간선, UNBOUNDED 는 시스템 상한까지의 간선을 허용한다.
 */
public record HopMode(Kind kind, int requestedHops) {

    public enum Kind {
        FIXED,
        UNBOUNDED
    }

    public static HopMode of(int relationMaxHops) {
        return relationMaxHops == 0
                ? new HopMode(Kind.UNBOUNDED, 0)
                : new HopMode(Kind.FIXED, relationMaxHops);
    }

    public boolean isUnbounded() {
        return kind == Kind.UNBOUNDED;
    }

    public boolean isSingleEdge() {
        return kind == Kind.FIXED && requestedHops == 1;
    }

    /**
     * 실제 패턴에 쓰일 최대 간선 수. UNBOUNDED 와 상한 초과 FIXED(k) 는 ceiling 으로 잘린다.
     */
    public int effectiveMaxHops(int ceiling) {
        return isUnbounded() ? ceiling : Math.min(requestedHops, ceiling);
    }
}
