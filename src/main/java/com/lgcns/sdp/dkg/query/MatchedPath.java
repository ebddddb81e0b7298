package com.lgcns.sdp.dkg.query;

import java.util.List;
import java.util.Map;

/**
 * 저장소가 돌려준 경로 1건 [node0, edge1, node1, ..., nodeK] (K >= 1).
 * 투영 직후 버려지며 저장되지 않는다.
 */
public record MatchedPath(List<PathNode> nodes, List<PathEdge> edges) {

    public MatchedPath {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        if (edges.isEmpty()) {
            throw new IllegalArgumentException("A matched path needs at least one edge");
        }
        if (nodes.size() != edges.size() + 1) {
            throw new IllegalArgumentException(
                    "A path of " + edges.size() + " edges must have " + (edges.size() + 1) + " nodes, got " + nodes.size());
        }
    }

    public PathNode start() {
        return nodes.get(0);
    }

    public PathNode end() {
        return nodes.get(nodes.size() - 1);
    }

    public int length() {
        return edges.size();
    }

    public record PathNode(String curie, Map<String, Object> properties) {
    }

    public record PathEdge(String type, Map<String, Object> properties) {
    }
}
