package com.lgcns.sdp.dkg.query;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.constant.RelationDirection;
import com.lgcns.sdp.dkg.dto.RelationQueryRequestDto;
import com.lgcns.sdp.dkg.exception.InvalidQueryException;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 검증이 끝난 불변 관계 질의.
 * 구조 검증만 수행하며, curie 와 type 이 서로 모순되는지는 실행 시 저장소가 판단한다(결과 없음).
 *
 * @param relations 허용 관계 타입 집합 (비어 있으면 모든 관계)
 */
@Builder(toBuilder = true)
public record RelationQuerySpec(
        NodeConstraint source,
        NodeConstraint target,
        List<String> relations,
        RelationDirection direction,
        int relationMaxHops,
        int limit,
        int offset,
        boolean distinct,
        boolean full) {

    public RelationQuerySpec {
        source = source == null ? NodeConstraint.ANY : source;
        target = target == null ? NodeConstraint.ANY : target;
        relations = relations == null ? List.of() : List.copyOf(relations);
        direction = direction == null ? RelationDirection.RIGHT : direction;
    }

    public HopMode hopMode() {
        return HopMode.of(relationMaxHops);
    }

    public boolean hasRelationConstraint() {
        return !relations.isEmpty();
    }

    public static RelationQuerySpec from(RelationQueryRequestDto request, DkgQueryProperties properties) {
        if (request == null) {
            throw new InvalidQueryException("body", "query specification is required");
        }

        int limit = nonNegative("limit", request.getLimit(), properties.defaultLimit());
        if (limit > properties.maxLimit()) {
            throw new InvalidQueryException("limit", "must not exceed " + properties.maxLimit());
        }

        RelationDirection direction = RelationDirection.RIGHT;
        if (request.getRelationDirection() != null) {
            direction = RelationDirection.find(request.getRelationDirection())
                    .orElseThrow(() -> new InvalidQueryException("relation_direction",
                            "must be one of " + Arrays.stream(RelationDirection.values())
                                    .map(RelationDirection::value)
                                    .collect(Collectors.joining(", "))));
        }

        return RelationQuerySpec.builder()
                .source(new NodeConstraint(
                        optionalText("source_curie", request.getSourceCurie()),
                        optionalText("source_type", request.getSourceType())))
                .target(new NodeConstraint(
                        optionalText("target_curie", request.getTargetCurie()),
                        optionalText("target_type", request.getTargetType())))
                .relations(relations(request.getRelation()))
                .direction(direction)
                .relationMaxHops(nonNegative("relation_max_hops", request.getRelationMaxHops(), 1))
                .limit(limit)
                .offset(nonNegative("offset", request.getOffset(), 0))
                .distinct(request.isDistinct())
                .full(request.isFull())
                .build();
    }

    private static int nonNegative(String field, Integer value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0) {
            throw new InvalidQueryException(field, "must be a non-negative integer, got " + value);
        }
        return value;
    }

    private static String optionalText(String field, String value) {
        if (value == null) {
            return null;
        }
        if (value.isBlank()) {
            throw new InvalidQueryException(field, "must not be blank");
        }
        return value.trim();
    }

    private static List<String> relations(List<String> requested) {
        if (requested == null) {
            return List.of();
        }
        // 순서 유지 + 중복 제거
        Set<String> relations = new LinkedHashSet<>();
        for (String relation : requested) {
            if (relation == null || relation.isBlank()) {
                throw new InvalidQueryException("relation", "must not contain empty relation types");
            }
            relations.add(relation.trim());
        }
        return new ArrayList<>(relations);
    }
}
