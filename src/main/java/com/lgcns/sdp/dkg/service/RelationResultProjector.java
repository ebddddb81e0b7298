package com.lgcns.sdp.dkg.service;

import com.lgcns.sdp.dkg.dto.RelationElement;
import com.lgcns.sdp.dkg.dto.RelationResultDto;
import com.lgcns.sdp.dkg.exception.StoreProtocolException;
import com.lgcns.sdp.dkg.query.CompiledRelationQuery;
import com.lgcns.sdp.dkg.query.MatchedPath;
import com.lgcns.sdp.dkg.query.MatchedPath.PathEdge;
import com.lgcns.sdp.dkg.query.RelationShape;
import com.lgcns.sdp.dkg.util.GraphRecordUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * MatchedPath -> 응답 행 변환.
 * 순서: 투영 -> (distinct) 구조적 중복 제거 -> offset / limit 슬라이스.
 */
@Component
@RequiredArgsConstructor
public class RelationResultProjector {

    private final GraphRecordUtil graphRecordUtil;

    public List<RelationResultDto<?>> project(CompiledRelationQuery query, List<MatchedPath> paths) {
        Stream<RelationResultDto<?>> rows = paths.stream()
                .<RelationResultDto<?>>map(path -> query.full()
                        ? projectFull(path, query.shape())
                        : projectCompact(path, query.shape()));

        if (query.distinct()) {
            // 첫 등장 순서를 유지하는 equals 기반 중복 제거
            rows = rows.distinct();
        }

        return rows.skip(query.offset())
                .limit(query.limit())
                .toList();
    }

    RelationResultDto<String> projectCompact(MatchedPath path, RelationShape shape) {
        List<String> labels = path.edges().stream()
                .map(PathEdge::type)
                .toList();
        return new RelationResultDto<>(
                path.start().curie(),
                toRelationElement(shape, labels),
                path.end().curie());
    }

    RelationResultDto<Map<String, Object>> projectFull(MatchedPath path, RelationShape shape) {
        List<Map<String, Object>> edges = path.edges().stream()
                .map(graphRecordUtil::hydrateEdge)
                .toList();
        return new RelationResultDto<>(
                graphRecordUtil.hydrateNode(path.start().properties()),
                toRelationElement(shape, edges),
                graphRecordUtil.hydrateNode(path.end().properties()));
    }

    private <T> RelationElement<T> toRelationElement(RelationShape shape, List<T> values) {
        return switch (shape) {
            case SINGLE -> {
                if (values.size() != 1) {
                    throw new StoreProtocolException(
                            "Direct relation query matched a path of " + values.size() + " edges");
                }
                yield new RelationElement.Single<>(values.get(0));
            }
            case PATH -> new RelationElement.Path<>(values);
        };
    }
}
