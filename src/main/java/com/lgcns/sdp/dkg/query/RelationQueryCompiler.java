package com.lgcns.sdp.dkg.query;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.exception.UnboundedUnconstrainedQueryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.cypherdsl.core.Condition;
import org.neo4j.cypherdsl.core.Cypher;
import org.neo4j.cypherdsl.core.NamedPath;
import org.neo4j.cypherdsl.core.Node;
import org.neo4j.cypherdsl.core.Relationship;
import org.neo4j.cypherdsl.core.Statement;
import org.neo4j.cypherdsl.core.renderer.Renderer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * RelationQuerySpec 을 MATCH p = (s)-[r]->(t) 형태의 탐색 패턴으로 변환한다.
 * 같은 입력에 대해 항상 같은 Cypher / 파라미터를 만든다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelationQueryCompiler {

    public static final String PATH = "p";
    private static final String SOURCE = "s";
    private static final String TARGET = "t";
    private static final String RELATION = "r";

    private final DkgQueryProperties properties;

    public CompiledRelationQuery compile(RelationQuerySpec spec) {
        HopMode hopMode = spec.hopMode();

        // 1. 전체 경로 공간 스캔이 되는 조합은 잘라내지 않고 거절
        if (hopMode.isUnbounded()
                && spec.source().isAny()
                && spec.target().isAny()
                && !spec.hasRelationConstraint()) {
            throw new UnboundedUnconstrainedQueryException();
        }

        List<Condition> whereConditions = new ArrayList<>();

        // 2. 소스 / 타겟 노드 (type -> 라벨, curie -> id 속성)
        Node source = createNode(spec.source(), SOURCE);
        Node target = createNode(spec.target(), TARGET);
        collectConditions(source, spec.source(), "sourceCurie", whereConditions);
        collectConditions(target, spec.target(), "targetCurie", whereConditions);

        // 3. 관계 (타입 집합은 홉마다 적용됨)
        int maxHops = hopMode.effectiveMaxHops(properties.maxHops());
        Relationship relationship = connect(source, target, spec);
        if (!hopMode.isSingleEdge()) {
            relationship = relationship.length(1, maxHops);
        }

        NamedPath path = Cypher.path(PATH).definedBy(relationship);

        Condition finalCondition = whereConditions.stream()
                .reduce(Condition::and)
                .orElse(Cypher.noCondition());

        int fetchLimit = fetchLimit(spec);

        Statement statement = Cypher.match(path)
                .where(finalCondition)
                .returning(Cypher.name(PATH))
                .limit(fetchLimit)
                .build();

        String cypher = Renderer.getDefaultRenderer().render(statement);
        log.debug("Compiled relation query [hops={}, fetch={}]: {}", maxHops, fetchLimit, cypher);

        return new CompiledRelationQuery(
                cypher,
                statement.getCatalog().getParameters(),
                RelationShape.of(hopMode),
                hopMode,
                maxHops,
                fetchLimit,
                spec.offset(),
                spec.limit(),
                spec.distinct(),
                spec.full());
    }

    private Node createNode(NodeConstraint constraint, String name) {
        return constraint.hasType()
                ? Cypher.node(constraint.type()).named(name)
                : Cypher.anyNode().named(name);
    }

    private void collectConditions(Node node, NodeConstraint constraint, String parameterName,
                                   List<Condition> conditions) {
        if (constraint.hasCurie()) {
            conditions.add(node.property("id").isEqualTo(Cypher.parameter(parameterName, constraint.curie())));
        }
    }

    private Relationship connect(Node source, Node target, RelationQuerySpec spec) {
        String[] types = spec.relations().toArray(new String[0]);
        Relationship relationship = switch (spec.direction()) {
            case RIGHT -> source.relationshipTo(target, types);
            case LEFT -> source.relationshipFrom(target, types);
            case BOTH -> source.relationshipBetween(target, types);
        };
        return relationship.named(RELATION);
    }

    /**
     * offset + limit 만큼 요청한다. distinct 는 투영 후 중복 제거로 행이 줄어들 수 있으므로
     * 배수만큼 더 가져오되 max-fetch 를 넘지 않는다.
     */
    int fetchLimit(RelationQuerySpec spec) {
        long wanted = (long) spec.offset() + spec.limit();
        if (spec.distinct()) {
            wanted *= Math.max(1, properties.distinctOverfetch());
        }
        return (int) Math.min(wanted, properties.maxFetch());
    }
}
