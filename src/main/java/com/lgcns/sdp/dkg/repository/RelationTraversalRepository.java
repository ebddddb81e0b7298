package com.lgcns.sdp.dkg.repository;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.exception.StoreProtocolException;
import com.lgcns.sdp.dkg.query.CompiledRelationQuery;
import com.lgcns.sdp.dkg.query.MatchedPath;
import com.lgcns.sdp.dkg.query.MatchedPath.PathEdge;
import com.lgcns.sdp.dkg.query.MatchedPath.PathNode;
import com.lgcns.sdp.dkg.query.RelationQueryCompiler;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Relationship;
import org.neo4j.driver.types.TypeSystem;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 컴파일된 패턴을 실행해 저장소의 매칭 순서 그대로 MatchedPath 목록을 돌려준다.
 * 읽기 전용 트랜잭션에 dkg.query.timeout 을 걸어, 제한 시간을 넘기면 서버 측에서 트랜잭션이 종료되고
 * 세션은 트랜잭션 매니저가 정리한다. 도중 실패 시 부분 결과는 반환하지 않는다.
 */
@Repository
public class RelationTraversalRepository {

    private final Neo4jClient neo4jClient;
    private final TransactionTemplate readOnlyTransaction;

    public RelationTraversalRepository(Neo4jClient neo4jClient,
                                       PlatformTransactionManager transactionManager,
                                       DkgQueryProperties properties) {
        this.neo4jClient = neo4jClient;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
        long timeoutSeconds = properties.timeout().toSeconds();
        if (timeoutSeconds > 0) {
            this.readOnlyTransaction.setTimeout((int) Math.min(timeoutSeconds, Integer.MAX_VALUE));
        }
    }

    public List<MatchedPath> findPaths(CompiledRelationQuery query) {
        if (query.fetchLimit() == 0) {
            return List.of();
        }

        Collection<MatchedPath> paths = readOnlyTransaction.execute(status ->
                neo4jClient.query(query.cypher())
                        .bindAll(query.parameters())
                        .fetchAs(MatchedPath.class)
                        .mappedBy((typeSystem, record) ->
                                toMatchedPath(typeSystem, record.get(RelationQueryCompiler.PATH)))
                        .all());

        return paths == null ? List.of() : new ArrayList<>(paths);
    }

    static MatchedPath toMatchedPath(TypeSystem typeSystem, Value value) {
        if (value == null || !value.hasType(typeSystem.PATH())) {
            throw new StoreProtocolException("Expected a path in column '" + RelationQueryCompiler.PATH + "', got "
                    + (value == null ? "nothing" : value.type().name()));
        }
        Path path = value.asPath();

        List<PathNode> nodes = new ArrayList<>();
        for (Node node : path.nodes()) {
            nodes.add(toPathNode(node));
        }

        List<PathEdge> edges = new ArrayList<>();
        for (Relationship relationship : path.relationships()) {
            edges.add(new PathEdge(relationship.type(), relationship.asMap()));
        }

        try {
            return new MatchedPath(nodes, edges);
        } catch (IllegalArgumentException e) {
            throw new StoreProtocolException("Malformed path from store: " + e.getMessage(), e);
        }
    }

    static PathNode toPathNode(Node node) {
        Object id = node.get("id").asObject();
        if (!(id instanceof String curie)) {
            throw new StoreProtocolException("Node " + node.elementId() + " has no string 'id' property");
        }
        return new PathNode(curie, node.asMap());
    }
}
