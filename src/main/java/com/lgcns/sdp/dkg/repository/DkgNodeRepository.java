package com.lgcns.sdp.dkg.repository;

import com.lgcns.sdp.dkg.constant.DkgQueryType;
import lombok.RequiredArgsConstructor;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.types.Entity;
import org.springframework.data.neo4j.core.DatabaseSelection;
import org.springframework.data.neo4j.core.DatabaseSelectionProvider;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Repository
@RequiredArgsConstructor
public class DkgNodeRepository {

    private final Neo4jClient neo4jClient;
    private final Driver driver;
    private final DatabaseSelectionProvider databaseSelectionProvider;

    /**
     * 모든 노드를 한 번씩 스트리밍한다. 전체 노드를 메모리에 올리지 않도록
     * Neo4jClient 대신 드라이버 세션의 auto-commit 결과를 레코드 단위로 소비한다.
     *
     * @return 전달한 노드 수
     */
    public long scanNodes(Consumer<Map<String, Object>> sink, Duration timeout) {
        TransactionConfig.Builder config = TransactionConfig.builder();
        if (timeout != null && !timeout.isZero()) {
            config.withTimeout(timeout);
        }

        long count = 0;
        try (Session session = driver.session(sessionConfig())) {
            Result result = session.run(DkgQueryType.LEXICAL_SCAN.getQuery(), config.build());
            while (result.hasNext()) {
                sink.accept(result.next().get("n").asNode().asMap());
                count++;
            }
        }
        return count;
    }

    @Transactional(readOnly = true)
    public long countNodes() {
        return neo4jClient.query(DkgQueryType.NODE_COUNT.getQuery())
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("count").asLong())
                .one()
                .orElse(0L);
    }

    @Transactional(readOnly = true)
    public List<Map<String, Object>> findByCuries(Collection<String> curies) {
        if (curies.isEmpty()) {
            return List.of();
        }
        return neo4jClient.query(DkgQueryType.ENTITIES_BY_CURIE.getQuery())
                .bind(List.copyOf(curies)).to("curies")
                .fetch()
                .all()
                .stream()
                .map(row -> ((Entity) row.get("n")).asMap())
                .toList();
    }

    private SessionConfig sessionConfig() {
        SessionConfig.Builder builder = SessionConfig.builder().withDefaultAccessMode(AccessMode.READ);
        DatabaseSelection selection = databaseSelectionProvider.getDatabaseSelection();
        if (selection.getValue() != null) {
            builder.withDatabase(selection.getValue());
        }
        return builder.build();
    }
}
