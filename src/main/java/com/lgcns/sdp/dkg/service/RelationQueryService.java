package com.lgcns.sdp.dkg.service;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.dto.RelationQueryRequestDto;
import com.lgcns.sdp.dkg.dto.RelationResultDto;
import com.lgcns.sdp.dkg.exception.DkgQueryException;
import com.lgcns.sdp.dkg.query.CompiledRelationQuery;
import com.lgcns.sdp.dkg.query.MatchedPath;
import com.lgcns.sdp.dkg.query.RelationQueryCompiler;
import com.lgcns.sdp.dkg.query.RelationQuerySpec;
import com.lgcns.sdp.dkg.repository.RelationTraversalRepository;
import com.lgcns.sdp.dkg.util.StoreExceptionTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 관계 질의 진입점: 요청 검증 -> 패턴 컴파일 -> 저장소 실행 -> 결과 투영.
 * 요청 간 공유 상태는 없으며 재시도는 호출자 책임이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationQueryService {

    private final DkgQueryProperties properties;
    private final RelationQueryCompiler relationQueryCompiler;
    private final RelationTraversalRepository relationTraversalRepository;
    private final RelationResultProjector relationResultProjector;

    public List<RelationResultDto<?>> compileAndExecute(RelationQueryRequestDto request) {
        return compileAndExecute(RelationQuerySpec.from(request, properties));
    }

    public List<RelationResultDto<?>> compileAndExecute(RelationQuerySpec spec) {
        CompiledRelationQuery query = relationQueryCompiler.compile(spec);

        List<MatchedPath> paths;
        try {
            paths = relationTraversalRepository.findPaths(query);
        } catch (RuntimeException e) {
            DkgQueryException translated = StoreExceptionTranslator.translate(e, "Relation query");
            if (translated.isTransient()) {
                log.warn("Relation query failed [{}]: {}", translated.getErrorCode(), translated.getMessage());
            } else {
                log.error("Relation query failed [{}]: {}", translated.getErrorCode(), query.cypher(), e);
            }
            throw translated;
        }

        List<RelationResultDto<?>> results = relationResultProjector.project(query, paths);
        log.debug("Relation query matched {} paths, returning {} rows", paths.size(), results.size());
        return results;
    }
}
