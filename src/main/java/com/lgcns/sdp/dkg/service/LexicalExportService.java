package com.lgcns.sdp.dkg.service;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.dto.LexicalRecordDto;
import com.lgcns.sdp.dkg.exception.DkgQueryException;
import com.lgcns.sdp.dkg.repository.DkgNodeRepository;
import com.lgcns.sdp.dkg.util.GraphRecordUtil;
import com.lgcns.sdp.dkg.util.StoreExceptionTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 개체명 인식용 렉시컬 추출. 질의 조건 없이 모든 노드를 한 번씩 훑어 노드당 레코드 1건을 만든다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LexicalExportService {

    private final DkgQueryProperties properties;
    private final DkgNodeRepository dkgNodeRepository;
    private final GraphRecordUtil graphRecordUtil;

    /**
     * 레코드를 sink 로 하나씩 흘려보낸다.
     *
     * @return 내보낸 레코드 수
     */
    public long exportLexical(Consumer<LexicalRecordDto> sink) {
        log.info("Starting lexical export");
        long count;
        try {
            count = dkgNodeRepository.scanNodes(
                    node -> sink.accept(graphRecordUtil.toLexicalRecord(node)),
                    properties.exportTimeout());
        } catch (UncheckedIOException e) {
            // 소비자(응답 스트림) 쪽 실패는 저장소 오류가 아님
            log.warn("Lexical export aborted by consumer: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            DkgQueryException translated = StoreExceptionTranslator.translate(e, "Lexical export");
            log.error("Lexical export failed [{}]", translated.getErrorCode(), e);
            throw translated;
        }
        log.info("Lexical export finished: {} records", count);
        return count;
    }

    public List<LexicalRecordDto> exportLexical() {
        List<LexicalRecordDto> records = new ArrayList<>();
        exportLexical(records::add);
        return records;
    }

    public long countNodes() {
        try {
            return dkgNodeRepository.countNodes();
        } catch (RuntimeException e) {
            throw StoreExceptionTranslator.translate(e, "Node count");
        }
    }
}
