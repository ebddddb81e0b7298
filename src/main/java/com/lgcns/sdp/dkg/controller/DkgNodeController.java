package com.lgcns.sdp.dkg.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lgcns.sdp.dkg.dto.ErrorResponseDto;
import com.lgcns.sdp.dkg.dto.LexicalExportSummaryDto;
import com.lgcns.sdp.dkg.exception.DkgQueryException;
import com.lgcns.sdp.dkg.service.DkgEntityService;
import com.lgcns.sdp.dkg.service.LexicalExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DkgNodeController {

    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final DkgEntityService dkgEntityService;
    private final LexicalExportService lexicalExportService;
    private final ObjectMapper objectMapper;

    @GetMapping("/entity/{curie}")
    public ResponseEntity<Map<String, Object>> getEntity(@PathVariable String curie) {
        return dkgEntityService.lookupEntity(curie)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/entities/{curies}")
    public ResponseEntity<List<Map<String, Object>>> getEntities(@PathVariable List<String> curies) {
        return ResponseEntity.ok(dkgEntityService.lookupEntities(curies));
    }

    /**
     * 전체 노드를 한 줄에 하나씩 (NDJSON) 스트리밍한다.
     * 응답은 첫 레코드와 함께 200 으로 커밋되므로 종료 상태는 마지막 줄로 전달한다.
     * 정상 종료 시 {"count": N}, 저장소 실패 시 {"error": ..., "message": ...}.
     */
    @GetMapping("/lexical")
    public ResponseEntity<StreamingResponseBody> getLexical() {
        StreamingResponseBody body = out -> {
            Object trailer;
            try {
                long count = lexicalExportService.exportLexical(record -> writeLine(out, record));
                trailer = new LexicalExportSummaryDto(count);
            } catch (DkgQueryException e) {
                // 서비스에서 이미 로그를 남김
                trailer = ErrorResponseDto.builder()
                        .error(e.getErrorCode())
                        .message(e.getMessage())
                        .build();
            }
            writeLine(out, trailer);
        };
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .body(body);
    }

    private void writeLine(OutputStream out, Object value) {
        try {
            out.write(objectMapper.writeValueAsBytes(value));
            out.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
