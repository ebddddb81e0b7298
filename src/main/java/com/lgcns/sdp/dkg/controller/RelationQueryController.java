package com.lgcns.sdp.dkg.controller;

import com.lgcns.sdp.dkg.dto.RelationQueryRequestDto;
import com.lgcns.sdp.dkg.dto.RelationResultDto;
import com.lgcns.sdp.dkg.service.RelationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RelationQueryController {

    private final RelationQueryService relationQueryService;

    @PostMapping("/relations")
    public ResponseEntity<List<RelationResultDto<?>>> getRelations(@RequestBody RelationQueryRequestDto requestDto) {
        return ResponseEntity.ok(relationQueryService.compileAndExecute(requestDto));
    }
}
