package com.lgcns.sdp.dkg.dto;

import java.util.List;
import java.util.Optional;

/**
 * 노드 1개당 1건. synonyms / description 은 값이 없으면 Optional.empty() 이며
 * JSON 에서는 null 로 나타나 빈 목록([])과 구분된다.
 */
public record LexicalRecordDto(
        String id,
        String name,
        Optional<List<String>> synonyms,
        Optional<String> description) {

    public LexicalRecordDto {
        synonyms = synonyms == null ? Optional.empty() : synonyms.map(List::copyOf);
        description = description == null ? Optional.empty() : description;
    }
}
