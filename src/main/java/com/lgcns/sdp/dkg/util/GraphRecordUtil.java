package com.lgcns.sdp.dkg.util;

import com.lgcns.sdp.dkg.dto.LexicalRecordDto;
import com.lgcns.sdp.dkg.exception.StoreProtocolException;
import com.lgcns.sdp.dkg.query.MatchedPath.PathEdge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 노드 / 관계 속성 레코드 공통 변환 (관계 질의 full 투영과 렉시컬 추출이 함께 사용)
 */
@Component
public class GraphRecordUtil {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String SYNONYMS = "synonyms";
    public static final String DESCRIPTION = "description";
    public static final String TYPE = "type";

    // 적재 파이프라인이 문자열 배열 대신 ';' 구분 문자열로 넣은 경우
    private static final String LIST_DELIMITER = ";";

    /**
     * 저장된 모든 속성을 그대로 담고, 선택 필드(name, synonyms, description)는 값이 없으면 null 로 채운다.
     * 키 순서는 정렬해서 동일 노드가 항상 같은 모양이 되도록 한다.
     */
    public Map<String, Object> hydrateNode(Map<String, Object> properties) {
        Map<String, Object> map = new TreeMap<>(properties);
        map.putIfAbsent(NAME, null);
        map.putIfAbsent(SYNONYMS, null);
        map.putIfAbsent(DESCRIPTION, null);
        return map;
    }

    /**
     * 관계 속성(pred, source, graph, version 등)에 관계 타입을 더한 레코드.
     * 관계 자체에 type 속성이 있으면 저장된 값을 유지한다.
     */
    public Map<String, Object> hydrateEdge(PathEdge edge) {
        Map<String, Object> map = new TreeMap<>(edge.properties());
        map.putIfAbsent(TYPE, edge.type());
        return map;
    }

    public LexicalRecordDto toLexicalRecord(Map<String, Object> properties) {
        Object id = properties.get(ID);
        if (!(id instanceof String curie)) {
            throw new StoreProtocolException("Node without a string '" + ID + "' property: " + properties.keySet());
        }

        Object name = properties.get(NAME);
        Object description = properties.get(DESCRIPTION);

        return new LexicalRecordDto(
                curie,
                name == null ? "" : name.toString(),
                toStringList(properties.get(SYNONYMS)),
                Optional.ofNullable(description).map(Object::toString));
    }

    private Optional<List<String>> toStringList(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Collection<?> collection) {
            List<String> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                list.add(String.valueOf(item));
            }
            return Optional.of(list);
        }
        if (value instanceof String[] array) {
            return Optional.of(List.of(array));
        }
        if (value instanceof String text) {
            if (text.isEmpty()) {
                return Optional.of(List.of());
            }
            return Optional.of(Arrays.asList(text.split(LIST_DELIMITER)));
        }
        throw new StoreProtocolException("Unexpected " + SYNONYMS + " value type: " + value.getClass().getName());
    }
}
