package com.lgcns.sdp.dkg.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 결과 행의 relation 항목.
 * 단일 간선 질의(FIXED(1))는 값 하나, 다중 홉 질의는 홉 순서대로의 목록으로 직렬화된다.
 *
 * @param <T> 관계 라벨(String) 또는 관계 속성 레코드(Map)
 */
public sealed interface RelationElement<T> permits RelationElement.Single, RelationElement.Path {

    List<T> values();

    record Single<T>(T value) implements RelationElement<T> {

        @JsonValue
        public T value() {
            return value;
        }

        @Override
        public List<T> values() {
            return List.of(value);
        }
    }

    record Path<T>(List<T> values) implements RelationElement<T> {

        public Path {
            values = List.copyOf(values);
        }

        @JsonValue
        @Override
        public List<T> values() {
            return values;
        }
    }
}
