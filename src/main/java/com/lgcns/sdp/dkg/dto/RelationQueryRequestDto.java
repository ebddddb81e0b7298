package com.lgcns.sdp.dkg.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelationQueryRequestDto {

    private String sourceCurie;
    private String sourceType;
    private String targetCurie;
    private String targetType;

    // "part_of" 또는 ["rdfs:subClassOf", "part_of"] 모두 허용
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> relation;

    private String relationDirection;   // right, left, both (null 이면 right)
    private Integer relationMaxHops;    // 0 = unbounded, null 이면 1
    private Integer limit;              // null 이면 dkg.query.default-limit
    private Integer offset;
    private boolean distinct;
    private boolean full;
}
