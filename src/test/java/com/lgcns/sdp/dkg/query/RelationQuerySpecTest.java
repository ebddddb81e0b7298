package com.lgcns.sdp.dkg.query;

import com.lgcns.sdp.dkg.config.DkgQueryProperties;
import com.lgcns.sdp.dkg.config.DkgQueryPropertiesFixture;
import com.lgcns.sdp.dkg.constant.RelationDirection;
import com.lgcns.sdp.dkg.dto.RelationQueryRequestDto;
import com.lgcns.sdp.dkg.exception.InvalidQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationQuerySpecTest {

    private final DkgQueryProperties properties = DkgQueryPropertiesFixture.defaults();

    @Test
    @DisplayName("Empty request gets defaults and matches broadly")
    void testDefaults() {
        RelationQuerySpec spec = RelationQuerySpec.from(new RelationQueryRequestDto(), properties);

        assertTrue(spec.source().isAny());
        assertTrue(spec.target().isAny());
        assertFalse(spec.hasRelationConstraint());
        assertEquals(RelationDirection.RIGHT, spec.direction());
        assertEquals(1, spec.relationMaxHops());
        assertEquals(properties.defaultLimit(), spec.limit());
        assertEquals(0, spec.offset());
        assertFalse(spec.distinct());
        assertFalse(spec.full());
        assertTrue(spec.hopMode().isSingleEdge());
    }

    @Test
    @DisplayName("Curie and type on the same side are both kept")
    void testCurieAndTypeTogether() {
        RelationQuerySpec spec = RelationQuerySpec.from(RelationQueryRequestDto.builder()
                .sourceCurie("doid:946")
                .sourceType("doid")
                .build(), properties);

        assertEquals(new NodeConstraint("doid:946", "doid"), spec.source());
    }

    @Test
    @DisplayName("Relation list is de-duplicated keeping order")
    void testRelationsDeduplicated() {
        RelationQuerySpec spec = RelationQuerySpec.from(RelationQueryRequestDto.builder()
                .relation(List.of("rdfs:subClassOf", "part_of", "rdfs:subClassOf"))
                .build(), properties);

        assertEquals(List.of("rdfs:subClassOf", "part_of"), spec.relations());
    }

    @Test
    @DisplayName("Negative limit is rejected with the field name")
    void testNegativeLimit() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder().limit(-1).build(), properties));
        assertEquals("limit", e.getField());
    }

    @Test
    @DisplayName("Negative offset is rejected")
    void testNegativeOffset() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder().offset(-5).build(), properties));
        assertEquals("offset", e.getField());
    }

    @Test
    @DisplayName("Negative relation_max_hops is rejected")
    void testNegativeHops() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder().relationMaxHops(-1).build(), properties));
        assertEquals("relation_max_hops", e.getField());
    }

    @Test
    @DisplayName("Limit above the configured maximum is rejected")
    void testLimitAboveMaximum() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder()
                        .limit(properties.maxLimit() + 1).build(), properties));
        assertEquals("limit", e.getField());
    }

    @Test
    @DisplayName("Empty and null relation types are rejected")
    void testEmptyRelationType() {
        assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder()
                        .relation(List.of("part_of", "")).build(), properties));
        assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder()
                        .relation(Arrays.asList("part_of", null)).build(), properties));
    }

    @Test
    @DisplayName("Blank curie is rejected")
    void testBlankCurie() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder().targetCurie("  ").build(), properties));
        assertEquals("target_curie", e.getField());
    }

    @Test
    @DisplayName("Unknown direction is rejected, known ones are case-insensitive")
    void testDirection() {
        InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> RelationQuerySpec.from(RelationQueryRequestDto.builder()
                        .relationDirection("up").build(), properties));
        assertEquals("relation_direction", e.getField());
        assertEquals("relation_direction: must be one of right, left, both", e.getMessage());

        RelationQuerySpec spec = RelationQuerySpec.from(RelationQueryRequestDto.builder()
                .relationDirection("Both").build(), properties);
        assertEquals(RelationDirection.BOTH, spec.direction());
    }

    @Test
    @DisplayName("Missing body is rejected")
    void testNullRequest() {
        assertThrows(InvalidQueryException.class, () -> RelationQuerySpec.from(null, properties));
    }

    @Test
    @DisplayName("Zero hops means unbounded")
    void testUnboundedHopMode() {
        RelationQuerySpec spec = RelationQuerySpec.from(RelationQueryRequestDto.builder()
                .relationMaxHops(0).build(), properties);

        assertTrue(spec.hopMode().isUnbounded());
        assertEquals(properties.maxHops(), spec.hopMode().effectiveMaxHops(properties.maxHops()));
    }
}
