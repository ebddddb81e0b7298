package com.lgcns.sdp.dkg.controller;

import com.lgcns.sdp.dkg.dto.LexicalRecordDto;
import com.lgcns.sdp.dkg.exception.StoreUnavailableException;
import com.lgcns.sdp.dkg.service.DkgEntityService;
import com.lgcns.sdp.dkg.service.LexicalExportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DkgNodeController.class)
class DkgNodeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DkgEntityService dkgEntityService;

    @MockBean
    private LexicalExportService lexicalExportService;

    @Test
    @DisplayName("Known entity returns its hydrated record")
    void testGetEntity() throws Exception {
        when(dkgEntityService.lookupEntity("doid:946"))
                .thenReturn(Optional.of(Map.of("id", "doid:946", "name", "hepatitis")));

        mockMvc.perform(get("/api/entity/doid:946"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("hepatitis"));
    }

    @Test
    @DisplayName("Unknown entity returns 404")
    void testGetMissingEntity() throws Exception {
        when(dkgEntityService.lookupEntity("doid:0")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/entity/doid:0"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Comma separated curies are looked up together")
    void testGetEntities() throws Exception {
        when(dkgEntityService.lookupEntities(List.of("vo:1", "vo:2")))
                .thenReturn(List.of(Map.of("id", "vo:1"), Map.of("id", "vo:2")));

        mockMvc.perform(get("/api/entities/vo:1,vo:2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].id").value("vo:2"));
    }

    @Test
    @DisplayName("Lexical export streams one JSON line per record with explicit absent markers")
    void testLexicalStream() throws Exception {
        when(lexicalExportService.exportLexical(ArgumentMatchers.<Consumer<LexicalRecordDto>>any())).thenAnswer(invocation -> {
            Consumer<LexicalRecordDto> sink = invocation.getArgument(0);
            sink.accept(new LexicalRecordDto("vo:1", "vaccine", Optional.of(List.of("jab")), Optional.empty()));
            sink.accept(new LexicalRecordDto("vo:2", "flu vaccine", Optional.of(List.of()), Optional.of("a vaccine")));
            return 2L;
        });

        MvcResult started = mockMvc.perform(get("/api/lexical"))
                .andExpect(request().asyncStarted())
                .andReturn();
        MvcResult result = mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andReturn();

        String[] lines = result.getResponse().getContentAsString().split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[0].contains("\"id\":\"vo:1\""), lines[0]);
        assertTrue(lines[0].contains("\"synonyms\":[\"jab\"]"), lines[0]);
        assertTrue(lines[0].contains("\"description\":null"), lines[0]);
        assertTrue(lines[1].contains("\"synonyms\":[]"), lines[1]);
        assertEquals("{\"count\":2}", lines[2]);
        assertEquals("application/x-ndjson", result.getResponse().getContentType());
    }

    @Test
    @DisplayName("Lexical export failing mid-stream ends with an error line instead of a count")
    void testLexicalStreamStoreFailure() throws Exception {
        when(lexicalExportService.exportLexical(ArgumentMatchers.<Consumer<LexicalRecordDto>>any())).thenAnswer(invocation -> {
            Consumer<LexicalRecordDto> sink = invocation.getArgument(0);
            for (int i = 0; i < 3; i++) {
                sink.accept(new LexicalRecordDto("vo:" + i, "term " + i, Optional.empty(), Optional.empty()));
            }
            throw new StoreUnavailableException("Lexical export failed: graph store unavailable", null);
        });

        MvcResult started = mockMvc.perform(get("/api/lexical"))
                .andExpect(request().asyncStarted())
                .andReturn();
        MvcResult result = mockMvc.perform(asyncDispatch(started)).andReturn();

        String[] lines = result.getResponse().getContentAsString().split("\n");
        assertEquals(4, lines.length);
        assertTrue(lines[2].contains("\"id\":\"vo:2\""), lines[2]);
        String trailer = lines[3];
        assertTrue(trailer.contains("\"error\":\"StoreUnavailable\""), trailer);
        assertTrue(trailer.contains("graph store unavailable"), trailer);
        assertFalse(trailer.contains("\"count\""), trailer);
    }
}
