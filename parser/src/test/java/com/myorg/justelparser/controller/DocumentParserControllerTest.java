package com.myorg.justelparser.controller;

import com.myorg.justelparser.config.StorageProperties;
import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseStatus;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.implementation.CorpusProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentParserController.class)
@DisplayName("DocumentParserController Tests")
class DocumentParserControllerTest {

    private static final String SOURCE_JSON = "{\"dossier_number\":\"2001-01-01/10\","
            + "\"metadata\":{\"title\":\"Loi\",\"publication_date\":\"2001-01-01\"},"
            + "\"events\":[{\"kind\":\"ARTICLE\",\"article_number\":\"1\",\"body\":\"Texte.\"}]}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentParser documentParser;

    @MockBean
    private CorpusProcessor corpusProcessor;

    @MockBean
    private StorageProperties storageProperties;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        when(storageProperties.getBasePath()).thenReturn(tempDir.toString());
    }

    @Test
    @DisplayName("should return the parse result of a single document")
    void shouldReturnResult_whenDocumentPosted() throws Exception {
        when(documentParser.parse(any(SourceDocument.class))).thenReturn(parsed("2001-01-01/10"));

        mockMvc.perform(post("/api/documents/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SOURCE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dossier_number").value("2001-01-01/10"))
                .andExpect(jsonPath("$.status").value("PARSED"))
                .andExpect(jsonPath("$.document.document_metadata.title").value("Loi"));
    }

    @Test
    @DisplayName("should reject an unreadable payload")
    void shouldReturnBadRequest_whenJsonMalformed() throws Exception {
        mockMvc.perform(post("/api/documents/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dossier_number\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed source document payload"));

        verifyNoInteractions(documentParser);
    }

    @Test
    @DisplayName("should reject an empty corpus")
    void shouldReturnBadRequest_whenCorpusEmpty() throws Exception {
        mockMvc.perform(post("/api/corpus/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Please submit at least one source document."));

        verifyNoInteractions(corpusProcessor);
    }

    @Test
    @DisplayName("should write corpus outputs and serve them back")
    void shouldWriteAndServeOutputs_whenCorpusProcessed() throws Exception {
        when(corpusProcessor.process(anyList())).thenReturn(List.of(
                parsed("2001-01-01/10"),
                DocumentParseResult.failed("2002-02-02/20", ParseStatus.FAILED, "boom")));

        mockMvc.perform(post("/api/corpus/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + SOURCE_JSON + "]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validation.document_count").value(2))
                .andExpect(jsonPath("$.validation.requires_hand_correction[0]").value("2002-02-02/20"));

        assertThat(tempDir.resolve(DocumentParserController.DOCUMENTS_FILE)).exists();
        assertThat(tempDir.resolve(DocumentParserController.VALIDATION_FILE)).exists();

        mockMvc.perform(get("/api/corpus/results/documents"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + DocumentParserController.DOCUMENTS_FILE + "\""))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("\"dossier_number\":\"2002-02-02/20\"")));
    }

    @Test
    @DisplayName("should return 404 when no report has been written yet")
    void shouldReturnNotFound_whenReportMissing() throws Exception {
        mockMvc.perform(get("/api/corpus/results/validation"))
                .andExpect(status().isNotFound());
    }

    private static DocumentParseResult parsed(String dossier) {
        return DocumentParseResult.builder()
                .dossierNumber(dossier)
                .status(ParseStatus.PARSED)
                .document(LegalDocument.builder()
                        .documentMetadata(DocumentMetadata.builder().dossierNumber(dossier).title("Loi").build())
                        .build())
                .build();
    }
}
