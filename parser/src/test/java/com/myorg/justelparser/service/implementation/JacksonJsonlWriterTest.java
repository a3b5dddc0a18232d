package com.myorg.justelparser.service.implementation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.ExtractionMetadata;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JacksonJsonlWriter Tests")
class JacksonJsonlWriterTest {

    private final JacksonJsonlWriter<DocumentParseResult> writer = new JacksonJsonlWriter<>();
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should write one snake_case JSON object per line")
    void shouldWriteLines_whenResultsGiven() throws Exception {
        File out = tempDir.resolve("out/documents.jsonl").toFile();
        DocumentParseResult parsed = DocumentParseResult.builder()
                .dossierNumber("2001-01-01/10")
                .status(ParseStatus.PARSED)
                .document(LegalDocument.builder()
                        .extractionMetadata(ExtractionMetadata.builder()
                                .extractionDate(Instant.parse("2024-01-01T00:00:00Z"))
                                .build())
                        .build())
                .build();

        writer.write(out, List.of(parsed, DocumentParseResult.failed("2002-02-02/20", ParseStatus.FAILED, "boom")));

        List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("dossier_number").asText()).isEqualTo("2001-01-01/10");
        assertThat(first.get("status").asText()).isEqualTo("PARSED");
        assertThat(first.at("/document/extraction_metadata/extraction_date").asText()).isEqualTo("2024-01-01T00:00:00Z");
        JsonNode second = mapper.readTree(lines.get(1));
        assertThat(second.get("error_message").asText()).isEqualTo("boom");
        assertThat(second.has("document")).isFalse();
    }

    @Test
    @DisplayName("should not create a file for an empty list")
    void shouldSkip_whenNoData() throws Exception {
        File out = tempDir.resolve("empty.jsonl").toFile();

        writer.write(out, List.of());

        assertThat(out).doesNotExist();
    }
}
