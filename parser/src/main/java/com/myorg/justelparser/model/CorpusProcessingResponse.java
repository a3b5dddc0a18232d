package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Reply of the corpus endpoint; full documents are downloaded separately as JSONL.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorpusProcessingResponse {

    @JsonProperty("output_directory")
    private String outputDirectory;

    @JsonProperty("duration_ms")
    private Long durationMs;

    @JsonProperty("validation")
    private CorpusValidationResult validation;
}
