package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Outcome of parsing one source document. {@code document} is null only for FAILED and
 * TIMED_OUT results.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentParseResult {

    @JsonProperty("dossier_number")
    private String dossierNumber;

    @JsonProperty("status")
    private ParseStatus status;

    @JsonProperty("document")
    private LegalDocument document;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonIgnore
    public boolean requiresHandCorrection() {
        return status == ParseStatus.CONFLICT || status == ParseStatus.FAILED;
    }

    public static DocumentParseResult failed(String dossierNumber, ParseStatus status, String message) {
        return DocumentParseResult.builder()
                .dossierNumber(dossierNumber)
                .status(status)
                .errorMessage(message)
                .build();
    }
}
