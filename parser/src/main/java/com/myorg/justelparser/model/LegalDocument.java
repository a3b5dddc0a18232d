package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Per-document output record. {@code document_hierarchy} is the top-level sequence owned by
 * the implicit document root.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegalDocument {

    @JsonProperty("document_metadata")
    private DocumentMetadata documentMetadata;

    @JsonProperty("preamble")
    private String preamble;

    @JsonProperty("abrogation_info")
    private AbrogationInfo abrogationInfo;

    @Builder.Default
    @JsonProperty("document_hierarchy")
    private List<DocumentNode> documentHierarchy = List.of();

    @JsonProperty("references")
    private References references;

    @JsonProperty("external_links")
    private ExternalLinks externalLinks;

    @JsonProperty("extraction_metadata")
    private ExtractionMetadata extractionMetadata;

    public List<DocumentNode> getDocumentHierarchy() {
        return documentHierarchy == null ? List.of() : List.copyOf(documentHierarchy);
    }

    @JsonIgnore
    public String getDossierNumber() {
        return documentMetadata == null ? null : documentMetadata.getDossierNumber();
    }
}
