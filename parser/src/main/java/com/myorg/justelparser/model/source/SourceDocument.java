package com.myorg.justelparser.model.source;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.ExternalLinks;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Tokenized input for one legal act.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceDocument {

    @JsonProperty("dossier_number")
    private String dossierNumber;

    @JsonProperty("metadata")
    private DocumentMetadata metadata;

    @JsonProperty("preamble")
    private String preamble;

    // text section of a fully repealed act, e.g. "(abrogé) <L 2019-04-26/28, art. 45, 239; ...>"
    @JsonProperty("abrogation_text")
    private String abrogationText;

    @Builder.Default
    @JsonProperty("amends")
    private List<AmendmentDeclaration> amends = List.of();

    @JsonProperty("external_links")
    private ExternalLinks externalLinks;

    @Builder.Default
    @JsonProperty("events")
    private List<SourceEvent> events = List.of();

    public List<AmendmentDeclaration> getAmends() {
        return amends == null ? List.of() : List.copyOf(amends);
    }

    public List<SourceEvent> getEvents() {
        return events == null ? List.of() : List.copyOf(events);
    }
}
