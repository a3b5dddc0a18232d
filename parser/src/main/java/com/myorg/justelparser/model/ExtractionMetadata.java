package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionMetadata {

    @JsonProperty("extraction_date")
    private Instant extractionDate;

    @JsonProperty("source_dossier")
    private String sourceDossier;

    @JsonProperty("hand_corrected")
    private boolean handCorrected;

    @JsonProperty("statistics")
    private ExtractionStatistics statistics;

    @JsonProperty("completeness_flags")
    private CompletenessFlags completenessFlags;

    @Builder.Default
    @JsonProperty("issues")
    private List<ParseIssue> issues = List.of();

    public List<ParseIssue> getIssues() {
        return issues == null ? List.of() : List.copyOf(issues);
    }
}
