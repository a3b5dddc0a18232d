package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Corpus-level validation summary, backing the Excel validation report.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorpusValidationResult {

    // --- counts ---
    @JsonProperty("document_count")
    private Integer documentCount;

    @JsonProperty("article_count")
    private Integer articleCount;

    // keyed by ParseStatus name
    @JsonProperty("status_counts")
    private Map<String, Integer> statusCounts;

    // keyed by IssueKind name
    @JsonProperty("issue_counts")
    private Map<String, Integer> issueCounts;

    // --- documents needing a hand-corrected replacement tree ---
    @JsonProperty("requires_hand_correction")
    private List<String> requiresHandCorrection;

    public Map<String, Integer> getStatusCounts() {
        return statusCounts == null ? Map.of() : Map.copyOf(statusCounts);
    }

    public Map<String, Integer> getIssueCounts() {
        return issueCounts == null ? Map.of() : Map.copyOf(issueCounts);
    }

    public List<String> getRequiresHandCorrection() {
        return requiresHandCorrection == null ? List.of() : List.copyOf(requiresHandCorrection);
    }
}
