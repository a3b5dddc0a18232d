package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Lets consumers tell a clean automatic parse apart from one that needs review.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class CompletenessFlags {

    @JsonProperty("all_articles_extracted")
    private boolean allArticlesExtracted;

    @JsonProperty("footnotes_linked")
    private boolean footnotesLinked;

    @JsonProperty("brackets_balanced")
    private boolean bracketsBalanced;

    @JsonProperty("citations_parsed")
    private boolean citationsParsed;

    @JsonProperty("hierarchical_structure_complete")
    private boolean hierarchicalStructureComplete;

    @JsonProperty("metadata_complete")
    private boolean metadataComplete;

    @JsonProperty("preamble_extracted")
    private boolean preambleExtracted;

    @JsonProperty("is_abrogated_document")
    private boolean abrogatedDocument;

    @JsonProperty("hand_corrected")
    private boolean handCorrected;

    @JsonProperty("requires_review")
    private boolean requiresReview;
}
