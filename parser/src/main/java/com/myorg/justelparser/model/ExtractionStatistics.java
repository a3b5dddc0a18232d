package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class ExtractionStatistics {

    @JsonProperty("total_articles")
    private int totalArticles;

    @JsonProperty("total_footnotes")
    private int totalFootnotes;

    @JsonProperty("total_footnote_references")
    private int totalFootnoteReferences;

    @JsonProperty("total_provisions")
    private int totalProvisions;
}
