package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A bracket span "[id text]id" recovered from article text.
 * Positions are offsets into the de-bracketed text, end exclusive.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FootnoteReference {

    @JsonProperty("reference_number")
    private String referenceNumber;

    @JsonProperty("text_position")
    private int textPosition;

    @JsonProperty("end_position")
    private int endPosition;

    @JsonProperty("referenced_text")
    private String referencedText;

    @JsonProperty("bracket_pattern")
    private String bracketPattern;

    // null when the id has no entry in the article's footnote table
    @JsonProperty("citation")
    private LegalCitation citation;
}
