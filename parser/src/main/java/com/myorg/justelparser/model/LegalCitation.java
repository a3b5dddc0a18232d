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
 * Structured form of a citation such as
 * {@code (1)<L [2008-12-22/33](https://...), art. 105, 013; En vigueur : 08-01-2009>}.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegalCitation {

    @JsonProperty("citation_type")
    private CitationType citationType;

    @JsonProperty("law_type")
    private String lawType;

    @JsonProperty("dossier_number")
    private String dossierNumber;

    @JsonProperty("article_number")
    private String articleNumber;

    @JsonProperty("sequence_number")
    private String sequenceNumber;

    /** ISO-8601 when the source date could be read, the raw value otherwise. */
    @JsonProperty("effective_date")
    private String effectiveDate;

    @JsonProperty("url")
    private String url;

    @JsonProperty("matched_text")
    private String matchedText;

    @JsonProperty("start_pos")
    private int startPos;

    @JsonProperty("end_pos")
    private int endPos;

    @JsonProperty("footnote_number")
    private String footnoteNumber;

    @JsonProperty("prefix")
    private String prefix;
}
