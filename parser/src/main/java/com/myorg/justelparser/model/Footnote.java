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
 * Footnote entry of an article. {@code footnoteNumber} is scoped to the owning article.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Footnote {

    @JsonProperty("footnote_number")
    private String footnoteNumber;

    // raw citation string, kept even when parsing failed
    @JsonProperty("footnote_content")
    private String footnoteContent;

    @JsonProperty("law_reference")
    private LegalCitation lawReference;

    @JsonProperty("effective_date")
    private String effectiveDate;

    @JsonProperty("modification_type")
    private ModificationType modificationType;

    @JsonProperty("direct_url")
    private String directUrl;

    @JsonProperty("direct_article_url")
    private String directArticleUrl;
}
