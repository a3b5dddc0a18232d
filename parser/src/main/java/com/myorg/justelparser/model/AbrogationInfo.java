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
 * Present only for acts whose whole text was repealed ("(abrogé) &lt;...&gt;").
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AbrogationInfo {

    @JsonProperty("is_fully_abrogated")
    private boolean fullyAbrogated;

    @JsonProperty("abrogating_law")
    private String abrogatingLaw;

    @JsonProperty("abrogating_article")
    private String abrogatingArticle;

    @JsonProperty("abrogation_entry")
    private String abrogationEntry;

    @JsonProperty("abrogation_date")
    private String abrogationDate;

    @JsonProperty("raw_abrogation_text")
    private String rawAbrogationText;
}
