package com.myorg.justelparser.model;

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
 * One edge of the amendment graph. In {@code modified_by} the dossier is the amending act,
 * in {@code modifies} it is the amended act.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModificationRecord {

    @JsonProperty("dossier_number")
    private String dossierNumber;

    @JsonProperty("publication_date")
    private String publicationDate;

    @Builder.Default
    @JsonProperty("modified_articles")
    private List<String> modifiedArticles = List.of();

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("full_title")
    private String fullTitle;

    @JsonProperty("modification_type")
    private ModificationType modificationType;

    public List<String> getModifiedArticles() {
        return modifiedArticles == null ? List.of() : List.copyOf(modifiedArticles);
    }
}
