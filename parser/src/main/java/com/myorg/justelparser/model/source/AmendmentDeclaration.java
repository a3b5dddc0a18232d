package com.myorg.justelparser.model.source;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.justelparser.model.ModificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Declares that the carrying document amends {@code targetDossierNumber}.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AmendmentDeclaration {

    @JsonProperty("target_dossier_number")
    private String targetDossierNumber;

    @Builder.Default
    @JsonProperty("modified_articles")
    private List<String> modifiedArticles = List.of();

    @JsonProperty("modification_type")
    private ModificationType modificationType;

    public List<String> getModifiedArticles() {
        return modifiedArticles == null ? List.of() : List.copyOf(modifiedArticles);
    }
}
