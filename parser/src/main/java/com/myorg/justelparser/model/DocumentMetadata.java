package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Publication metadata of a legal act, as handed over by the upstream tokenizer.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentMetadata {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_ABROGATED = "abrogated";

    @JsonProperty("dossier_number")
    private String dossierNumber;

    /** NUMAC. */
    @JsonProperty("document_number")
    private String documentNumber;

    @JsonProperty("title")
    private String title;

    @JsonProperty("document_type")
    private String documentType;

    @JsonProperty("language")
    private String language;

    @JsonProperty("publication_date")
    private String publicationDate;

    @JsonProperty("effective_date")
    private String effectiveDate;

    @JsonProperty("end_validity_date")
    private String endValidityDate;

    @JsonProperty("status")
    private String status;

    @JsonProperty("source")
    private String source;

    @JsonProperty("official_url")
    private String officialUrl;

    /**
     * True once the identifying fields a downstream consumer needs are all present.
     */
    @JsonIgnore
    public boolean isComplete() {
        return notBlank(dossierNumber) && notBlank(title) && notBlank(publicationDate);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
