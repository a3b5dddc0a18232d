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
 * A numbered provision ("1°") or a lettered sub-item ("a)") of an article.
 * Offsets are half-open and point into the article's main_text_raw.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Provision {

    @JsonProperty("number")
    private String number;

    @JsonProperty("text")
    private String text;

    @Builder.Default
    @JsonProperty("sub_items")
    private List<Provision> subItems = List.of();

    @JsonProperty("start_offset")
    private int startOffset;

    @JsonProperty("end_offset")
    private int endOffset;

    public List<Provision> getSubItems() {
        return subItems == null ? List.of() : List.copyOf(subItems);
    }
}
