package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class ExternalLinks {

    @Builder.Default
    @JsonProperty("official_links")
    private List<String> officialLinks = List.of();

    @Builder.Default
    @JsonProperty("parliamentary_work")
    private List<String> parliamentaryWork = List.of();

    public List<String> getOfficialLinks() {
        return officialLinks == null ? List.of() : List.copyOf(officialLinks);
    }

    public List<String> getParliamentaryWork() {
        return parliamentaryWork == null ? List.of() : List.copyOf(parliamentaryWork);
    }

    public static ExternalLinks empty() {
        return ExternalLinks.builder().build();
    }
}
