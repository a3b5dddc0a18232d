package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredContentMetadata {

    @JsonProperty("paragraph_count")
    private int paragraphCount;

    @JsonProperty("provision_count")
    private int provisionCount;

    @JsonProperty("has_tables")
    private boolean hasTables;

    @JsonProperty("generation_timestamp")
    private Instant generationTimestamp;
}
