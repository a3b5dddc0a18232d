package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseIssue {

    @JsonProperty("kind")
    private IssueKind kind;

    // null for document-scoped issues
    @JsonProperty("anchor_id")
    private String anchorId;

    @JsonProperty("offset")
    private Integer offset;

    @JsonProperty("message")
    private String message;
}
