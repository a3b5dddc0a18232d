package com.myorg.justelparser.model.source;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.justelparser.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One entry of the flat event stream emitted by the upstream tokenizer.
 * Headings fill the title fields, articles fill {@code articleNumber} and {@code body}.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceEvent {

    @JsonProperty("kind")
    private EventKind kind;

    // optional for headings; classified from title_type when absent
    @JsonProperty("type")
    private NodeType type;

    @JsonProperty("title_type")
    private String titleType;

    @JsonProperty("title_content")
    private String titleContent;

    @JsonProperty("rank")
    private Integer rank;

    @JsonProperty("article_number")
    private String articleNumber;

    /** Raw article text, optionally followed by a hyphen separator line and footnotes. */
    @JsonProperty("body")
    private String body;

    public static SourceEvent heading(String titleType, String titleContent) {
        return SourceEvent.builder()
                .kind(EventKind.HEADING)
                .titleType(titleType)
                .titleContent(titleContent)
                .build();
    }

    public static SourceEvent article(String articleNumber, String body) {
        return SourceEvent.builder()
                .kind(EventKind.ARTICLE)
                .articleNumber(articleNumber)
                .body(body)
                .build();
    }
}
