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
 * Resolved content of a single article. The footnote table is owned here, so footnote
 * numbers are only meaningful together with {@link #getAnchorId()}.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleContent {

    @JsonProperty("article_number")
    private String articleNumber;

    @JsonProperty("anchor_id")
    private String anchorId;

    /** De-bracketed plain text; all footnote offsets point into this string. */
    @JsonProperty("main_text_raw")
    private String mainTextRaw;

    /** Rendered HTML, always derived from the other fields. */
    @JsonProperty("main_text")
    private String mainText;

    @Builder.Default
    @JsonProperty("numbered_provisions")
    private List<Provision> numberedProvisions = List.of();

    @Builder.Default
    @JsonProperty("footnotes")
    private List<Footnote> footnotes = List.of();

    @Builder.Default
    @JsonProperty("footnote_references")
    private List<FootnoteReference> footnoteReferences = List.of();

    @JsonProperty("structured_content_metadata")
    private StructuredContentMetadata structuredContentMetadata;

    /** Set when bracket resolution failed and main_text_raw still carries the markup. */
    @JsonProperty("resolution_skipped")
    private boolean resolutionSkipped;

    @JsonProperty("abrogated")
    private boolean abrogated;

    public List<Provision> getNumberedProvisions() {
        return numberedProvisions == null ? List.of() : List.copyOf(numberedProvisions);
    }

    public List<Footnote> getFootnotes() {
        return footnotes == null ? List.of() : List.copyOf(footnotes);
    }

    public List<FootnoteReference> getFootnoteReferences() {
        return footnoteReferences == null ? List.of() : List.copyOf(footnoteReferences);
    }
}
