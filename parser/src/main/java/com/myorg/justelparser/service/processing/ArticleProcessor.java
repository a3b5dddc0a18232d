package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.BracketMismatchException;
import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.Footnote;
import com.myorg.justelparser.model.FootnoteReference;
import com.myorg.justelparser.model.IssueKind;
import com.myorg.justelparser.model.ParseIssue;
import com.myorg.justelparser.model.Provision;
import com.myorg.justelparser.model.StructuredContentMetadata;
import com.myorg.justelparser.model.source.SourceEvent;
import com.myorg.justelparser.service.HtmlRenderer;
import com.myorg.justelparser.service.ProvisionExtractor;
import com.myorg.justelparser.util.AnchorIds;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns one article event into its {@link ArticleContent}. All failures here are scoped to
 * the article and come back as issues.
 */
@Slf4j
@RequiredArgsConstructor
public class ArticleProcessor {

    private static final Pattern ABROGATED = Pattern.compile(
            "^\\s*(?:[\\[(]\\s*abrogé\\s*[\\])]|<\\s*abrogé\\s+par\\b)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TABLE = Pattern.compile("(?m)(?:<table\\b|^[ \\t]*\\|.*\\|[ \\t]*$)");

    private final FootnoteSectionParser footnoteSectionParser;
    private final BracketSpanResolver bracketSpanResolver;
    private final ProvisionExtractor provisionExtractor;
    private final HtmlRenderer htmlRenderer;
    private final Clock clock;

    public ArticleOutcome process(SourceEvent event, String dossierNumber) {
        String articleNumber = event.getArticleNumber();
        if (articleNumber == null || articleNumber.isBlank()) {
            throw new ValidationException("Article event without article_number in " + dossierNumber);
        }
        String anchor = AnchorIds.forArticle(articleNumber);
        List<ParseIssue> issues = new ArrayList<>();

        FootnoteSectionParser.BodyParts parts = footnoteSectionParser.split(event.getBody());
        FootnoteSectionParser.FootnoteTable table = footnoteSectionParser.parse(parts.getFootnoteSection(), anchor);
        issues.addAll(table.getIssues());

        String mainText;
        List<FootnoteReference> references;
        List<Provision> provisions;
        boolean skipped = false;
        try {
            ResolvedText resolved = bracketSpanResolver.resolve(parts.getMainText());
            mainText = resolved.getText();
            references = link(resolved.getReferences(), table.getFootnotes(), anchor, dossierNumber, issues);
            provisions = provisionExtractor.extract(mainText);
        } catch (BracketMismatchException e) {
            log.warn("Bracket mismatch in {} {} at offset {}: {}", dossierNumber, anchor, e.getSourceOffset(), e.getMessage());
            issues.add(ParseIssue.builder()
                    .kind(IssueKind.BRACKET_MISMATCH)
                    .anchorId(anchor)
                    .offset(e.getSourceOffset())
                    .message(e.getMessage())
                    .build());
            mainText = parts.getMainText();
            references = List.of();
            provisions = List.of();
            skipped = true;
        }

        ArticleContent content = ArticleContent.builder()
                .articleNumber(articleNumber.trim())
                .anchorId(anchor)
                .mainTextRaw(mainText)
                .numberedProvisions(provisions)
                .footnotes(table.getFootnotes())
                .footnoteReferences(references)
                .structuredContentMetadata(StructuredContentMetadata.builder()
                        .paragraphCount(paragraphCount(mainText))
                        .provisionCount(provisions.size())
                        .hasTables(TABLE.matcher(mainText).find())
                        .generationTimestamp(clock.instant())
                        .build())
                .resolutionSkipped(skipped)
                .abrogated(ABROGATED.matcher(mainText).find())
                .build();

        content = content.toBuilder().mainText(htmlRenderer.render(content)).build();
        return new ArticleOutcome(content, issues, event.getBody());
    }

    private List<FootnoteReference> link(List<FootnoteReference> refs, List<Footnote> footnotes,
                                         String anchor, String dossierNumber, List<ParseIssue> issues) {
        Map<String, Footnote> byNumber = new HashMap<>();
        for (Footnote f : footnotes) byNumber.putIfAbsent(f.getFootnoteNumber(), f);

        List<FootnoteReference> linked = new ArrayList<>(refs.size());
        for (FootnoteReference ref : refs) {
            Footnote footnote = byNumber.get(ref.getReferenceNumber());
            if (footnote == null) {
                log.debug("Dangling reference [{} in {} {}", ref.getReferenceNumber(), dossierNumber, anchor);
                issues.add(ParseIssue.builder()
                        .kind(IssueKind.DANGLING_FOOTNOTE_REFERENCE)
                        .anchorId(anchor)
                        .offset(ref.getTextPosition())
                        .message("No footnote (" + ref.getReferenceNumber() + ") for span at offset " + ref.getTextPosition())
                        .build());
                linked.add(ref);
            } else {
                linked.add(ref.toBuilder().citation(footnote.getLawReference()).build());
            }
        }
        return linked;
    }

    private static int paragraphCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return Math.max(1, ParagraphSplitter.split(text).size());
    }

    /**
     * Processed article plus the issues raised while processing it. {@code rawBody} is what
     * duplicate detection compares.
     */
    @Getter
    public static final class ArticleOutcome {
        private final ArticleContent content;
        private final List<ParseIssue> issues;
        private final String rawBody;

        public ArticleOutcome(ArticleContent content, List<ParseIssue> issues, String rawBody) {
            this.content = content;
            this.issues = List.copyOf(issues);
            this.rawBody = rawBody;
        }
    }
}
