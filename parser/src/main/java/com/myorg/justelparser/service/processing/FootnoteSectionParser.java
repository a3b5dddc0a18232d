package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.CitationParseException;
import com.myorg.justelparser.model.Footnote;
import com.myorg.justelparser.model.IssueKind;
import com.myorg.justelparser.model.LegalCitation;
import com.myorg.justelparser.model.ModificationType;
import com.myorg.justelparser.model.ParseIssue;
import com.myorg.justelparser.service.CitationParser;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an article body from its trailing footnote section and parses the footnote table.
 */
@Slf4j
@RequiredArgsConstructor
public class FootnoteSectionParser {

    private static final Pattern SEPARATOR = Pattern.compile("(?m)^[ \\t]*\\\\?-{5,}[ \\t]*$");
    private static final Pattern ENTRY_START = Pattern.compile("(?m)^[ \\t]*\\((\\d+)\\)");

    private final CitationParser citationParser;
    private final LegalUrlTemplate urlTemplate;

    /**
     * Splits at the first separator line. Without a separator the whole body is main text.
     */
    public BodyParts split(String body) {
        if (body == null) return new BodyParts("", "");
        Matcher m = SEPARATOR.matcher(body);
        if (!m.find()) {
            return new BodyParts(stripTrailing(body), "");
        }
        return new BodyParts(stripTrailing(body.substring(0, m.start())), body.substring(m.end()).trim());
    }

    /**
     * Parses every {@code (n)...} entry. Entries that match no citation shape are kept with
     * their raw text and reported.
     */
    public FootnoteTable parse(String footnoteSection, String anchorId) {
        if (footnoteSection == null || footnoteSection.isBlank()) {
            return new FootnoteTable(List.of(), List.of());
        }

        List<int[]> bounds = new ArrayList<>();
        List<String> numbers = new ArrayList<>();
        Matcher m = ENTRY_START.matcher(footnoteSection);
        while (m.find()) {
            if (!bounds.isEmpty()) bounds.get(bounds.size() - 1)[1] = m.start();
            bounds.add(new int[]{m.start(), footnoteSection.length()});
            numbers.add(m.group(1));
        }

        List<Footnote> footnotes = new ArrayList<>();
        List<ParseIssue> issues = new ArrayList<>();
        for (int i = 0; i < bounds.size(); i++) {
            String content = footnoteSection.substring(bounds.get(i)[0], bounds.get(i)[1]).trim();
            String number = numbers.get(i);
            try {
                LegalCitation citation = citationParser.parse(content);
                footnotes.add(Footnote.builder()
                        .footnoteNumber(number)
                        .footnoteContent(content)
                        .lawReference(citation)
                        .effectiveDate(citation.getEffectiveDate())
                        .modificationType(ModificationType.fromPrefix(citation.getPrefix()))
                        .directUrl(urlTemplate.directUrl(citation.getDossierNumber()))
                        .directArticleUrl(urlTemplate.directArticleUrl(citation.getDossierNumber(), citation.getArticleNumber()))
                        .build());
            } catch (CitationParseException e) {
                log.debug("Footnote ({}) of {} kept unparsed: {}", number, anchorId, e.getMessage());
                footnotes.add(Footnote.builder()
                        .footnoteNumber(number)
                        .footnoteContent(content)
                        .build());
                issues.add(ParseIssue.builder()
                        .kind(IssueKind.CITATION_PARSE_ERROR)
                        .anchorId(anchorId)
                        .message("Footnote (" + number + "): " + e.getMessage())
                        .build());
            }
        }
        return new FootnoteTable(footnotes, issues);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    @Getter
    public static final class BodyParts {
        private final String mainText;
        private final String footnoteSection;

        public BodyParts(String mainText, String footnoteSection) {
            this.mainText = mainText;
            this.footnoteSection = footnoteSection;
        }
    }

    @Getter
    public static final class FootnoteTable {
        private final List<Footnote> footnotes;
        private final List<ParseIssue> issues;

        public FootnoteTable(List<Footnote> footnotes, List<ParseIssue> issues) {
            this.footnotes = List.copyOf(footnotes);
            this.issues = List.copyOf(issues);
        }
    }
}
