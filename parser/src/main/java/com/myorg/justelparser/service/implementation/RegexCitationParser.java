package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.exception.CitationParseException;
import com.myorg.justelparser.model.CitationType;
import com.myorg.justelparser.model.LegalCitation;
import com.myorg.justelparser.service.CitationParser;
import com.myorg.justelparser.util.DateNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based citation parser. Both the standard and the "Abrogé par" shapes share one
 * template; the prefix decides the citation type.
 */
@Slf4j
public class RegexCitationParser implements CitationParser {

    // groups: 1 footnote no, 2 prefix, 3 law type, 4 dossier in brackets, 5 bare dossier,
    // 6 url, 7 article, 8 sequence, 9 effective date
    private static final Pattern CITATION = Pattern.compile(
            "(?:\\((\\d+)\\)\\s*)?"
                    + "<\\s*(?:(Inséré(?:\\s+pour\\s+la\\s+Région\\s+\\S+)?\\s+par|intitulé\\s+modifié\\s+par"
                    + "|Modifié\\s+par|Abrogé\\s+par|Remplacé\\s+par)\\s+)?"
                    + "([A-Z]+)\\s+"
                    + "(?:\\[([^\\]]+)\\]|(\\d{4}-\\d{2}-\\d{2}/\\d+))"
                    + "(?:\\(([^)\\s]+)\\))?"
                    + "(?:\\s*,\\s*art\\.\\s*([^,;>]+))?"
                    + "(?:\\s*,\\s*([^;>]+))?"
                    + "(?:\\s*;\\s*(?:\\*\\*)?\\s*En\\s+vigueur\\s*:?\\s*(?:\\*\\*)?([^>]*))?"
                    + "\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern DOSSIER = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})/(\\d+)");
    private static final Pattern ARTICLE = Pattern.compile("^\\s*(\\d+(?:[a-z]+)?(?:/\\d+)?)", Pattern.CASE_INSENSITIVE);

    @Override
    public LegalCitation parse(String raw) throws CitationParseException {
        if (raw == null || raw.isBlank()) {
            throw new CitationParseException("Empty citation", raw);
        }
        Matcher m = CITATION.matcher(raw);
        if (!m.find()) {
            throw new CitationParseException("No citation shape matches: " + abbreviate(raw), raw);
        }
        return toCitation(m);
    }

    @Override
    public List<LegalCitation> findAll(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<LegalCitation> out = new ArrayList<>();
        Matcher m = CITATION.matcher(text);
        while (m.find()) {
            out.add(toCitation(m));
        }
        log.debug("Found {} citation(s) in {} chars", out.size(), text.length());
        return out;
    }

    private LegalCitation toCitation(Matcher m) {
        String prefix = clean(m.group(2));
        String dossierRaw = m.group(4) != null ? m.group(4) : m.group(5);
        return LegalCitation.builder()
                .citationType(isAbrogation(prefix) ? CitationType.ABROGATION : CitationType.STANDARD)
                .lawType(m.group(3).toUpperCase(Locale.ROOT))
                .dossierNumber(dossier(dossierRaw))
                .articleNumber(article(m.group(7)))
                .sequenceNumber(clean(m.group(8)))
                .effectiveDate(DateNormalizer.toIso(clean(m.group(9))))
                .url(clean(m.group(6)))
                .matchedText(m.group(0))
                .startPos(m.start())
                .endPos(m.end())
                .footnoteNumber(m.group(1))
                .prefix(prefix)
                .build();
    }

    private static boolean isAbrogation(String prefix) {
        return prefix != null && prefix.toLowerCase(Locale.ROOT).startsWith("abrogé");
    }

    private static String dossier(String raw) {
        if (raw == null) return null;
        Matcher m = DOSSIER.matcher(raw);
        return m.find() ? m.group(1) + "/" + m.group(2) : raw.trim();
    }

    private static String article(String raw) {
        if (raw == null) return null;
        Matcher m = ARTICLE.matcher(raw);
        return m.find() ? m.group(1) : raw.trim();
    }

    private static String clean(String s) {
        if (s == null) return null;
        String t = s.replace("**", "").trim();
        return t.isEmpty() ? null : t;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
