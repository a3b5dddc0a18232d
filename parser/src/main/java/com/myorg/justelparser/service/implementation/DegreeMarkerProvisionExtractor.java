package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.model.Provision;
import com.myorg.justelparser.service.ProvisionExtractor;
import com.myorg.justelparser.service.processing.ParagraphSplitter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts "1°" provisions and their "a)" sub-items.
 *
 * <p>A marker only opens an item at a clause boundary: start of text, a line break, or
 * after {@code :}, {@code ;} or {@code .}. The first marker of a level is also accepted
 * after plain whitespace ("... comprend 1° ..."). A marker after a comma is a cross
 * reference ("art. 3, 1°") and never opens an item. Provisions stop at the next
 * provision or at the next "§" paragraph.
 */
public class DegreeMarkerProvisionExtractor implements ProvisionExtractor {

    private static final Pattern DEGREE_MARKER = Pattern.compile(
            "(?<![\\p{L}\\d])(\\d+°(?:bis|ter|quater|quinquies|sexies)?)");
    private static final Pattern LETTER_MARKER = Pattern.compile("(?<![\\p{L}\\d])([a-z]\\))");
    private static final Pattern ART_ABBREVIATION = Pattern.compile("(?i)\\bart\\.$");

    @Override
    public List<Provision> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<MatchResult> markers = boundaryMarkers(DEGREE_MARKER, text, 0, text.length());
        List<Integer> paragraphStarts = ParagraphSplitter.boundaries(text);

        List<Provision> provisions = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            int start = markers.get(i).start();
            int bodyStart = markers.get(i).end();
            int limit = i + 1 < markers.size() ? markers.get(i + 1).start() : text.length();
            for (int p : paragraphStarts) {
                if (p > start && p < limit) {
                    limit = p;
                    break;
                }
            }
            int end = trimEnd(text, bodyStart, limit);
            provisions.add(Provision.builder()
                    .number(markers.get(i).group(1))
                    .text(text.substring(trimStart(text, bodyStart, end), end))
                    .subItems(subItems(text, bodyStart, end))
                    .startOffset(start)
                    .endOffset(end)
                    .build());
        }
        return provisions;
    }

    private List<Provision> subItems(String text, int from, int to) {
        List<MatchResult> markers = boundaryMarkers(LETTER_MARKER, text, from, to);
        List<Provision> items = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            int bodyStart = markers.get(i).end();
            int limit = i + 1 < markers.size() ? markers.get(i + 1).start() : to;
            int end = trimEnd(text, bodyStart, limit);
            items.add(Provision.builder()
                    .number(markers.get(i).group(1))
                    .text(text.substring(trimStart(text, bodyStart, end), end))
                    .startOffset(markers.get(i).start())
                    .endOffset(end)
                    .build());
        }
        return items;
    }

    private List<MatchResult> boundaryMarkers(Pattern pattern, String text, int from, int to) {
        List<MatchResult> out = new ArrayList<>();
        Matcher m = pattern.matcher(text).region(from, to);
        m.useTransparentBounds(true);
        while (m.find()) {
            if (isBoundary(text, from, m.start(), out.isEmpty())) {
                out.add(m.toMatchResult());
            }
        }
        return out;
    }

    private boolean isBoundary(String text, int regionStart, int markerStart, boolean first) {
        int q = markerStart - 1;
        boolean sawWhitespace = false;
        boolean sawNewline = false;
        while (q >= regionStart && Character.isWhitespace(text.charAt(q))) {
            sawWhitespace = true;
            if (text.charAt(q) == '\n') sawNewline = true;
            q--;
        }
        if (q < regionStart || sawNewline) return true;

        char prev = text.charAt(q);
        if (prev == ',') return false;
        if (prev == ':' || prev == ';') return true;
        if (prev == '.') return !ART_ABBREVIATION.matcher(text.substring(Math.max(0, q - 4), q + 1)).find();
        return first && sawWhitespace;
    }

    private static int trimEnd(String text, int from, int to) {
        int end = to;
        while (end > from && isTrailingSeparator(text.charAt(end - 1))) end--;
        return end;
    }

    private static int trimStart(String text, int from, int to) {
        int start = from;
        while (start < to && Character.isWhitespace(text.charAt(start))) start++;
        return start;
    }

    private static boolean isTrailingSeparator(char c) {
        return Character.isWhitespace(c) || c == ';' || c == ',';
    }
}
