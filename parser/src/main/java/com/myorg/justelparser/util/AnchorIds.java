package com.myorg.justelparser.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic anchor slugs for article numbers ("2bis" -> "art-2bis",
 * "16 DROIT FUTUR" -> "art-16-droit-futur").
 */
public final class AnchorIds {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern ART_PREFIX = Pattern.compile("^(?i)art(?:icle)?\\.?\\s*");

    private AnchorIds() {}

    public static String forArticle(String articleNumber) {
        if (articleNumber == null || articleNumber.isBlank()) {
            throw new IllegalArgumentException("Article number must not be blank");
        }
        String s = ART_PREFIX.matcher(articleNumber.trim()).replaceFirst("");
        s = Normalizer.normalize(s, Normalizer.Form.NFD);
        s = DIACRITICS.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("-");
        s = trimDashes(s);
        return s.isEmpty() ? "art" : "art-" + s;
    }

    public static String forParagraph(String anchorId, String paragraphNumber) {
        return anchorId + "-par-" + paragraphNumber;
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
