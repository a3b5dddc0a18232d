package com.myorg.justelparser.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the date spellings found in the gazette to ISO-8601. Values that cannot be
 * read are returned trimmed but otherwise untouched.
 */
public final class DateNormalizer {

    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})$");
    private static final Pattern FRENCH = Pattern.compile("^(\\d{1,2})(?:er)?\\s+(\\p{L}+)\\s+(\\d{4})$");

    private static final Map<String, Integer> FRENCH_MONTHS = Map.ofEntries(
            Map.entry("janvier", 1), Map.entry("fevrier", 2), Map.entry("février", 2),
            Map.entry("mars", 3), Map.entry("avril", 4), Map.entry("mai", 5),
            Map.entry("juin", 6), Map.entry("juillet", 7), Map.entry("aout", 8),
            Map.entry("août", 8), Map.entry("septembre", 9), Map.entry("octobre", 10),
            Map.entry("novembre", 11), Map.entry("decembre", 12), Map.entry("décembre", 12));

    private DateNormalizer() {}

    public static String toIso(String raw) {
        if (raw == null) return null;
        String s = raw.replace("**", "").trim();
        if (s.isEmpty()) return s;

        Matcher m = ISO.matcher(s);
        if (m.matches()) {
            return format(m.group(1), m.group(2), m.group(3), s);
        }
        m = DAY_FIRST.matcher(s);
        if (m.matches()) {
            return format(m.group(3), m.group(2), m.group(1), s);
        }
        m = FRENCH.matcher(s);
        if (m.matches()) {
            Integer month = FRENCH_MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
            if (month != null) {
                return format(m.group(3), String.valueOf(month), m.group(1), s);
            }
        }
        return s;
    }

    private static String format(String year, String month, String day, String fallback) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)).toString();
        } catch (DateTimeException | NumberFormatException e) {
            return fallback;
        }
    }
}
