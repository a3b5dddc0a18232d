package com.myorg.justelparser.service.processing;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds "§ n." paragraph markers at line starts.
 */
public final class ParagraphSplitter {

    private static final Pattern MARKER = Pattern.compile(
            "(?m)^[ \\t]*§\\s*(\\d+)(er)?((?:/\\d+)?(?:bis|ter|quater|quinquies|sexies)?)\\.?");

    private ParagraphSplitter() {}

    /**
     * Returns the paragraphs of {@code text} in order. Text before the first marker is not a
     * paragraph; callers render it as a lead-in.
     */
    public static List<Paragraph> split(String text) {
        List<Paragraph> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        Matcher m = MARKER.matcher(text);
        while (m.find()) {
            if (!out.isEmpty()) out.get(out.size() - 1).end = m.start();
            out.add(new Paragraph(m.group(1) + m.group(3), m.start(), m.end(), text.length()));
        }
        return out;
    }

    /**
     * Start offsets of the paragraph markers in {@code text}.
     */
    public static List<Integer> boundaries(String text) {
        List<Integer> out = new ArrayList<>();
        for (Paragraph p : split(text)) out.add(p.getStart());
        return out;
    }

    @Getter
    public static final class Paragraph {
        /** Marker number without the ordinal suffix: "§ 1er." gives "1". */
        private final String number;
        private final int start;
        private final int contentStart;
        private int end;

        Paragraph(String number, int start, int contentStart, int end) {
            this.number = number;
            this.start = start;
            this.contentStart = contentStart;
            this.end = end;
        }
    }
}
