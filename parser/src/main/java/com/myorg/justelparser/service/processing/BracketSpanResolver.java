package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.BracketMismatchException;
import com.myorg.justelparser.model.FootnoteReference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Single-pass scanner for amendment spans {@code [id text]id}.
 *
 * <p>Recognized markers:
 * <ul>
 *   <li>opener {@code [id} followed by one whitespace character (consumed), or {@code [id]}</li>
 *   <li>closer {@code ]id}, or {@code ][id]}</li>
 * </ul>
 * Any other bracket is ordinary text. Offsets are lengths of the output buffer, so they are
 * stable no matter what the rest of the document contains.
 */
public class BracketSpanResolver {

    private static final Comparator<FootnoteReference> SOURCE_ORDER =
            Comparator.comparingInt(FootnoteReference::getTextPosition)
                    .thenComparing(Comparator.comparingInt(FootnoteReference::getEndPosition).reversed());

    public ResolvedText resolve(String raw) throws BracketMismatchException {
        if (raw == null || raw.isEmpty()) {
            return new ResolvedText(raw == null ? "" : raw, List.of());
        }

        StringBuilder out = new StringBuilder(raw.length());
        Deque<OpenSpan> stack = new ArrayDeque<>();
        List<FootnoteReference> refs = new ArrayList<>();

        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i);

            if (c == '[') {
                int digitsEnd = digitsEnd(raw, i + 1);
                if (digitsEnd > i + 1 && digitsEnd < n) {
                    char after = raw.charAt(digitsEnd);
                    if (Character.isWhitespace(after) || after == ']') {
                        stack.push(new OpenSpan(raw.substring(i + 1, digitsEnd), i, out.length()));
                        i = digitsEnd + 1;
                        continue;
                    }
                }
            } else if (c == ']') {
                Closer closer = readCloser(raw, i);
                if (closer != null) {
                    if (stack.isEmpty()) {
                        throw new BracketMismatchException(
                                "Closer ]" + closer.digits + " at offset " + i + " has no matching opener",
                                i, out.length(), null, closer.digits);
                    }
                    OpenSpan top = stack.peek();
                    int consumedEnd;
                    if (closer.digits.equals(top.id)) {
                        consumedEnd = closer.end;
                    } else if (!closer.bracketed && closer.digits.startsWith(top.id)) {
                        // closer runs straight into following digits, e.g. "]12019"
                        consumedEnd = i + 1 + top.id.length();
                    } else {
                        throw new BracketMismatchException(
                                "Closer ]" + closer.digits + " at offset " + i + " does not match open span " + top.id,
                                i, out.length(), top.id, closer.digits);
                    }
                    stack.pop();
                    refs.add(FootnoteReference.builder()
                            .referenceNumber(top.id)
                            .textPosition(top.outputStart)
                            .endPosition(out.length())
                            .referencedText(out.substring(top.outputStart))
                            .bracketPattern(raw.substring(top.sourceStart, consumedEnd))
                            .build());
                    i = consumedEnd;
                    continue;
                }
            }

            out.append(c);
            i++;
        }

        if (!stack.isEmpty()) {
            OpenSpan unclosed = stack.peek();
            throw new BracketMismatchException(
                    "Span [" + unclosed.id + " opened at offset " + unclosed.sourceStart + " is never closed",
                    unclosed.sourceStart, out.length(), unclosed.id, null);
        }

        refs.sort(SOURCE_ORDER);
        return new ResolvedText(out.toString(), refs);
    }

    private static Closer readCloser(String raw, int i) {
        int n = raw.length();
        if (i + 1 >= n) return null;
        if (Character.isDigit(raw.charAt(i + 1))) {
            int end = digitsEnd(raw, i + 1);
            return new Closer(raw.substring(i + 1, end), end, false);
        }
        // "][id]" form
        if (raw.charAt(i + 1) == '[') {
            int end = digitsEnd(raw, i + 2);
            if (end > i + 2 && end < n && raw.charAt(end) == ']') {
                return new Closer(raw.substring(i + 2, end), end + 1, true);
            }
        }
        return null;
    }

    private static int digitsEnd(String s, int from) {
        int j = from;
        while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
        return j;
    }

    private static final class OpenSpan {
        final String id;
        final int sourceStart;
        final int outputStart;

        OpenSpan(String id, int sourceStart, int outputStart) {
            this.id = id;
            this.sourceStart = sourceStart;
            this.outputStart = outputStart;
        }
    }

    private static final class Closer {
        final String digits;
        final int end;
        final boolean bracketed;

        Closer(String digits, int end, boolean bracketed) {
            this.digits = digits;
            this.end = end;
            this.bracketed = bracketed;
        }
    }
}
