package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.FootnoteReference;
import com.myorg.justelparser.model.LegalCitation;
import com.myorg.justelparser.model.Provision;
import com.myorg.justelparser.service.HtmlRenderer;
import com.myorg.justelparser.service.processing.ParagraphSplitter;
import com.myorg.justelparser.service.processing.ParagraphSplitter.Paragraph;
import com.myorg.justelparser.util.AnchorIds;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Renders an article into the fixed semantic template:
 * <pre>
 * &lt;article class="legal-article" id="art-1"&gt;
 *   &lt;header&gt;&lt;h2 class="article-number"&gt;Art. 1&lt;/h2&gt;&lt;/header&gt;
 *   &lt;div class="article-content"&gt;
 *     &lt;section class="paragraph" id="art-1-par-1"&gt; ... &lt;/section&gt;
 *   &lt;/div&gt;
 * &lt;/article&gt;
 * </pre>
 * Footnote spans are nested {@code span.footnote-ref} elements, clipped to the block they
 * fall in. Output depends only on the content passed in.
 */
public class ArticleHtmlRenderer implements HtmlRenderer {

    private static final Comparator<FootnoteReference> OPEN_ORDER =
            Comparator.comparingInt(FootnoteReference::getTextPosition)
                    .thenComparing(Comparator.comparingInt(FootnoteReference::getEndPosition).reversed())
                    .thenComparing(FootnoteReference::getReferenceNumber);

    @Override
    public String render(ArticleContent content) {
        String anchor = content.getAnchorId();
        String text = content.getMainTextRaw() == null ? "" : content.getMainTextRaw();

        StringBuilder html = new StringBuilder();
        html.append("<article class=\"legal-article\" id=\"").append(attr(anchor)).append("\">\n");
        html.append("<header><h2 class=\"article-number\">Art. ")
                .append(escape(content.getArticleNumber())).append("</h2></header>\n");
        html.append("<div class=\"article-content\">\n");

        if (content.isResolutionSkipped()) {
            // markup is still in the text, so offsets are meaningless
            appendParagraph(html, text, 0, text.length(), List.of());
        } else {
            List<FootnoteReference> refs = content.getFootnoteReferences();
            List<Provision> provisions = content.getNumberedProvisions();
            List<Paragraph> paragraphs = ParagraphSplitter.split(text);
            if (paragraphs.isEmpty()) {
                appendBlock(html, text, 0, text.length(), provisions, refs);
            } else {
                appendBlock(html, text, 0, paragraphs.get(0).getStart(), provisions, refs);
                for (Paragraph p : paragraphs) {
                    html.append("<section class=\"paragraph\" id=\"")
                            .append(attr(AnchorIds.forParagraph(anchor, p.getNumber())))
                            .append("\">\n");
                    html.append("<span class=\"paragraph-number\">")
                            .append(escape(text.substring(p.getStart(), p.getContentStart()).trim()))
                            .append("</span>\n");
                    appendBlock(html, text, p.getContentStart(), p.getEnd(), provisions, refs);
                    html.append("</section>\n");
                }
            }
        }

        html.append("</div>\n</article>");
        return html.toString();
    }

    private void appendBlock(StringBuilder html, String text, int from, int to,
                             List<Provision> provisions, List<FootnoteReference> refs) {
        List<Provision> inBlock = new ArrayList<>();
        for (Provision p : provisions) {
            if (p.getStartOffset() >= from && p.getStartOffset() < to) inBlock.add(p);
        }
        if (inBlock.isEmpty()) {
            appendParagraph(html, text, from, to, refs);
            return;
        }

        appendParagraph(html, text, from, inBlock.get(0).getStartOffset(), refs);
        html.append("<ol class=\"numbered-provisions\">\n");
        for (Provision p : inBlock) {
            appendProvision(html, text, p, Math.min(p.getEndOffset(), to), refs, "provision");
        }
        html.append("</ol>\n");

        Provision last = inBlock.get(inBlock.size() - 1);
        appendParagraph(html, text, Math.min(last.getEndOffset(), to), to, refs);
    }

    private void appendProvision(StringBuilder html, String text, Provision p, int end,
                                 List<FootnoteReference> refs, String cssClass) {
        int bodyStart = Math.min(p.getStartOffset() + p.getNumber().length(), end);
        html.append("<li class=\"").append(cssClass).append("\" data-number=\"")
                .append(attr(p.getNumber())).append("\">");
        html.append("<span class=\"provision-number\">").append(escape(p.getNumber())).append("</span> ");

        List<Provision> subs = p.getSubItems();
        if (subs.isEmpty()) {
            appendInline(html, text, bodyStart, end, refs);
        } else {
            appendInline(html, text, bodyStart, Math.min(subs.get(0).getStartOffset(), end), refs);
            html.append("\n<ol class=\"sub-items\">\n");
            for (Provision sub : subs) {
                appendProvision(html, text, sub, Math.min(sub.getEndOffset(), end), refs, "sub-item");
            }
            html.append("</ol>\n");
        }
        html.append("</li>\n");
    }

    private void appendParagraph(StringBuilder html, String text, int from, int to,
                                 List<FootnoteReference> refs) {
        int[] r = trim(text, from, to);
        if (r[0] >= r[1]) return;
        html.append("<p>");
        appendInline(html, text, r[0], r[1], refs);
        html.append("</p>\n");
    }

    /**
     * Writes {@code text[from, to)} with every overlapping reference as a nested span.
     */
    private void appendInline(StringBuilder html, String text, int from, int to,
                              List<FootnoteReference> refs) {
        int[] r = trim(text, from, to);
        from = r[0];
        to = r[1];
        if (from >= to) return;

        List<FootnoteReference> overlapping = new ArrayList<>();
        for (FootnoteReference ref : refs) {
            if (ref.getTextPosition() < to && ref.getEndPosition() > from) overlapping.add(ref);
        }
        overlapping.sort(OPEN_ORDER);

        Deque<Integer> openEnds = new ArrayDeque<>();
        int cursor = from;
        int next = 0;
        while (next < overlapping.size() || !openEnds.isEmpty()) {
            int nextOpen = next < overlapping.size()
                    ? Math.max(overlapping.get(next).getTextPosition(), from) : Integer.MAX_VALUE;
            int nextClose = openEnds.isEmpty() ? Integer.MAX_VALUE : openEnds.peek();
            if (nextClose <= nextOpen) {
                html.append(escape(text.substring(cursor, nextClose)));
                cursor = nextClose;
                html.append("</span>");
                openEnds.pop();
            } else {
                FootnoteReference ref = overlapping.get(next++);
                html.append(escape(text.substring(cursor, nextOpen)));
                cursor = nextOpen;
                int end = Math.min(ref.getEndPosition(), to);
                if (!openEnds.isEmpty()) end = Math.min(end, openEnds.peek());
                html.append(openSpan(ref));
                openEnds.push(end);
            }
        }
        html.append(escape(text.substring(cursor, to)));
    }

    private String openSpan(FootnoteReference ref) {
        StringBuilder s = new StringBuilder("<span class=\"footnote-ref\" data-footnote=\"")
                .append(attr(ref.getReferenceNumber())).append('"');
        LegalCitation c = ref.getCitation();
        if (c != null) {
            dataAttr(s, "data-citation-type", c.getCitationType() == null ? null : c.getCitationType().getWireName());
            dataAttr(s, "data-law-type", c.getLawType());
            dataAttr(s, "data-dossier", c.getDossierNumber());
            dataAttr(s, "data-article", c.getArticleNumber());
            dataAttr(s, "data-sequence", c.getSequenceNumber());
            dataAttr(s, "data-effective-date", c.getEffectiveDate());
            dataAttr(s, "data-url", c.getUrl());
        } else {
            s.append(" data-unresolved=\"true\"");
        }
        return s.append('>').toString();
    }

    private static void dataAttr(StringBuilder s, String name, String value) {
        if (value == null || value.isEmpty()) return;
        s.append(' ').append(name).append("=\"").append(attr(value)).append('"');
    }

    private static int[] trim(String text, int from, int to) {
        while (from < to && Character.isWhitespace(text.charAt(from))) from++;
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
        return new int[]{from, to};
    }

    private static String escape(String s) {
        if (s == null) return "";
        return HtmlUtils.htmlEscape(s, "UTF-8").replace("\n", "<br>");
    }

    private static String attr(String s) {
        return s == null ? "" : HtmlUtils.htmlEscape(s, "UTF-8");
    }
}
