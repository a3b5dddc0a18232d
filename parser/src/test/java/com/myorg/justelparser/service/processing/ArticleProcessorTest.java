package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.FootnoteReference;
import com.myorg.justelparser.model.IssueKind;
import com.myorg.justelparser.model.ParseIssue;
import com.myorg.justelparser.model.source.SourceEvent;
import com.myorg.justelparser.service.implementation.ArticleHtmlRenderer;
import com.myorg.justelparser.service.implementation.DegreeMarkerProvisionExtractor;
import com.myorg.justelparser.service.implementation.RegexCitationParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArticleProcessor Tests")
class ArticleProcessorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ArticleProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ArticleProcessor(
                new FootnoteSectionParser(new RegexCitationParser(), new LegalUrlTemplate("https://example.test/loi?cn={cn}")),
                new BracketSpanResolver(),
                new DegreeMarkerProvisionExtractor(),
                new ArticleHtmlRenderer(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should link spans to footnotes and report dangling ones")
    void shouldLinkReferences_whenFootnotesPresent() {
        String body = "Le [1 texte]1 et [2 autre]2.\n-----\n(1)<L 2008-12-22/33, art. 105, 013; En vigueur : 08-01-2009>";

        ArticleProcessor.ArticleOutcome outcome = processor.process(SourceEvent.article("1er", body), "2000-01-01/01");
        ArticleContent content = outcome.getContent();

        assertThat(content.getAnchorId()).isEqualTo("art-1er");
        assertThat(content.getMainTextRaw()).isEqualTo("Le texte et autre.");
        assertThat(content.getFootnotes()).hasSize(1);
        assertThat(content.getFootnoteReferences()).hasSize(2);
        FootnoteReference linked = content.getFootnoteReferences().get(0);
        assertThat(linked.getCitation().getDossierNumber()).isEqualTo("2008-12-22/33");
        assertThat(content.getFootnoteReferences().get(1).getCitation()).isNull();

        assertThat(outcome.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.DANGLING_FOOTNOTE_REFERENCE);
            assertThat(issue.getOffset()).isEqualTo(12);
        });
        assertThat(content.getMainText())
                .startsWith("<article class=\"legal-article\" id=\"art-1er\">")
                .contains("data-dossier=\"2008-12-22/33\"")
                .contains("data-unresolved=\"true\"");
        assertThat(outcome.getRawBody()).isEqualTo(body);
    }

    @Test
    @DisplayName("should fall back to raw text when brackets do not balance")
    void shouldSkipResolution_whenBracketMismatch() {
        ArticleProcessor.ArticleOutcome outcome = processor.process(
                SourceEvent.article("2", "[1 texte]2"), "2000-01-01/01");
        ArticleContent content = outcome.getContent();

        assertThat(content.isResolutionSkipped()).isTrue();
        assertThat(content.getMainTextRaw()).isEqualTo("[1 texte]2");
        assertThat(content.getFootnoteReferences()).isEmpty();
        assertThat(content.getNumberedProvisions()).isEmpty();
        assertThat(outcome.getIssues()).extracting(ParseIssue::getKind, ParseIssue::getOffset)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(IssueKind.BRACKET_MISMATCH, 8));
    }

    @Test
    @DisplayName("should fill structured metadata from the resolved text")
    void shouldComputeMetadata_whenParagraphsAndProvisions() {
        String body = "§ 1er. Sont visés :\n1° les communes;\n2° les provinces.\n§ 2. Le Roi fixe les modalités.";

        ArticleContent content = processor.process(SourceEvent.article("3", body), "2000-01-01/01").getContent();

        assertThat(content.getNumberedProvisions()).hasSize(2);
        assertThat(content.getStructuredContentMetadata().getParagraphCount()).isEqualTo(2);
        assertThat(content.getStructuredContentMetadata().getProvisionCount()).isEqualTo(2);
        assertThat(content.getStructuredContentMetadata().isHasTables()).isFalse();
        assertThat(content.getStructuredContentMetadata().getGenerationTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("should flag abrogated articles")
    void shouldFlagAbrogated_whenBodyIsAbrogationMarker() {
        ArticleContent content = processor.process(SourceEvent.article("4", "(Abrogé)"), "2000-01-01/01").getContent();

        assertThat(content.isAbrogated()).isTrue();
    }

    @Test
    @DisplayName("should reject article events without number")
    void shouldThrow_whenArticleNumberMissing() {
        assertThatThrownBy(() -> processor.process(SourceEvent.article(" ", "texte"), "2000-01-01/01"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("2000-01-01/01");
    }
}
