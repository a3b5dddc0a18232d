package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.BracketMismatchException;
import com.myorg.justelparser.model.FootnoteReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BracketSpanResolver Tests")
class BracketSpanResolverTest {

    private final BracketSpanResolver resolver = new BracketSpanResolver();

    @Test
    @DisplayName("should strip markers and record the span in output offsets")
    void shouldRecordSpan_whenSingleAmendment() throws Exception {
        ResolvedText resolved = resolver.resolve("Le [1 texte inséré]1 reste.");

        assertThat(resolved.getText()).isEqualTo("Le texte inséré reste.");
        assertThat(resolved.getReferences()).hasSize(1);
        FootnoteReference ref = resolved.getReferences().get(0);
        assertThat(ref.getReferenceNumber()).isEqualTo("1");
        assertThat(ref.getTextPosition()).isEqualTo(3);
        assertThat(ref.getEndPosition()).isEqualTo(15);
        assertThat(ref.getReferencedText()).isEqualTo("texte inséré");
        assertThat(ref.getBracketPattern()).isEqualTo("[1 texte inséré]1");
    }

    @Test
    @DisplayName("should emit nested spans outer first")
    void shouldOrderOuterFirst_whenSpansNest() throws Exception {
        ResolvedText resolved = resolver.resolve("[1 a [2 b]2 c]1");

        assertThat(resolved.getText()).isEqualTo("a b c");
        assertThat(resolved.getReferences())
                .extracting(FootnoteReference::getReferenceNumber, FootnoteReference::getTextPosition,
                        FootnoteReference::getEndPosition)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("1", 0, 5),
                        org.assertj.core.groups.Tuple.tuple("2", 2, 3));
    }

    @Test
    @DisplayName("should accept bracketed opener and closer forms")
    void shouldResolve_whenBracketedMarkerForms() throws Exception {
        assertThat(resolver.resolve("[1 texte][1] suite").getText()).isEqualTo("texte suite");
        assertThat(resolver.resolve("[1]texte]1").getText()).isEqualTo("texte");
    }

    @Test
    @DisplayName("should keep digits that run straight after a closer")
    void shouldKeepTrailingDigits_whenCloserRunsIntoNumber() throws Exception {
        ResolvedText resolved = resolver.resolve("[1 loi]12019");

        assertThat(resolved.getText()).isEqualTo("loi2019");
        assertThat(resolved.getReferences().get(0).getEndPosition()).isEqualTo(3);
    }

    @Test
    @DisplayName("should leave ordinary brackets untouched")
    void shouldIgnoreBrackets_whenNotMarkers() throws Exception {
        String raw = "voir [2008-12-22/33](https://example.test) et [abrogé]";

        ResolvedText resolved = resolver.resolve(raw);

        assertThat(resolved.getText()).isEqualTo(raw);
        assertThat(resolved.getReferences()).isEmpty();
    }

    @Test
    @DisplayName("should report the source offset of a mismatched closer")
    void shouldThrow_whenCloserDoesNotMatch() {
        assertThatThrownBy(() -> resolver.resolve("[1 texte]2"))
                .isInstanceOf(BracketMismatchException.class)
                .satisfies(e -> {
                    BracketMismatchException ex = (BracketMismatchException) e;
                    assertThat(ex.getSourceOffset()).isEqualTo(8);
                    assertThat(ex.getOutputOffset()).isEqualTo(5);
                    assertThat(ex.getExpectedId()).isEqualTo("1");
                    assertThat(ex.getFoundId()).isEqualTo("2");
                });
    }

    @Test
    @DisplayName("should reject a closer without opener")
    void shouldThrow_whenStrayCloser() {
        assertThatThrownBy(() -> resolver.resolve("texte]1 suite"))
                .isInstanceOf(BracketMismatchException.class)
                .satisfies(e -> {
                    BracketMismatchException ex = (BracketMismatchException) e;
                    assertThat(ex.getSourceOffset()).isEqualTo(5);
                    assertThat(ex.getExpectedId()).isNull();
                });
    }

    @Test
    @DisplayName("should reject a span that never closes")
    void shouldThrow_whenSpanUnclosed() {
        assertThatThrownBy(() -> resolver.resolve("Début [1 texte"))
                .isInstanceOf(BracketMismatchException.class)
                .satisfies(e -> assertThat(((BracketMismatchException) e).getSourceOffset()).isEqualTo(6));
    }

    @Test
    @DisplayName("should rebuild the text from spans and the text between them")
    void shouldRoundTrip_whenSpansAreSiblings() throws Exception {
        for (String raw : List.of(
                "Le [1 texte]1 et [2 autre]2.",
                "[3 début]3 milieu [4 fin]4",
                "sans marqueur")) {
            ResolvedText resolved = resolver.resolve(raw);

            StringBuilder rebuilt = new StringBuilder();
            int cursor = 0;
            for (FootnoteReference ref : resolved.getReferences()) {
                rebuilt.append(resolved.getText(), cursor, ref.getTextPosition());
                rebuilt.append(ref.getReferencedText());
                cursor = ref.getEndPosition();
            }
            rebuilt.append(resolved.getText().substring(cursor));

            assertThat(rebuilt.toString()).isEqualTo(resolved.getText());
        }
    }

    @Test
    @DisplayName("should be a no-op on already resolved text")
    void shouldBeIdempotent_whenResolvedTwice() throws Exception {
        ResolvedText once = resolver.resolve("Le [1 a [2 b]2 c]1 et [3 d]3.");
        ResolvedText twice = resolver.resolve(once.getText());

        assertThat(twice.getText()).isEqualTo(once.getText());
        assertThat(twice.getReferences()).isEmpty();
    }

    @Test
    @DisplayName("should return empty text for null input")
    void shouldReturnEmpty_whenNull() throws Exception {
        assertThat(resolver.resolve(null).getText()).isEmpty();
    }
}
