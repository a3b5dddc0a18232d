package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseStatus;
import com.myorg.justelparser.model.References;
import com.myorg.justelparser.model.source.AmendmentDeclaration;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.processing.ModificationHistoryLinker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CorpusProcessor Tests")
class CorpusProcessorTest {

    @Mock
    private DocumentParser documentParser;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("should parse every document and link amendment history")
    void shouldParseAndLink_whenCorpusValid() {
        when(documentParser.parse(any())).thenAnswer(inv -> parsed(inv.getArgument(0)));
        SourceDocument x = source("X", "2010-01-01");
        SourceDocument y = source("Y", "2020-01-01").toBuilder()
                .amends(List.of(AmendmentDeclaration.builder().targetDossierNumber("X").modifiedArticles(List.of("1", "4")).build()))
                .build();
        CorpusProcessor processor = new CorpusProcessor(documentParser, new ModificationHistoryLinker(), executor, Duration.ofSeconds(30));

        List<DocumentParseResult> results = processor.process(List.of(x, y));

        assertThat(results).extracting(DocumentParseResult::getDossierNumber).containsExactly("X", "Y");
        assertThat(results).extracting(DocumentParseResult::getStatus).containsOnly(ParseStatus.PARSED);
        assertThat(results.get(0).getDocument().getReferences().getModifiedBy())
                .singleElement().satisfies(r -> assertThat(r.getDossierNumber()).isEqualTo("Y"));
        assertThat(results.get(1).getDocument().getReferences().getModifies())
                .singleElement().satisfies(r -> assertThat(r.getDossierNumber()).isEqualTo("X"));
    }

    @Test
    @DisplayName("should turn a parser crash into a failed result without stopping the corpus")
    void shouldReturnFailed_whenParserThrows() {
        when(documentParser.parse(any())).thenAnswer(inv -> {
            SourceDocument s = inv.getArgument(0);
            if ("BAD".equals(s.getDossierNumber())) throw new IllegalStateException("boom");
            return parsed(s);
        });
        CorpusProcessor processor = new CorpusProcessor(documentParser, new ModificationHistoryLinker(), executor, Duration.ZERO);

        List<DocumentParseResult> results = processor.process(List.of(source("A", null), source("BAD", null)));

        assertThat(results.get(0).getStatus()).isEqualTo(ParseStatus.PARSED);
        assertThat(results.get(1).getStatus()).isEqualTo(ParseStatus.FAILED);
        assertThat(results.get(1).getErrorMessage()).isEqualTo("boom");
        assertThat(results.get(1).getDocument()).isNull();
        assertThat(results.get(1).requiresHandCorrection()).isTrue();
    }

    @Test
    @DisplayName("should abandon documents still running when the corpus timeout expires")
    void shouldReturnTimedOut_whenParserHangs() {
        CountDownLatch never = new CountDownLatch(1);
        when(documentParser.parse(any())).thenAnswer(inv -> {
            SourceDocument s = inv.getArgument(0);
            if ("SLOW".equals(s.getDossierNumber())) never.await();
            return parsed(s);
        });
        CorpusProcessor processor = new CorpusProcessor(documentParser, new ModificationHistoryLinker(), executor, Duration.ofMillis(300));

        List<DocumentParseResult> results = processor.process(List.of(source("FAST", null), source("SLOW", null)));

        assertThat(results.get(0).getStatus()).isEqualTo(ParseStatus.PARSED);
        assertThat(results.get(1).getStatus()).isEqualTo(ParseStatus.TIMED_OUT);
        assertThat(results.get(1).getDossierNumber()).isEqualTo("SLOW");
    }

    @Test
    @DisplayName("should reject an empty corpus")
    void shouldThrow_whenCorpusEmpty() {
        CorpusProcessor processor = new CorpusProcessor(documentParser, new ModificationHistoryLinker(), executor, Duration.ZERO);

        assertThatThrownBy(() -> processor.process(List.of())).isInstanceOf(ValidationException.class);
        verifyNoInteractions(documentParser);
    }

    private static SourceDocument source(String dossier, String publicationDate) {
        return SourceDocument.builder()
                .dossierNumber(dossier)
                .metadata(DocumentMetadata.builder().dossierNumber(dossier).title("Acte " + dossier)
                        .publicationDate(publicationDate).build())
                .build();
    }

    private static DocumentParseResult parsed(SourceDocument source) {
        return DocumentParseResult.builder()
                .dossierNumber(source.getDossierNumber())
                .status(ParseStatus.PARSED)
                .document(LegalDocument.builder()
                        .documentMetadata(source.getMetadata())
                        .references(References.empty())
                        .build())
                .build();
    }
}
