package com.myorg.justelparser.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.justelparser.service.CitationParser;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.HandCorrectionStore;
import com.myorg.justelparser.service.HtmlRenderer;
import com.myorg.justelparser.service.ProvisionExtractor;
import com.myorg.justelparser.service.implementation.ArticleHtmlRenderer;
import com.myorg.justelparser.service.implementation.CorpusProcessor;
import com.myorg.justelparser.service.implementation.DegreeMarkerProvisionExtractor;
import com.myorg.justelparser.service.implementation.FileSystemHandCorrectionStore;
import com.myorg.justelparser.service.implementation.JustelDocumentParser;
import com.myorg.justelparser.service.implementation.RegexCitationParser;
import com.myorg.justelparser.service.processing.AbrogationInfoExtractor;
import com.myorg.justelparser.service.processing.ArticleProcessor;
import com.myorg.justelparser.service.processing.BracketSpanResolver;
import com.myorg.justelparser.service.processing.FootnoteSectionParser;
import com.myorg.justelparser.service.processing.HeadingGrammar;
import com.myorg.justelparser.service.processing.HierarchyBuilder;
import com.myorg.justelparser.service.processing.HierarchyValidator;
import com.myorg.justelparser.service.processing.LegalUrlTemplate;
import com.myorg.justelparser.service.processing.ModificationHistoryLinker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Wires the parsing pipeline. The components themselves carry no Spring annotations. */
@Configuration
public class ParserConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HeadingGrammar headingGrammar() {
        return new HeadingGrammar();
    }

    @Bean
    public HierarchyValidator hierarchyValidator(HeadingGrammar grammar) {
        return new HierarchyValidator(grammar);
    }

    @Bean
    public CitationParser citationParser() {
        return new RegexCitationParser();
    }

    @Bean
    public ProvisionExtractor provisionExtractor() {
        return new DegreeMarkerProvisionExtractor();
    }

    @Bean
    public HtmlRenderer htmlRenderer() {
        return new ArticleHtmlRenderer();
    }

    @Bean
    public ArticleProcessor articleProcessor(CitationParser citationParser, ProvisionExtractor provisionExtractor,
                                             HtmlRenderer htmlRenderer, ParserProperties properties, Clock clock) {
        LegalUrlTemplate urls = new LegalUrlTemplate(properties.getCitation().getUrlTemplate());
        return new ArticleProcessor(new FootnoteSectionParser(citationParser, urls), new BracketSpanResolver(),
                provisionExtractor, htmlRenderer, clock);
    }

    @Bean
    public HandCorrectionStore handCorrectionStore(ParserProperties properties, ObjectMapper objectMapper,
                                                   HierarchyValidator validator) {
        String dir = properties.getOverrides().getDirectory();
        if (dir == null || dir.isBlank()) {
            return HandCorrectionStore.empty();
        }
        return new FileSystemHandCorrectionStore(Path.of(dir), objectMapper, validator);
    }

    @Bean
    public DocumentParser documentParser(HandCorrectionStore store, ArticleProcessor articleProcessor,
                                         HeadingGrammar grammar, HierarchyValidator validator, Clock clock) {
        return new JustelDocumentParser(store, articleProcessor, new HierarchyBuilder(grammar), validator,
                new AbrogationInfoExtractor(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService corpusExecutor(ParserProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getCorpus().getWorkerThreads()),
                new CustomizableThreadFactory("corpus-parse-"));
    }

    @Bean
    public CorpusProcessor corpusProcessor(DocumentParser documentParser, ExecutorService corpusExecutor,
                                           ParserProperties properties) {
        return new CorpusProcessor(documentParser, new ModificationHistoryLinker(), corpusExecutor,
                properties.getCorpus().getTimeout());
    }
}
