package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.metrics.PerfProbe;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseStatus;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.processing.AmendmentIndex;
import com.myorg.justelparser.service.processing.ModificationHistoryLinker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Parses a corpus with one task per document, waits for all of them, then links
 * modification history across the documents that produced a tree.
 */
@Slf4j
public class CorpusProcessor {

    private final DocumentParser documentParser;
    private final ModificationHistoryLinker linker;
    private final ExecutorService executor;
    private final Duration timeout;

    public CorpusProcessor(DocumentParser documentParser, ModificationHistoryLinker linker,
                           ExecutorService executor, Duration timeout) {
        this.documentParser = documentParser;
        this.linker = linker;
        this.executor = executor;
        this.timeout = timeout;
    }

    public List<DocumentParseResult> process(List<SourceDocument> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new ValidationException("Corpus must contain at least one document");
        }
        PerfProbe probe = new PerfProbe("corpus");

        List<Callable<DocumentParseResult>> tasks = new ArrayList<>(sources.size());
        for (SourceDocument source : sources) {
            tasks.add(() -> documentParser.parse(source));
        }

        List<Future<DocumentParseResult>> futures;
        try {
            futures = hasTimeout()
                    ? executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing corpus", e);
        }

        List<DocumentParseResult> results = new ArrayList<>(sources.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(collect(futures.get(i), sources.get(i)));
        }
        probe.mark("documents parsed", results.size());

        results = link(results, sources);
        probe.mark("history linked", results.size());
        probe.done("corpus of " + results.size());
        return results;
    }

    private DocumentParseResult collect(Future<DocumentParseResult> future, SourceDocument source) {
        String dossier = source == null ? null : source.getDossierNumber();
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Document {} abandoned after corpus timeout {}", dossier, timeout);
            return DocumentParseResult.failed(dossier, ParseStatus.TIMED_OUT, "Abandoned after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Document {} failed: {}", dossier, cause.getMessage(), cause);
            return DocumentParseResult.failed(dossier, ParseStatus.FAILED, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DocumentParseResult.failed(dossier, ParseStatus.FAILED, "Interrupted");
        }
    }

    private List<DocumentParseResult> link(List<DocumentParseResult> results, List<SourceDocument> sources) {
        List<LegalDocument> documents = new ArrayList<>();
        for (DocumentParseResult r : results) {
            if (r.getDocument() != null) documents.add(r.getDocument());
        }
        List<LegalDocument> linked = linker.link(documents, AmendmentIndex.harvest(sources));

        Map<LegalDocument, LegalDocument> replacement = new IdentityHashMap<>();
        for (int i = 0; i < documents.size(); i++) replacement.put(documents.get(i), linked.get(i));

        List<DocumentParseResult> out = new ArrayList<>(results.size());
        for (DocumentParseResult r : results) {
            out.add(r.getDocument() == null ? r : r.toBuilder().document(replacement.get(r.getDocument())).build());
        }
        return out;
    }

    private boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
