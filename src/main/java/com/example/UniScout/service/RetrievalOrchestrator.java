package com.example.UniScout.service;

import com.example.UniScout.config.OrchestratorProperties;
import com.example.UniScout.model.AllowedDomainSet;
import com.example.UniScout.model.Answer;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.BackendReport;
import com.example.UniScout.model.BackendStatus;
import com.example.UniScout.model.ClassificationVerdict;
import com.example.UniScout.model.CompositionMode;
import com.example.UniScout.model.Diagnostics;
import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.OrchestrationOutcome;
import com.example.UniScout.model.OrchestrationRequest;
import com.example.UniScout.model.OrchestrationState;
import com.example.UniScout.model.ProgressEvent;
import com.example.UniScout.model.ProgressStep;
import com.example.UniScout.model.QueryPlan;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchPreview;
import com.example.UniScout.model.SearchResult;
import com.example.UniScout.model.Sentinel;
import com.example.UniScout.search.BackendException;
import com.example.UniScout.search.BackendRegistry;
import com.example.UniScout.search.SearchBackend;
import com.example.UniScout.util.AnswerMessages;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Runs one question through the full pipeline:
 *
 *   VALIDATING -> PER_BACKEND_SEARCH -> FILTER_AND_MERGE -> SYNTHESIZING -> DONE
 *
 * - a denied query never reaches a backend
 * - each backend fails on its own; an error or missing credential only empties its result list
 * - synthesis runs once over the full merge (or once per backend in PER_BACKEND mode)
 * - every failure ends in a well-formed {@link OrchestrationOutcome}; nothing is thrown to the caller
 *
 * All per-call state lives on the stack, so concurrent calls share nothing.
 */
@Service
@RequiredArgsConstructor
public class RetrievalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private final QueryClassifier classifier;
    private final QueryPlanner planner;
    private final BackendRegistry registry;
    private final ResultMerger merger;
    private final EvidenceSynthesizer synthesizer;
    private final CitationFormatter citationFormatter;
    private final ProvenanceComposer composer;
    private final OrchestratorProperties properties;

    public OrchestrationOutcome orchestrate(OrchestrationRequest request) {
        return orchestrate(request, ProgressListener.noop());
    }

    public OrchestrationOutcome orchestrate(OrchestrationRequest request, ProgressListener listener) {
        Progress progress = new Progress(listener == null ? ProgressListener.noop() : listener);
        OrchestrationOutcome outcome;
        try {
            if (request == null || request.query() == null || request.query().isBlank()) {
                outcome = outcome(Answer.nothingFound(), Diagnostics.none(OrchestrationState.DONE));
            } else {
                outcome = run(request, progress);
            }
        } catch (RuntimeException e) {
            log.error("Orchestration failed unexpectedly for '{}'", request == null ? null : request.query(), e);
            outcome = new OrchestrationOutcome(AnswerMessages.UNEXPECTED_ERROR, Sentinel.NONE, List.of(),
                    Diagnostics.none(OrchestrationState.DEGRADED));
        }
        progress.emit(ProgressStep.DONE, "Finished.", outcome);
        return outcome;
    }

    /**
     * Streaming variant: emits every progress event and completes after the
     * {@code done} event, whose data is the outcome. Cancelling the subscription
     * interrupts the worker, abandoning in-flight backend calls.
     */
    public Flux<ProgressEvent> stream(OrchestrationRequest request) {
        return Flux.create((FluxSink<ProgressEvent> sink) -> {
            Disposable run = Mono.fromCallable(() -> orchestrate(request, sink::next))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(outcome -> sink.complete(), sink::error);
            sink.onDispose(run);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    /**
     * Retrieval without classification or synthesis: search, filter, merge, project.
     */
    public SearchPreview preview(OrchestrationRequest request) {
        String query = request.query().trim();
        AllowedDomainSet allowed = request.resolveAllowedDomains(properties.allowedDomains());
        QueryPlan plan = planner.plan(query, allowed);
        List<BackendHits> hits = searchAll(request, plan, DomainFilter.of(allowed), new Progress(ProgressListener.noop()));
        EvidenceBundle evidence = merger.merge(hits.stream().map(BackendHits::results).toList());
        return new SearchPreview(
                query,
                citationFormatter.project(evidence),
                Diagnostics.of(reports(hits), evidence.size(), OrchestrationState.DONE));
    }

    private OrchestrationOutcome run(OrchestrationRequest request, Progress progress) {
        String query = request.query().trim();
        AllowedDomainSet allowed = request.resolveAllowedDomains(properties.allowedDomains());

        // 1. VALIDATING
        enter(OrchestrationState.VALIDATING, query);
        progress.emit(ProgressStep.VALIDATE_START, "Validating query relevance...", null);
        ClassificationVerdict verdict = classifier.classify(query);
        progress.emit(ProgressStep.VALIDATE_COMPLETE,
                verdict.inDomain() ? "Query accepted." : "Query not related to allowed topics.",
                Map.of("inDomain", verdict.inDomain(), "failedOpen", verdict.failedOpen()));
        if (!verdict.inDomain()) {
            return outcome(Answer.denied(), Diagnostics.none(OrchestrationState.DONE));
        }
        if (abandoned()) {
            return cancelled(List.of(), 0);
        }

        // 2. PER_BACKEND_SEARCH
        enter(OrchestrationState.PER_BACKEND_SEARCH, query);
        QueryPlan plan = planner.plan(query, allowed);
        List<BackendHits> hits = searchAll(request, plan, DomainFilter.of(allowed), progress);

        CompositionMode mode = request.resolveMode(properties.compositionMode());
        return mode == CompositionMode.PER_BACKEND
                ? synthesizePerBackend(request, query, hits, progress)
                : synthesizeMerged(request, query, hits, progress);
    }

    private OrchestrationOutcome synthesizeMerged(OrchestrationRequest request, String query,
                                                  List<BackendHits> hits, Progress progress) {
        List<BackendReport> reports = reports(hits);

        // 3. FILTER_AND_MERGE
        enter(OrchestrationState.FILTER_AND_MERGE, query);
        EvidenceBundle evidence = merger.merge(hits.stream().map(BackendHits::results).toList());
        progress.emit(ProgressStep.FILTER_COMPLETE,
                "Merged results into " + evidence.size() + " documents",
                Map.of("evidenceSize", evidence.size(), "backends", reports));
        if (abandoned()) {
            return cancelled(reports, evidence.size());
        }
        if (evidence.isEmpty()) {
            return outcome(Answer.nothingFound(), Diagnostics.of(reports, 0, OrchestrationState.DONE));
        }

        // 4. SYNTHESIZING
        enter(OrchestrationState.SYNTHESIZING, query);
        progress.emit(ProgressStep.SYNTHESIZE_START, "Analyzing documents and generating answer...",
                Map.of("documents", evidence.size()));
        Answer answer = synthesizer.synthesize(query, evidence, request.hints());

        // 5. DONE
        enter(OrchestrationState.DONE, query);
        return outcome(answer, Diagnostics.of(reports, evidence.size(), OrchestrationState.DONE));
    }

    private OrchestrationOutcome synthesizePerBackend(OrchestrationRequest request, String query,
                                                      List<BackendHits> hits, Progress progress) {
        List<BackendReport> reports = reports(hits);

        enter(OrchestrationState.FILTER_AND_MERGE, query);
        List<BackendId> contributing = new ArrayList<>();
        List<EvidenceBundle> bundles = new ArrayList<>();
        for (BackendHits hit : hits) {
            if (!hit.results().isEmpty()) {
                contributing.add(hit.report().backend());
                bundles.add(merger.merge(List.of(hit.results())));
            }
        }
        int evidenceSize = bundles.stream().mapToInt(EvidenceBundle::size).sum();
        progress.emit(ProgressStep.FILTER_COMPLETE,
                "Prepared " + evidenceSize + " documents from " + bundles.size() + " sources",
                Map.of("evidenceSize", evidenceSize, "backends", reports));
        if (abandoned()) {
            return cancelled(reports, evidenceSize);
        }
        if (bundles.isEmpty()) {
            return outcome(Answer.nothingFound(), Diagnostics.of(reports, 0, OrchestrationState.DONE));
        }

        enter(OrchestrationState.SYNTHESIZING, query);
        List<ProvenanceComposer.Section> sections = new ArrayList<>();
        for (int i = 0; i < bundles.size(); i++) {
            BackendId backend = contributing.get(i);
            progress.emit(ProgressStep.SYNTHESIZE_START,
                    "Generating answer from " + backend.label() + "...",
                    Map.of("backend", backend, "documents", bundles.get(i).size()));
            sections.add(new ProvenanceComposer.Section(
                    backend, synthesizer.synthesize(query, bundles.get(i), request.hints())));
        }

        enter(OrchestrationState.DONE, query);
        return outcome(composer.compose(sections, reports), Diagnostics.of(reports, evidenceSize, OrchestrationState.DONE));
    }

    private List<BackendHits> searchAll(OrchestrationRequest request, QueryPlan plan, DomainFilter filter, Progress progress) {
        Set<BackendId> enabled = request.resolveEnabledBackends(properties.enabledBackends());
        SearchDepth depth = request.resolveDepth(properties.searchDepth());
        List<BackendId> order = Arrays.stream(BackendId.values())
                .filter(enabled::contains)
                .toList();

        if (!properties.parallelBackends() || order.size() < 2) {
            return order.stream()
                    .map(id -> searchBackend(id, plan, filter, request.resolveLimit(id, properties.defaultLimit()), depth, progress))
                    .toList();
        }

        // searchBackend never throws, so one backend cannot fail its siblings
        List<BackendHits> hits;
        try {
            hits = Flux.fromIterable(order)
                    .flatMapSequential(id -> Mono.fromCallable(() -> searchBackend(
                                    id, plan, filter, request.resolveLimit(id, properties.defaultLimit()), depth, progress))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .collectList()
                    .block();
        } catch (RuntimeException e) {
            if (!(Exceptions.unwrap(e) instanceof InterruptedException)) {
                throw e;
            }
            Thread.currentThread().interrupt();
            log.debug("Parallel search abandoned by caller");
            return order.stream()
                    .map(id -> new BackendHits(BackendReport.error(id, "search abandoned"), List.<SearchResult>of()))
                    .toList();
        }
        return hits == null ? List.of() : hits;
    }

    private BackendHits searchBackend(BackendId id, QueryPlan plan, DomainFilter filter,
                                      int limit, SearchDepth depth, Progress progress) {
        progress.emit(ProgressStep.SEARCH_START, "Searching " + id.label() + "...", Map.of("backend", id));

        Optional<SearchBackend> found = registry.find(id);
        if (found.isEmpty() || !found.get().isConfigured()) {
            log.debug("Backend {} skipped: not configured", id);
            progress.emit(ProgressStep.SEARCH_SKIP, "Search of " + id.label() + " unavailable (not configured)",
                    Map.of("backend", id));
            return new BackendHits(BackendReport.skipped(id, "not configured"), List.of());
        }

        SearchBackend backend = found.get();
        try {
            BackendHits hits = backend.domainScoped()
                    ? searchScoped(backend, plan, filter, limit, depth)
                    : searchUnscoped(backend, plan, limit, depth);
            BackendReport report = hits.report();
            progress.emit(ProgressStep.SEARCH_COMPLETE,
                    "Found " + report.survivingCount() + " results in " + id.label(),
                    Map.of("backend", id,
                            "status", report.status(),
                            "rawCount", report.rawCount(),
                            "survivingCount", report.survivingCount(),
                            "filteredOut", report.filteredOut()));
            return hits;
        } catch (RuntimeException e) {
            log.warn("Backend {} failed, continuing without it: {}", id, e.getMessage());
            progress.emit(ProgressStep.SEARCH_ERROR, "Search of " + id.label() + " encountered an error, continuing...",
                    Map.of("backend", id));
            return new BackendHits(BackendReport.error(id, String.valueOf(e.getMessage())), List.of());
        }
    }

    /**
     * Site-restricted results are kept as-is; unrestricted results must pass the domain filter.
     */
    private BackendHits searchScoped(SearchBackend backend, QueryPlan plan, DomainFilter filter,
                                     int limit, SearchDepth depth) {
        List<SearchResult> restricted = call(backend, plan.restricted(), limit, depth);
        List<SearchResult> general = call(backend, plan.unrestricted(), limit, depth);
        List<SearchResult> allowedGeneral = filter.filter(general);

        List<SearchResult> surviving = new ArrayList<>(restricted);
        surviving.addAll(allowedGeneral);
        log.debug("[{}] restricted={} general={} allowedGeneral={}",
                backend.id(), restricted.size(), general.size(), allowedGeneral.size());

        BackendReport report = new BackendReport(
                backend.id(),
                surviving.isEmpty() ? BackendStatus.EMPTY : BackendStatus.OK,
                restricted.size() + general.size(),
                surviving.size(),
                restricted.size(),
                general.size() - allowedGeneral.size(),
                null);
        return new BackendHits(report, List.copyOf(surviving));
    }

    private BackendHits searchUnscoped(SearchBackend backend, QueryPlan plan, int limit, SearchDepth depth) {
        List<SearchResult> results = call(backend, plan.unrestricted(), limit, depth);
        BackendReport report = new BackendReport(
                backend.id(),
                results.isEmpty() ? BackendStatus.EMPTY : BackendStatus.OK,
                results.size(),
                results.size(),
                0,
                0,
                null);
        return new BackendHits(report, List.copyOf(results));
    }

    /**
     * One bounded backend call. Timeouts and unexpected adapter errors surface as {@link BackendException}.
     */
    private List<SearchResult> call(SearchBackend backend, String expression, int limit, SearchDepth depth) {
        try {
            List<SearchResult> results = Mono.fromCallable(() -> backend.search(expression, limit, depth))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(properties.backendTimeout())
                    .block();
            return results == null ? List.of() : results;
        } catch (BackendException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new BackendException(backend.id(), "search abandoned", cause);
            }
            if (cause instanceof TimeoutException) {
                throw new BackendException(backend.id(),
                        "timed out after " + properties.backendTimeout().toMillis() + " ms", cause);
            }
            throw new BackendException(backend.id(), String.valueOf(cause.getMessage()), cause);
        }
    }

    private OrchestrationOutcome outcome(Answer answer, Diagnostics diagnostics) {
        return new OrchestrationOutcome(answer.text(), answer.sentinel(), answer.citations(), diagnostics);
    }

    private OrchestrationOutcome cancelled(List<BackendReport> reports, int evidenceSize) {
        log.info("Caller abandoned the request; skipping synthesis");
        return new OrchestrationOutcome(AnswerMessages.CANCELLED, Sentinel.NONE, List.of(),
                Diagnostics.of(reports, evidenceSize, OrchestrationState.DEGRADED));
    }

    private static boolean abandoned() {
        return Thread.currentThread().isInterrupted();
    }

    private static List<BackendReport> reports(List<BackendHits> hits) {
        return hits.stream().map(BackendHits::report).toList();
    }

    private static void enter(OrchestrationState state, String query) {
        log.debug("[orchestrator] -> {} for '{}'", state, query);
    }

    private record BackendHits(BackendReport report, List<SearchResult> results) {
    }

    /**
     * Serializes listener calls (parallel backends emit from several threads)
     * and keeps a failing listener from affecting the orchestration.
     */
    private static final class Progress {

        private final ProgressListener listener;

        private Progress(ProgressListener listener) {
            this.listener = listener;
        }

        synchronized void emit(ProgressStep step, String message, Object data) {
            try {
                listener.onProgress(new ProgressEvent(step, message, data));
            } catch (RuntimeException e) {
                log.debug("Progress listener failed on {}: {}", step.wireName(), e.toString());
            }
        }
    }
}
