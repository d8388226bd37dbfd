package com.netcourier.rag.service.query;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.model.QueryRequest;
import com.netcourier.rag.model.QueryResponse;
import com.netcourier.rag.model.SourceReference;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import com.netcourier.rag.service.cache.CacheEntry;
import com.netcourier.rag.service.cache.CacheKeys;
import com.netcourier.rag.service.cache.CacheStore;
import com.netcourier.rag.service.embedding.EmbeddingBatcher;
import com.netcourier.rag.service.embedding.EmbeddingVector;
import com.netcourier.rag.service.generation.ContextBudgetGuard;
import com.netcourier.rag.service.generation.ContextPassage;
import com.netcourier.rag.service.generation.GenerationClient;
import com.netcourier.rag.service.generation.GenerationFailureException;
import com.netcourier.rag.service.generation.GenerationRequest;
import com.netcourier.rag.service.generation.GenerationResponse;
import com.netcourier.rag.service.vectorstore.VectorMatch;
import com.netcourier.rag.service.vectorstore.VectorStoreAdapter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Service
public class DefaultQueryOrchestrator implements QueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultQueryOrchestrator.class);

    static final String DEGRADED_ANSWER = "An answer could not be generated right now. "
            + "The most relevant passages are listed in the sources.";

    private final EmbeddingBatcher embeddingBatcher;
    private final VectorStoreAdapter vectorStore;
    private final CacheStore cacheStore;
    private final GenerationClient generationClient;
    private final RagProperties properties;
    private final ContextBudgetGuard budgetGuard;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Counter generationFailures;

    public DefaultQueryOrchestrator(EmbeddingBatcher embeddingBatcher,
                                    VectorStoreAdapter vectorStore,
                                    CacheStore cacheStore,
                                    GenerationClient generationClient,
                                    RagProperties properties,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.embeddingBatcher = embeddingBatcher;
        this.vectorStore = vectorStore;
        this.cacheStore = cacheStore;
        this.generationClient = generationClient;
        this.properties = properties;
        this.budgetGuard = new ContextBudgetGuard(properties.generation().contextTokenBudget());
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.generationFailures = meterRegistry.counter("rag.generation.failures");
    }

    @Override
    public QueryResponse answer(QueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant deadline = clock.instant().plus(properties.query().timeout());

        String query = QueryNormaliser.normalise(request.query());
        int topK = resolveTopK(request.topK());
        validate(query);
        Map<String, String> filters = request.filters();
        String normalized = QueryNormaliser.cacheForm(query);
        String cacheKey = CacheKeys.key(normalized, topK, properties.modelVersion(), filters);

        Optional<CacheEntry> cached = lookup(cacheKey);
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            log.debug("Cache hit for query key {}", cacheKey);
            sample.stop(meterRegistry.timer("rag.query.duration", "cache_hit", "true"));
            return new QueryResponse(entry.answer(), entry.sources(), true, entry.unsupportedByContext(), false);
        }

        EmbeddingVector queryVector = timed("embedding",
                () -> embeddingBatcher.embedQuery("query-" + cacheKey.substring(0, 16), query));
        checkDeadline(deadline, "embedding");

        List<VectorMatch> matches = timed("retrieval", () -> vectorStore.search(queryVector.vector(), topK, filters));
        checkDeadline(deadline, "retrieval");

        boolean unsupported = matches.isEmpty();
        List<ContextPassage> passages = matches.stream()
                .map(match -> new ContextPassage(match.chunkId(), match.documentId(), match.text(), match.score()))
                .toList();
        ContextBudgetGuard.GuardedContext context = budgetGuard.enforce(passages);
        if (context.truncated()) {
            log.debug("Context truncated to {} of {} passages", context.passages().size(), passages.size());
        }
        // only passages the model actually saw are cited
        List<SourceReference> sources = context.passages().stream()
                .map(passage -> new SourceReference(passage.chunkId(), passage.documentId(), passage.score()))
                .toList();

        GenerationResponse generated;
        try {
            generated = generateWithRetry(new GenerationRequest(query, context.passages()), deadline);
        } catch (GenerationFailureException ex) {
            generationFailures.increment();
            log.warn("Generation failed, returning degraded answer with {} source(s): {}", sources.size(), ex.getMessage());
            sample.stop(meterRegistry.timer("rag.query.duration", "cache_hit", "false"));
            return new QueryResponse(DEGRADED_ANSWER, sources, false, unsupported, true);
        }
        checkDeadline(deadline, "generation");

        if (properties.cache().enabled()) {
            store(new CacheEntry(cacheKey, normalized, topK, generated.answer(), sources, unsupported, null, null));
        }
        sample.stop(meterRegistry.timer("rag.query.duration", "cache_hit", "false"));
        return new QueryResponse(generated.answer(), sources, false, unsupported, false);
    }

    private GenerationResponse generateWithRetry(GenerationRequest request, Instant deadline) {
        int attempts = properties.generation().maxAttempts();
        GenerationFailureException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return timed("generation", () -> generationClient.generate(request));
            } catch (GenerationFailureException ex) {
                last = ex;
                checkDeadline(deadline, "generation");
                if (!ex.retryable()) {
                    log.warn("Generation rejected, not retrying: {}", ex.getMessage());
                    break;
                }
                if (attempt < attempts) {
                    log.warn("Generation attempt {} failed, retrying: {}", attempt, ex.getMessage());
                }
            }
        }
        throw last;
    }

    private Optional<CacheEntry> lookup(String cacheKey) {
        if (!properties.cache().enabled()) {
            return Optional.empty();
        }
        Optional<CacheEntry> entry;
        try {
            entry = cacheStore.get(cacheKey);
        } catch (RuntimeException ex) {
            log.warn("Cache lookup failed, continuing without cache: {}", ex.getMessage());
            entry = Optional.empty();
        }
        meterRegistry.counter("rag.cache.lookups", "result", entry.isPresent() ? "hit" : "miss").increment();
        return entry;
    }

    private void store(CacheEntry entry) {
        try {
            cacheStore.put(entry, properties.cache().ttl());
        } catch (RuntimeException ex) {
            log.warn("Unable to cache answer: {}", ex.getMessage());
        }
    }

    private int resolveTopK(Integer requested) {
        if (requested == null) {
            return properties.query().defaultTopK();
        }
        if (requested < 1 || requested > properties.query().maxTopK()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.QUERY,
                    "top_k must be between 1 and " + properties.query().maxTopK());
        }
        return requested;
    }

    private void validate(String query) {
        if (query.isEmpty()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.QUERY, "Query must not be empty");
        }
        if (query.length() > properties.query().maxQueryLength()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.QUERY,
                    "Query exceeds " + properties.query().maxQueryLength() + " characters");
        }
    }

    private void checkDeadline(Instant deadline, String stage) {
        if (clock.instant().isAfter(deadline)) {
            log.warn("Query exceeded its {} deadline after {}", properties.query().timeout(), stage);
            throw new QueryTimeoutException("Query timed out after " + stage);
        }
    }

    private <T> T timed(String stage, Supplier<T> call) {
        return meterRegistry.timer("rag.query.stage", "stage", stage).record(call);
    }
}
