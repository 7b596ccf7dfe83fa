package com.restaurant.simulator.service;

import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GenerationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one generate-and-store per location on the generation worker pool.
 * A failing location is reported in its summary and does not stop the others.
 */
@Service
public class BatchGenerationService {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerationService.class);

    private final GenerationService generationService;
    private final ExecutorService executor;

    public BatchGenerationService(GenerationService generationService,
                                  @Qualifier("generationExecutor") ExecutorService executor) {
        this.generationService = generationService;
        this.executor = executor;
    }

    /**
     * @return one summary per request, in request order
     */
    public List<GenerationSummary> generateAll(List<GenerationRequest> requests) {
        log.info("Starting batch generation for {} locations", requests.size());

        List<CompletableFuture<GenerationSummary>> futures = new ArrayList<>(requests.size());
        for (GenerationRequest request : requests) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> generationService.generateAndStore(request), executor)
                    .exceptionally(e -> failed(request, e)));
        }

        List<GenerationSummary> summaries = new ArrayList<>(futures.size());
        for (CompletableFuture<GenerationSummary> future : futures) {
            summaries.add(future.join());
        }

        long failures = summaries.stream()
                .filter(s -> GenerationService.STATUS_FAILED.equals(s.getStatus()))
                .count();
        log.info("Batch generation complete: {} succeeded, {} failed", summaries.size() - failures, failures);
        return summaries;
    }

    private GenerationSummary failed(GenerationRequest request, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        log.warn("Generation failed for {}: {}", request.getLocationId(), cause.getMessage());
        return GenerationSummary.builder()
                .locationId(request.getLocationId())
                .status(GenerationService.STATUS_FAILED)
                .error(cause.getMessage())
                .horizonDays(request.getHorizonDays())
                .build();
    }
}
