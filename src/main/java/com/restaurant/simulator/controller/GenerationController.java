package com.restaurant.simulator.controller;

import com.restaurant.simulator.exception.InvalidGenerationConfigException;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GenerationSummary;
import com.restaurant.simulator.service.BatchGenerationService;
import com.restaurant.simulator.service.GenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/generation")
@Tag(name = "Generation", description = "Generate deterministic synthetic restaurant data and store it in Aerospike")
public class GenerationController {

    private final GenerationService generationService;
    private final BatchGenerationService batchGenerationService;

    public GenerationController(GenerationService generationService,
                                BatchGenerationService batchGenerationService) {
        this.generationService = generationService;
        this.batchGenerationService = batchGenerationService;
    }

    @Operation(summary = "Preview generated rows without storing them",
            description = "Returns all four row families for the requested location and horizon. " +
                    "The same request always returns the same rows.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = GeneratedDataset.class)))
    @ApiResponse(responseCode = "400", description = "Invalid request or configuration")
    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestBody GenerationRequest request) {
        try {
            GeneratedDataset dataset = generationService.preview(request);
            return ResponseEntity.ok(dataset);
        } catch (InvalidGenerationConfigException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Generate and store rows for one location",
            description = "Generates the horizon ending on the reference date (default: today) and writes every row. " +
                    "Re-running the same request overwrites the same records.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = GenerationSummary.class)))
    @ApiResponse(responseCode = "400", description = "Invalid request or configuration")
    @PostMapping("/runs")
    public ResponseEntity<?> generateAndStore(@RequestBody GenerationRequest request) {
        try {
            GenerationSummary summary = generationService.generateAndStore(request);
            return ResponseEntity.ok(summary);
        } catch (InvalidGenerationConfigException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Generate and store rows for many locations in parallel",
            description = "One summary per request, in request order. Failed locations are reported with status FAILED.")
    @ApiResponse(responseCode = "200",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = GenerationSummary.class))))
    @PostMapping("/runs/batch")
    public ResponseEntity<?> generateBatch(@RequestBody List<GenerationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return badRequest("requests must be a non-empty list", "requests");
        }
        List<GenerationSummary> summaries = batchGenerationService.generateAll(requests);
        return ResponseEntity.ok(summaries);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
