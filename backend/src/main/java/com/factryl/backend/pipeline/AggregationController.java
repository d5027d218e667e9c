package com.factryl.backend.pipeline;

import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.dto.AggregationRequestDTO;
import com.factryl.backend.model.dto.AggregationResultDTO;
import com.factryl.backend.model.dto.RawItemDTO;
import com.factryl.backend.model.dto.SourceStatisticsDTO;
import com.factryl.backend.registry.SourceCredibility;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/aggregation")
@RequiredArgsConstructor
@Slf4j
@Validated
public class AggregationController {

    private final AggregationPipelineService pipelineService;

    /**
     * Combine, deduplicate and score collector output grouped by source
     */
    @PostMapping("/run")
    public ResponseEntity<?> run(@Valid @RequestBody @NotNull AggregationRequestDTO request) {
        try {
            if (request.getSources() == null || request.getSources().isEmpty()) {
                return ResponseEntity.badRequest()
                        .body(Map.of("error", "No sources provided"));
            }

            AggregationResultDTO result = pipelineService.run(request);
            return ResponseEntity.ok(result);

        } catch (Exception e) {
            log.error("Aggregation run failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Aggregation run failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Filter, deduplicate and cap a flat list of items
     */
    @PostMapping("/aggregate")
    public ResponseEntity<?> aggregate(@RequestBody @NotNull List<RawItemDTO> items) {
        try {
            List<RawItemDTO> aggregated = pipelineService.aggregate(items);
            return ResponseEntity.ok(Map.of(
                    "items", aggregated,
                    "total", aggregated.size(),
                    "dropped", items.size() - aggregated.size()
            ));
        } catch (Exception e) {
            log.error("Aggregation failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Aggregation failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }

    /**
     * Per source type counts for a list of standardized items
     */
    @PostMapping("/statistics")
    public ResponseEntity<SourceStatisticsDTO> statistics(@RequestBody List<ContentItem> items) {
        return ResponseEntity.ok(pipelineService.statistics(items));
    }

    /**
     * Score explanations, one per item in request order
     */
    @PostMapping("/explain")
    public ResponseEntity<List<String>> explain(@RequestBody List<ContentItem> items) {
        return ResponseEntity.ok(pipelineService.explain(items));
    }

    @GetMapping("/sources")
    public ResponseEntity<Map<String, SourceCredibility>> sources() {
        return ResponseEntity.ok(pipelineService.sources());
    }
}
