package io.infopulse.ingestion.api;

import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.CycleSummary;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.service.IngestionEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Query surface for chat front ends and operators.
 */
@RestController
@RequestMapping("/api/v1/intel")
public class IntelligenceController {

    private static final int DEFAULT_LIMIT = 10;

    private final IngestionEngine engine;

    public IntelligenceController(IngestionEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/latest")
    public List<IntelligenceItem> latest(@RequestParam(required = false) String category,
                                         @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {
        return engine.latest(parseCategory(category), limit);
    }

    @GetMapping("/count")
    public Map<String, Object> count(@RequestParam(required = false) String category) {
        Category parsed = parseCategory(category);
        return Map.of(
                "category", parsed != null ? parsed.name() : "ALL",
                "count", engine.count(parsed)
        );
    }

    @GetMapping("/{id}")
    public ResponseEntity<IntelligenceItem> byId(@PathVariable String id) {
        return engine.byId(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/refresh")
    public CompletableFuture<ResponseEntity<CycleSummary>> refresh() {
        return engine.refreshNow()
                .thenApply(summary -> ResponseEntity.status(HttpStatus.ACCEPTED).body(summary));
    }

    private static Category parseCategory(String category) {
        return category == null || category.isBlank() ? null : Category.from(category);
    }
}
