package io.infopulse.ingestion.api;

import io.infopulse.ingestion.api.dto.EngineStatus;
import io.infopulse.ingestion.api.dto.SourcesInfo;
import io.infopulse.ingestion.api.service.IngestionEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/engine")
public class EngineController {

    private final IngestionEngine engine;

    public EngineController(IngestionEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/status")
    public EngineStatus status() {
        return engine.status();
    }

    @GetMapping("/sources")
    public SourcesInfo sources() {
        return engine.sourcesInfo();
    }

    @PostMapping("/start")
    public ResponseEntity<EngineStatus> start() {
        engine.start();
        return ResponseEntity.ok(engine.status());
    }

    @PostMapping("/stop")
    public ResponseEntity<EngineStatus> stop() {
        engine.stop();
        return ResponseEntity.ok(engine.status());
    }
}
