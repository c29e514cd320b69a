package com.polkadot.analytics.controller;

import com.polkadot.analytics.repository.MetricDataSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/catalog")
@Tag(name = "Catalog", description = "Parachains and metrics present in the metric store")
public class CatalogController {

    private final MetricDataSource dataSource;

    public CatalogController(MetricDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping("/metrics")
    @Operation(summary = "List available metrics")
    public ResponseEntity<List<String>> metrics() {
        return ResponseEntity.ok(dataSource.findAvailableMetrics());
    }

    @GetMapping("/parachains")
    @Operation(summary = "List known parachains")
    public ResponseEntity<List<String>> parachains() {
        return ResponseEntity.ok(dataSource.findAllEntityIds());
    }
}
