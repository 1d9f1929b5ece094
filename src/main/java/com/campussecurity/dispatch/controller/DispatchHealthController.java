package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.BeaconGraphSnapshot;
import com.campussecurity.dispatch.service.BeaconGraphService;
import com.campussecurity.dispatch.service.IncidentQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/dispatch")
@RequiredArgsConstructor
@Tag(name = "Dispatch", description = "Engine status")
public class DispatchHealthController {

    private final BeaconGraphService beaconGraphService;
    private final IncidentQueryService incidentQueryService;
    private final Clock clock;

    @Operation(summary = "Health check", description = "Engine status with graph size and open incident count.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        BeaconGraphSnapshot graph = beaconGraphService.snapshot();
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Campus Dispatch Engine",
            "graphEdges", graph.edgeCount(),
            "openIncidents", incidentQueryService.listOpenIncidents().size(),
            "timestamp", clock.instant().toString()
        ));
    }
}
