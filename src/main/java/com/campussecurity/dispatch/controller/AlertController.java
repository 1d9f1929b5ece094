package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.AlertResult;
import com.campussecurity.dispatch.dto.GuardResponseRequest;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.service.DispatchOrchestrator;
import com.campussecurity.dispatch.service.IncidentQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Guard responses to alerts.
 *
 * A lost race or a response to an alert that is no longer pending is not an error: the
 * response is 200 with the outcome (ALREADY_ASSIGNED, GUARD_UNAVAILABLE, INCIDENT_CLOSED,
 * STALE_OR_TERMINAL) so the app can tell the guard they were too late.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Alerts", description = "Guard alert inbox and responses")
public class AlertController {

    private final DispatchOrchestrator orchestrator;
    private final IncidentQueryService incidentQueryService;

    @Operation(summary = "Accept an alert", description = "First accept wins the incident.")
    @PostMapping("/{alertId}/accept")
    public ResponseEntity<AlertResult> accept(@PathVariable Long alertId,
                                              @Valid @RequestBody GuardResponseRequest request) {
        AlertResult result = orchestrator.acceptAlert(alertId, request.guardId());
        log.info("Accept of alert {} by guard {}: {}", alertId, request.guardId(), result.outcome());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Decline an alert", description = "Escalates to the next nearest guard not yet alerted.")
    @PostMapping("/{alertId}/decline")
    public ResponseEntity<AlertResult> decline(@PathVariable Long alertId,
                                               @Valid @RequestBody GuardResponseRequest request) {
        AlertResult result = orchestrator.declineAlert(alertId, request.guardId());
        log.info("Decline of alert {} by guard {}: {}", alertId, request.guardId(), result.outcome());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List a guard's alerts", description = "Newest first; filter by status for the pending inbox.")
    @GetMapping
    public ResponseEntity<List<GuardAlert>> list(
            @Parameter(description = "Guard profile id", example = "7") @RequestParam Long guardId,
            @Parameter(description = "Optional status filter", example = "SENT")
            @RequestParam(required = false) AlertStatus status) {
        return ResponseEntity.ok(incidentQueryService.listGuardAlerts(guardId, status));
    }
}
