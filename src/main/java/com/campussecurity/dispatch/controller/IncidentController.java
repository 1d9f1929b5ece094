package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.AdminActionRequest;
import com.campussecurity.dispatch.dto.AssignGuardRequest;
import com.campussecurity.dispatch.dto.GuardResponseRequest;
import com.campussecurity.dispatch.dto.IncidentDetail;
import com.campussecurity.dispatch.dto.ResolveIncidentRequest;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardAssignment;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.service.AlertLifecycleManager;
import com.campussecurity.dispatch.service.IncidentQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
@Tag(name = "Incidents", description = "Incident lifecycle and manual dispatch")
public class IncidentController {

    private final AlertLifecycleManager alertLifecycleManager;
    private final IncidentQueryService incidentQueryService;

    @Operation(summary = "List open incidents")
    @GetMapping
    public ResponseEntity<List<Incident>> listOpen() {
        return ResponseEntity.ok(incidentQueryService.listOpenIncidents());
    }

    @Operation(summary = "Incident detail", description = "Incident with its signals, alerts, assignments and audit trail.")
    @GetMapping("/{incidentId}")
    public ResponseEntity<IncidentDetail> get(@PathVariable Long incidentId) {
        return ResponseEntity.ok(incidentQueryService.getIncidentDetail(incidentId));
    }

    @Operation(summary = "Start response", description = "ASSIGNED -> IN_PROGRESS, by the assigned guard.")
    @PostMapping("/{incidentId}/start")
    public ResponseEntity<Incident> start(@PathVariable Long incidentId,
                                          @Valid @RequestBody GuardResponseRequest request) {
        return ResponseEntity.ok(alertLifecycleManager.startResponse(incidentId, request.guardId()));
    }

    @Operation(summary = "Resolve incident", description = "Closes the incident and frees its beacon. Notes are required.")
    @PostMapping("/{incidentId}/resolve")
    public ResponseEntity<Incident> resolve(@PathVariable Long incidentId,
                                            @Valid @RequestBody ResolveIncidentRequest request) {
        SignalActor actor = new SignalActor(request.actorRole(), request.actorId());
        return ResponseEntity.ok(alertLifecycleManager.resolveIncident(
            incidentId, actor, request.notes(), request.resolutionType()));
    }

    @Operation(summary = "Assign a guard", description = "Admin override; revokes any current assignment.")
    @PostMapping("/{incidentId}/assign")
    public ResponseEntity<GuardAssignment> assign(@PathVariable Long incidentId,
                                                  @Valid @RequestBody AssignGuardRequest request) {
        return ResponseEntity.ok(alertLifecycleManager.assignGuard(
            incidentId, request.guardId(), SignalActor.admin(request.adminId())));
    }

    @Operation(summary = "Unassign", description = "Revokes the active assignment; the incident returns to CREATED.")
    @PostMapping("/{incidentId}/unassign")
    public ResponseEntity<Incident> unassign(@PathVariable Long incidentId,
                                             @Valid @RequestBody AdminActionRequest request) {
        return ResponseEntity.ok(alertLifecycleManager.unassignGuard(incidentId, SignalActor.admin(request.adminId())));
    }

    @Operation(summary = "Redispatch", description = "Alerts a fresh wave of guards not alerted before.")
    @PostMapping("/{incidentId}/redispatch")
    public ResponseEntity<Map<String, Object>> redispatch(@PathVariable Long incidentId,
                                                          @Valid @RequestBody AdminActionRequest request) {
        List<GuardAlert> alerts = alertLifecycleManager.redispatch(incidentId, SignalActor.admin(request.adminId()));
        return ResponseEntity.ok(Map.of(
            "incidentId", incidentId,
            "alertsSent", alerts.size(),
            "alerts", alerts
        ));
    }
}
