package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.AvailabilityRequest;
import com.campussecurity.dispatch.dto.LocationUpdateRequest;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.service.GuardService;
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

@RestController
@RequestMapping("/api/guards")
@RequiredArgsConstructor
@Tag(name = "Guards", description = "Guard location and availability")
public class GuardController {

    private final GuardService guardService;

    @GetMapping("/{guardId}")
    public ResponseEntity<GuardProfile> get(@PathVariable Long guardId) {
        return ResponseEntity.ok(guardService.getGuard(guardId));
    }

    @Operation(summary = "Report nearest beacon", description = "REST fallback of the STOMP /app/guard/location ping.")
    @PostMapping("/{guardId}/location")
    public ResponseEntity<GuardProfile> updateLocation(@PathVariable Long guardId,
                                                       @Valid @RequestBody LocationUpdateRequest request) {
        return ResponseEntity.ok(guardService.updateLocation(guardId, request.beaconId()));
    }

    @Operation(summary = "Toggle availability / duty", description = "Omitted flags are left unchanged.")
    @PostMapping("/{guardId}/availability")
    public ResponseEntity<GuardProfile> updateAvailability(@PathVariable Long guardId,
                                                           @RequestBody AvailabilityRequest request) {
        GuardProfile guard = guardService.getGuard(guardId);
        if (request.available() != null) {
            guard = guardService.setAvailability(guardId, request.available());
        }
        if (request.onDuty() != null) {
            guard = guardService.setOnDuty(guardId, request.onDuty());
        }
        return ResponseEntity.ok(guard);
    }
}
