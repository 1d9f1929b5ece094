package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.PriorityChangeRequest;
import com.campussecurity.dispatch.dto.ProximityMoveRequest;
import com.campussecurity.dispatch.dto.ProximityRequest;
import com.campussecurity.dispatch.entity.BeaconProximity;
import com.campussecurity.dispatch.service.ProximityGraphService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin editing of a beacon's ordered neighbour list.
 */
@RestController
@RequestMapping("/api/beacons/{beaconId}/proximities")
@RequiredArgsConstructor
@Tag(name = "Beacon graph", description = "Beacon proximity ordering used by the guard search")
public class BeaconGraphController {

    private final ProximityGraphService proximityGraphService;

    @GetMapping
    public ResponseEntity<List<BeaconProximity>> list(@PathVariable Long beaconId) {
        return ResponseEntity.ok(proximityGraphService.listProximities(beaconId));
    }

    @Operation(summary = "Add neighbour", description = "Inserts at the given priority and shifts later siblings down.")
    @PostMapping
    public ResponseEntity<BeaconProximity> add(@PathVariable Long beaconId,
                                               @Valid @RequestBody ProximityRequest request) {
        BeaconProximity created = proximityGraphService.addProximity(beaconId, request.toBeaconId(), request.priority());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{proximityId}")
    public ResponseEntity<BeaconProximity> changePriority(@PathVariable Long beaconId,
                                                          @PathVariable Long proximityId,
                                                          @Valid @RequestBody PriorityChangeRequest request) {
        return ResponseEntity.ok(proximityGraphService.changePriority(beaconId, proximityId, request.priority()));
    }

    @PostMapping("/{proximityId}/move")
    public ResponseEntity<BeaconProximity> move(@PathVariable Long beaconId,
                                                @PathVariable Long proximityId,
                                                @Valid @RequestBody ProximityMoveRequest request) {
        return ResponseEntity.ok(proximityGraphService.moveProximity(beaconId, proximityId, request.direction()));
    }

    @DeleteMapping("/{proximityId}")
    public ResponseEntity<Void> remove(@PathVariable Long beaconId, @PathVariable Long proximityId) {
        proximityGraphService.removeProximity(beaconId, proximityId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Reindex", description = "Renumbers the beacon's neighbours 1..n in their current order.")
    @PostMapping("/reindex")
    public ResponseEntity<List<BeaconProximity>> reindex(@PathVariable Long beaconId) {
        return ResponseEntity.ok(proximityGraphService.reindex(beaconId));
    }
}
