package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.AiDetectionRequest;
import com.campussecurity.dispatch.dto.DispatchResult;
import com.campussecurity.dispatch.dto.PanicSignalRequest;
import com.campussecurity.dispatch.dto.SosSignalRequest;
import com.campussecurity.dispatch.service.DispatchOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound signal channels. All three feed the same dedup and dispatch path, so concurrent
 * signals from different channels at one beacon land on one incident.
 *
 * Responses:
 * - 201 when the signal opened a new incident
 * - 200 when it merged into the beacon's open incident, or an AI detection was suppressed
 */
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Signals", description = "SOS, panic button and AI detection intake")
public class SignalController {

    private final DispatchOrchestrator orchestrator;

    @Operation(
            summary = "Raise a student SOS",
            description = "Reports an emergency at a beacon. Opens an incident and alerts the nearest guards, " +
                    "or merges into the incident already open at that beacon."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "New incident opened"),
            @ApiResponse(responseCode = "200", description = "Merged into the open incident"),
            @ApiResponse(responseCode = "404", description = "Unknown or inactive beacon")
    })
    @PostMapping("/sos")
    public ResponseEntity<DispatchResult> sos(@Valid @RequestBody SosSignalRequest request) {
        log.info("SOS received at beacon {} from {}:{}", request.beaconId(), request.reporterRole(), request.reporterId());
        return respond(orchestrator.handleSignal(request.toCommand()));
    }

    @Operation(summary = "Panic button press", description = "Raised by an ESP32 panic button at its fixed beacon.")
    @PostMapping("/panic")
    public ResponseEntity<DispatchResult> panic(@Valid @RequestBody PanicSignalRequest request) {
        log.info("Panic button pressed: device {}", request.deviceId());
        return respond(orchestrator.handlePanicButton(request.deviceId(), request.details()));
    }

    @Operation(
            summary = "AI vision/audio detection",
            description = "Detections below the device type's confidence threshold are suppressed and open nothing."
    )
    @PostMapping("/ai-detection")
    public ResponseEntity<DispatchResult> aiDetection(@Valid @RequestBody AiDetectionRequest request) {
        log.info("AI detection from device {} (confidence {})", request.deviceId(), request.confidence());
        return respond(orchestrator.handleAiDetection(request.deviceId(), request.confidence(), request.details()));
    }

    private ResponseEntity<DispatchResult> respond(DispatchResult result) {
        HttpStatus status = result.wasCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
