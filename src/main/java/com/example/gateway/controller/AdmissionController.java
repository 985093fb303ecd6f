package com.example.gateway.controller;

import com.example.gateway.model.AdmissionDecision;
import com.example.gateway.model.AdmissionRequest;
import com.example.gateway.model.OutcomeReport;
import com.example.gateway.service.GatewayOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admission API consumed by business endpoint handlers running outside this process.
 * <p>
 * A decision is always answered with 200; whether the request may proceed is in the body.
 */
@RestController
@RequestMapping("/api/admission")
public class AdmissionController {

    private final GatewayOrchestrator orchestrator;

    public AdmissionController(GatewayOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<AdmissionDecision> admit(@Valid @RequestBody AdmissionRequest request) {
        return ResponseEntity.ok(orchestrator.admit(request));
    }

    @PostMapping("/outcomes")
    public ResponseEntity<Void> reportOutcome(@Valid @RequestBody OutcomeReport report) {
        orchestrator.complete(report);
        return ResponseEntity.accepted().build();
    }
}
