package com.example.gateway.controller;

import com.example.gateway.model.EmergencyOverride;
import com.example.gateway.model.OverrideRequest;
import com.example.gateway.service.EmergencyOverrideRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator endpoints for emergency overrides. There is no update: an override is extended by
 * issuing a new one.
 */
@RestController
@RequestMapping("/api/admin/overrides")
public class OverrideAdminController {

    private final EmergencyOverrideRegistry registry;

    public OverrideAdminController(EmergencyOverrideRegistry registry) {
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<EmergencyOverride> create(@Valid @RequestBody OverrideRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.create(request));
    }

    @PostMapping("/{id}/expire")
    public ResponseEntity<EmergencyOverride> expire(
            @PathVariable("id") String id,
            @RequestHeader(value = "X-Operator", defaultValue = "unknown") String operator
    ) {
        return registry.expire(id, operator)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<EmergencyOverride> active() {
        return registry.active();
    }
}
