package com.example.gateway.controller;

import com.example.gateway.exception.OverrideRejectedException;
import com.example.gateway.model.EmergencyOverride;
import com.example.gateway.model.OverrideEffect;
import com.example.gateway.model.OverrideRequest;
import com.example.gateway.model.OverrideScope;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.service.EmergencyOverrideRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OverrideAdminControllerTest {

    private static final EmergencyOverride FLOOR = new EmergencyOverride(
            "ovr-1", OverrideScope.EVENT, "wedding-2026-0613-barn", OverrideEffect.PRIORITY_FLOOR, null,
            PriorityClass.CRITICAL, Instant.parse("2026-06-13T09:00:00Z"), Instant.parse("2026-06-13T21:00:00Z"),
            "ops-oncall", "venue wifi outage");

    @Mock
    private EmergencyOverrideRegistry registry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OverrideAdminController(registry))
                .setControllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @Test
    void shouldCreateOverride() throws Exception {
        when(registry.create(any(OverrideRequest.class))).thenReturn(FLOOR);

        mockMvc.perform(post("/api/admin/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"EVENT\",\"target\":\"wedding-2026-0613-barn\","
                                + "\"effect\":\"PRIORITY_FLOOR\",\"priorityClass\":\"CRITICAL\","
                                + "\"expiresAt\":\"2026-06-13T21:00:00Z\",\"issuedBy\":\"ops-oncall\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("ovr-1"))
                .andExpect(jsonPath("$.effect").value("PRIORITY_FLOOR"));

        ArgumentCaptor<OverrideRequest> captor = ArgumentCaptor.forClass(OverrideRequest.class);
        verify(registry).create(captor.capture());
        assertThat(captor.getValue().getExpiresAt()).isEqualTo(Instant.parse("2026-06-13T21:00:00Z"));
    }

    @Test
    void shouldAnswerBadRequestWhenRegistryRefuses() throws Exception {
        when(registry.create(any(OverrideRequest.class)))
                .thenThrow(new OverrideRejectedException("expiresAt must be in the future"));

        mockMvc.perform(post("/api/admin/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GLOBAL\",\"effect\":\"PRIORITY_CEILING\",\"priorityClass\":\"LOW\","
                                + "\"expiresAt\":\"2020-01-01T00:00:00Z\",\"issuedBy\":\"ops-oncall\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("expiresAt must be in the future"));
    }

    @Test
    void shouldRequireExpiryAndIssuer() throws Exception {
        mockMvc.perform(post("/api/admin/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GLOBAL\",\"effect\":\"QUOTA_MULTIPLIER\",\"factor\":2.0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldExpireOverrideOnBehalfOfOperator() throws Exception {
        when(registry.expire("ovr-1", "ops-lead")).thenReturn(Optional.of(FLOOR));

        mockMvc.perform(post("/api/admin/overrides/ovr-1/expire").header("X-Operator", "ops-lead"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("ovr-1"));
    }

    @Test
    void shouldAnswerNotFoundForUnknownOverride() throws Exception {
        when(registry.expire("missing", "unknown")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/admin/overrides/missing/expire"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListActiveOverrides() throws Exception {
        when(registry.active()).thenReturn(List.of(FLOOR));

        mockMvc.perform(get("/api/admin/overrides"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target").value("wedding-2026-0613-barn"))
                .andExpect(jsonPath("$[0].issuedBy").value("ops-oncall"));
    }
}
