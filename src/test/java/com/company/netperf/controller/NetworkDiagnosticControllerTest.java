package com.company.netperf.controller;

import com.company.netperf.domain.enums.CauseKind;
import com.company.netperf.domain.enums.Confidence;
import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.dto.response.DiagnosticCause;
import com.company.netperf.dto.response.NetworkDiagnostic;
import com.company.netperf.dto.response.NetworkPathResponse;
import com.company.netperf.exception.GlobalExceptionHandler;
import com.company.netperf.service.NetworkDiagnosticService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class NetworkDiagnosticControllerTest {

    @Mock
    private NetworkDiagnosticService diagnosticService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new NetworkDiagnosticController(diagnosticService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getDiagnostic_returnsCausesAndRecommendations() throws Exception {
        NetworkDiagnostic diag = NetworkDiagnostic.builder()
                .sourceHost("node-1")
                .destHost("storage-01")
                .pathType("direct")
                .currentStatus(PathStatus.DEGRADED)
                .potentialCauses(List.of(new DiagnosticCause(CauseKind.HIGH_JITTER, Confidence.HIGH, "25.0ms jitter")))
                .recommendations(List.of("Network jitter often indicates congestion"))
                .build();
        when(diagnosticService.diagnose("node-1", "storage-01", 24)).thenReturn(diag);

        mockMvc.perform(get("/api/v1/network/diagnostics")
                        .param("source", "node-1")
                        .param("dest", "storage-01")
                        .param("hours", "24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceHost").value("node-1"))
                .andExpect(jsonPath("$.currentStatus").value("DEGRADED"))
                .andExpect(jsonPath("$.potentialCauses[0].cause").value("High Jitter"))
                .andExpect(jsonPath("$.potentialCauses[0].confidence").value("HIGH"))
                .andExpect(jsonPath("$.recommendations[0]").value("Network jitter often indicates congestion"));
    }

    @Test
    void getReport_returnsPlainText() throws Exception {
        when(diagnosticService.report(null, null, null, false)).thenReturn("Network Diagnostic - a → b\n");

        mockMvc.perform(get("/api/v1/network/diagnostics/report"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("Network Diagnostic")));
    }

    @Test
    void getPaths_listsMeasuredPaths() throws Exception {
        when(diagnosticService.findPaths()).thenReturn(List.of(NetworkPathResponse.builder()
                .sourceHost("node-1").destHost("storage-01").pathType("direct").samples(12)
                .lastSeen(Instant.parse("2024-03-04T10:00:00Z")).build()));

        mockMvc.perform(get("/api/v1/network/paths"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].destHost").value("storage-01"))
                .andExpect(jsonPath("$[0].samples").value(12));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(diagnosticService.findPaths()).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(get("/api/v1/network/paths"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
