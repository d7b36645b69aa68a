package com.company.netperf.controller;

import com.company.netperf.domain.NetworkPerfSample;
import com.company.netperf.dto.response.NetworkDiagnostic;
import com.company.netperf.dto.response.NetworkPathResponse;
import com.company.netperf.service.NetworkDiagnosticService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/v1/network")
@Tag(name = "Network Diagnostics", description = "Query measured network paths and diagnose them")
@RequiredArgsConstructor
@Slf4j
@Validated
public class NetworkDiagnosticController {

    private final NetworkDiagnosticService diagnosticService;

    @GetMapping("/diagnostics")
    @Operation(
            summary = "Diagnose a network path",
            description = "Current metrics, history, time patterns, trends, causes and recommendations. "
                    + "Without source/dest the most recently measured path is used."
    )
    public ResponseEntity<NetworkDiagnostic> getDiagnostic(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String dest,
            @Parameter(description = "History lookback in hours (default one week)")
            @RequestParam(required = false) @Min(1) @Max(8760) Integer hours) {

        return ResponseEntity.ok(diagnosticService.diagnose(source, dest, hours));
    }

    @GetMapping(value = "/diagnostics/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Diagnose a network path as a text report")
    public ResponseEntity<String> getReport(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String dest,
            @RequestParam(required = false) @Min(1) @Max(8760) Integer hours,
            @Parameter(description = "Include ANSI color codes")
            @RequestParam(defaultValue = "false") boolean color) {

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(diagnosticService.report(source, dest, hours, color));
    }

    @GetMapping("/paths")
    @Operation(summary = "List measured network paths")
    public ResponseEntity<List<NetworkPathResponse>> getPaths() {
        return ResponseEntity.ok(diagnosticService.findPaths());
    }

    @GetMapping("/records")
    @Operation(summary = "Stored measurements, newest first")
    public ResponseEntity<List<NetworkPerfSample>> getRecords(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String dest,
            @RequestParam(defaultValue = "24") @Min(1) @Max(8760) int hours) {

        log.debug("Record query for {}->{} over {}h", source, dest, hours);
        return ResponseEntity.ok(diagnosticService.findHistory(source, dest, hours));
    }
}
