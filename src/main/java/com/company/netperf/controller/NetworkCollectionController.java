package com.company.netperf.controller;

import com.company.netperf.domain.NetworkPerfSample;
import com.company.netperf.domain.NetworkPerfRecord;
import com.company.netperf.service.NetworkPathCollector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/network/collections")
@Tag(name = "Network Collection", description = "Trigger network measurements outside the schedule")
@RequiredArgsConstructor
@Slf4j
@Validated
public class NetworkCollectionController {

    private final NetworkPathCollector collector;

    @PostMapping
    @Operation(
            summary = "Run one collection cycle now",
            description = "Measures every configured path and returns the stored records. May take minutes in full-test mode."
    )
    public ResponseEntity<List<NetworkPerfSample>> collectAll() {
        log.info("Manual collection cycle requested");
        List<NetworkPerfSample> samples = collector.collectAll().stream()
                .map(NetworkPerfSample::fromRecord)
                .collect(Collectors.toList());
        return ResponseEntity.ok(samples);
    }

    @PostMapping("/path")
    @Operation(summary = "Measure one configured path now")
    public ResponseEntity<NetworkPerfSample> collectPath(
            @RequestParam(required = false) String source,
            @RequestParam @NotBlank String dest) {

        log.info("Manual collection requested for {}->{}", source, dest);
        NetworkPerfRecord record = collector.collectConfiguredPath(source, dest);
        return ResponseEntity.ok(NetworkPerfSample.fromRecord(record));
    }
}
