package com.company.netperf.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkPathResponse {
    private String sourceHost;
    private String destHost;
    private String pathType;
    private long samples;
    private Instant lastSeen;
}
