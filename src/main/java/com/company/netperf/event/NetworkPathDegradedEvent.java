package com.company.netperf.event;

import com.company.netperf.domain.NetworkPerfRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published when a freshly collected path is not healthy.
 */
@Getter
@AllArgsConstructor
public class NetworkPathDegradedEvent {
    private final NetworkPerfRecord record;
}
