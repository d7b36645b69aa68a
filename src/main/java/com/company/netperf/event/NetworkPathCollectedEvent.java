package com.company.netperf.event;

import com.company.netperf.domain.NetworkPerfRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class NetworkPathCollectedEvent {
    private final NetworkPerfRecord record;
}
