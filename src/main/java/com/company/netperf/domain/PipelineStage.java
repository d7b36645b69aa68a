package com.company.netperf.domain;

import lombok.Value;

import java.util.List;

/**
 * One process of a transfer pipeline; stdout of each stage feeds stdin of the next.
 */
@Value
public class PipelineStage {
    String name;
    List<String> command;

    public static PipelineStage of(String name, List<String> command) {
        return new PipelineStage(name, List.copyOf(command));
    }

    public String describe() {
        return String.join(" ", command);
    }
}
