package com.company.netperf.dto.response;

import com.company.netperf.domain.enums.CauseKind;
import com.company.netperf.domain.enums.Confidence;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticCause {
    private CauseKind kind;
    private Confidence confidence;
    private String detail;

    public String getCause() {
        return kind != null ? kind.getTitle() : null;
    }
}
