package com.skyt.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class AnalysisModeResolver {

    private final AnalysisMode mode;

    public AnalysisModeResolver(
        @Value("${skyt.analysis.mode:baseline}") String mode
    ) {
        this.mode = AnalysisMode.valueOf(mode.trim().toUpperCase());
    }

    public AnalysisMode getMode() {
        return mode;
    }
}
