package com.skyt.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Pipeline defaults from {@code skyt.pipeline.*}; per-call {@link TransformOptions} override them. */
@Component
public class PipelineSettings {

    private final int     maxIterations;
    private final boolean templateTierEnabled;
    private final double  templateDistanceThreshold;
    private final long    oracleTimeoutMillis;

    public PipelineSettings(
            @Value("${skyt.pipeline.max-iterations:5}") int maxIterations,
            @Value("${skyt.pipeline.template-tier.enabled:false}") boolean templateTierEnabled,
            @Value("${skyt.pipeline.template-tier.distance-threshold:0.15}") double templateDistanceThreshold,
            @Value("${skyt.oracle.timeout-ms:10000}") long oracleTimeoutMillis
    ) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("skyt.pipeline.max-iterations must be at least 1");
        }
        this.maxIterations             = maxIterations;
        this.templateTierEnabled       = templateTierEnabled;
        this.templateDistanceThreshold = templateDistanceThreshold;
        this.oracleTimeoutMillis       = oracleTimeoutMillis;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(5, false, 0.15, 10_000);
    }

    public int     getMaxIterations()             { return maxIterations; }
    public boolean isTemplateTierEnabled()        { return templateTierEnabled; }
    public double  getTemplateDistanceThreshold() { return templateDistanceThreshold; }
    public long    getOracleTimeoutMillis()       { return oracleTimeoutMillis; }
}
