package com.skyt.pipeline;

import com.skyt.core.naming.NamingPolicy;

/**
 * Per-call overrides. Unset values fall back to {@link PipelineSettings};
 * an unset naming policy falls back to the contract's, then the canon
 * record's, then the permissive policy.
 */
public final class TransformOptions {

    private static final TransformOptions DEFAULTS = builder().build();

    private final Integer      maxIterations;
    private final Boolean      templateTierEnabled;
    private final NamingPolicy namingPolicy;

    private TransformOptions(Builder b) {
        this.maxIterations       = b.maxIterations;
        this.templateTierEnabled = b.templateTierEnabled;
        this.namingPolicy        = b.namingPolicy;
    }

    public static TransformOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Integer      getMaxIterations()       { return maxIterations; }
    public Boolean      getTemplateTierEnabled() { return templateTierEnabled; }
    public NamingPolicy getNamingPolicy()        { return namingPolicy; }

    @Override
    public String toString() {
        return "TransformOptions{maxIterations=" + maxIterations
                + ", templateTierEnabled=" + templateTierEnabled
                + ", namingPolicy=" + namingPolicy + "}";
    }

    public static final class Builder {
        private Integer      maxIterations;
        private Boolean      templateTierEnabled;
        private NamingPolicy namingPolicy;

        private Builder() {}

        public Builder maxIterations(int v) {
            if (v < 1) throw new IllegalArgumentException("maxIterations must be at least 1");
            this.maxIterations = v;
            return this;
        }

        public Builder templateTierEnabled(boolean v)  { this.templateTierEnabled = v; return this; }
        public Builder namingPolicy(NamingPolicy v)    { this.namingPolicy = v;        return this; }

        public TransformOptions build() { return new TransformOptions(this); }
    }
}
