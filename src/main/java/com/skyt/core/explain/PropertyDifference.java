package com.skyt.core.explain;

import com.skyt.core.property.PropertyKind;

/**
 * A nonzero per-property distance that an explainer could attribute to a
 * concrete idiom. Recomputed every iteration and never persisted.
 */
public final class PropertyDifference {

    private final PropertyKind        kind;
    private final DifferenceType      type;
    private final double              severity;
    private final String              explanation;
    private final TransformationHints hints;
    private final String              candidateDetail;
    private final String              canonDetail;

    private PropertyDifference(Builder b) {
        this.kind            = b.type.getKind();
        this.type            = b.type;
        this.severity        = b.severity;
        this.explanation     = b.explanation;
        this.hints           = b.hints;
        this.candidateDetail = b.candidateDetail;
        this.canonDetail     = b.canonDetail;
    }

    public static Builder builder(DifferenceType type) {
        return new Builder(type);
    }

    public PropertyKind        getKind()            { return kind; }
    public DifferenceType      getType()            { return type; }
    public double              getSeverity()        { return severity; }
    public String              getExplanation()     { return explanation; }
    public TransformationHints getHints()           { return hints; }
    public String              getCandidateDetail() { return candidateDetail; }
    public String              getCanonDetail()     { return canonDetail; }

    @Override
    public String toString() {
        return "PropertyDifference{" + type.tag() + ", severity=" + severity + ", " + explanation + "}";
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final DifferenceType type;
        private double               severity;
        private String               explanation     = "";
        private TransformationHints  hints           = TransformationHints.empty();
        private String               candidateDetail = "";
        private String               canonDetail     = "";

        private Builder(DifferenceType type) {
            if (type == null) throw new IllegalArgumentException("Difference type must not be null");
            this.type     = type;
            this.severity = type.getSeverity();
        }

        public Builder severity(double v)              { this.severity = v; return this; }
        public Builder explanation(String v)           { this.explanation = v; return this; }
        public Builder hints(TransformationHints v)    { this.hints = v; return this; }
        public Builder candidateDetail(String v)       { this.candidateDetail = v; return this; }
        public Builder canonDetail(String v)           { this.canonDetail = v; return this; }

        public PropertyDifference build() {
            if (severity < 0.0 || severity > 1.0) {
                throw new IllegalArgumentException("Severity out of range: " + severity);
            }
            return new PropertyDifference(this);
        }
    }
}
