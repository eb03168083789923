package com.skyt.core.canon;

import com.skyt.config.AnalysisMode;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.property.PropertySet;

import java.time.Instant;
import java.util.Objects;

/**
 * The anchored reference for one task: its source, the property snapshot
 * taken when it was anchored, and how it was validated.
 *
 * Immutable. Replacing a canon means writing a new record with an explicit
 * overwrite through {@link CanonStore}.
 */
public final class CanonRecord {

    private final String       taskId;
    private final String       source;
    private final PropertySet  properties;
    private final Provenance   provenance;
    private final NamingPolicy namingPolicy;
    private final String       contractId;
    private final AnalysisMode analysisMode;
    private final Instant      createdAt;

    public CanonRecord(String taskId, String source, PropertySet properties, Provenance provenance,
                       NamingPolicy namingPolicy, String contractId, AnalysisMode analysisMode,
                       Instant createdAt) {
        this.taskId       = Objects.requireNonNull(taskId, "taskId");
        this.source       = Objects.requireNonNull(source, "source");
        this.properties   = Objects.requireNonNull(properties, "properties");
        this.provenance   = Objects.requireNonNull(provenance, "provenance");
        this.namingPolicy = namingPolicy == null ? NamingPolicy.permissive() : namingPolicy;
        this.contractId   = contractId;
        this.analysisMode = analysisMode == null ? AnalysisMode.BASELINE : analysisMode;
        this.createdAt    = createdAt;
    }

    public String       getTaskId()       { return taskId; }
    public String       getSource()       { return source; }
    public PropertySet  getProperties()   { return properties; }
    public Provenance   getProvenance()   { return provenance; }
    public NamingPolicy getNamingPolicy() { return namingPolicy; }
    public String       getContractId()   { return contractId; }
    /** Mode the property snapshot was extracted under. */
    public AnalysisMode getAnalysisMode() { return analysisMode; }
    public Instant      getCreatedAt()    { return createdAt; }

    public boolean isOracleValidated() {
        return provenance.isOracleValidated();
    }

    @Override
    public String toString() {
        return "CanonRecord{task=" + taskId + ", contract=" + contractId
                + ", validated=" + provenance.isOracleValidated() + ", createdAt=" + createdAt + "}";
    }

    // =========================================================================
    // Inner classes
    // =========================================================================

    /** How the canon was validated when it was anchored. */
    public static final class Provenance {
        private final boolean oracleValidated;
        private final double  passRate;
        private final String  detail;

        public Provenance(boolean oracleValidated, double passRate, String detail) {
            this.oracleValidated = oracleValidated;
            this.passRate        = passRate;
            this.detail          = detail;
        }

        public boolean isOracleValidated() { return oracleValidated; }
        public double  getPassRate()       { return passRate; }
        public String  getDetail()         { return detail; }
    }
}
