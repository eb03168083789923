package com.skyt.core.compliance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Result of checking a fragment against a contract's non-functional constraints. */
public final class ComplianceReport {

    private final boolean      fullyCompliant;
    private final double       score;
    private final List<String> violations;

    public ComplianceReport(boolean fullyCompliant, double score, List<String> violations) {
        this.fullyCompliant = fullyCompliant;
        this.score          = score;
        this.violations     = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean      isFullyCompliant() { return fullyCompliant; }
    public double       getScore()         { return score; }
    public List<String> getViolations()    { return violations; }

    @Override
    public String toString() {
        return String.format("ComplianceReport{compliant=%b, score=%.2f, violations=%s}",
                fullyCompliant, score, violations);
    }
}
