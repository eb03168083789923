package com.skyt.core.compliance;

import com.skyt.core.oracle.Contract;
import com.skyt.core.oracle.Oracle;
import com.skyt.core.oracle.OracleResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * CanonSelectionPolicy: picks which of several candidate implementations
 * should become a task's canon.
 *
 * Only oracle-passing candidates are eligible. Among them the highest
 * compliance score wins; ties go to the earliest candidate, so selection is
 * deterministic for a fixed input order. Returns null when nothing passes.
 */
@Component
public class CanonSelectionPolicy {

    private static final Logger log = LoggerFactory.getLogger(CanonSelectionPolicy.class);

    private final Oracle            oracle;
    private final ComplianceChecker complianceChecker;
    private final long              oracleTimeoutMillis;

    public CanonSelectionPolicy(
            Oracle oracle,
            ComplianceChecker complianceChecker,
            @Value("${skyt.oracle.timeout-ms:10000}") long oracleTimeoutMillis
    ) {
        this.oracle              = oracle;
        this.complianceChecker   = complianceChecker;
        this.oracleTimeoutMillis = oracleTimeoutMillis;
    }

    public Selection select(List<String> candidates, Contract contract) {
        Selection best = null;
        for (int i = 0; i < candidates.size(); i++) {
            String code = candidates.get(i);
            OracleResult verdict = oracle.validate(code, contract, oracleTimeoutMillis);
            if (!verdict.isPassed()) {
                log.info("[CanonSelection] Candidate {} rejected by oracle: {}", i, verdict.getDetail());
                continue;
            }
            ComplianceReport compliance = complianceChecker.check(code, contract);
            log.info("[CanonSelection] Candidate {} eligible, compliance={}", i, compliance.getScore());
            if (best == null || compliance.getScore() > best.getCompliance().getScore()) {
                best = new Selection(i, code, verdict, compliance);
            }
        }
        if (best == null) {
            log.warn("[CanonSelection] No candidate passed the oracle ({} tried)", candidates.size());
        }
        return best;
    }

    // =========================================================================
    // Inner classes
    // =========================================================================

    public static final class Selection {
        private final int              index;
        private final String           code;
        private final OracleResult     oracleResult;
        private final ComplianceReport compliance;

        Selection(int index, String code, OracleResult oracleResult, ComplianceReport compliance) {
            this.index        = index;
            this.code         = code;
            this.oracleResult = oracleResult;
            this.compliance   = compliance;
        }

        public int              getIndex()        { return index; }
        public String           getCode()         { return code; }
        public OracleResult     getOracleResult() { return oracleResult; }
        public ComplianceReport getCompliance()   { return compliance; }
    }
}
