package com.skyt.service;

import com.skyt.core.canon.CanonCreationRefusedException;
import com.skyt.core.canon.CanonRecord;
import com.skyt.core.canon.CanonStore;
import com.skyt.core.canon.CanonStoreException;
import com.skyt.core.compliance.CanonSelectionPolicy;
import com.skyt.core.distance.DistanceReport;
import com.skyt.core.oracle.Contract;
import com.skyt.core.oracle.Oracle;
import com.skyt.core.oracle.OracleResult;
import com.skyt.pipeline.TransformOptions;
import com.skyt.pipeline.TransformResult;
import com.skyt.pipeline.TransformationPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers that work per task: anchor a canon once, then
 * canonicalize any number of candidates against it.
 *
 * Only {@link CanonStoreException}s reach the caller; everything else is
 * absorbed by the store or the pipeline.
 */
@Service
public class CanonicalizationService {

    private static final Logger log = LoggerFactory.getLogger(CanonicalizationService.class);

    private final CanonStore             store;
    private final TransformationPipeline pipeline;
    private final CanonSelectionPolicy   selectionPolicy;
    private final Oracle                 oracle;
    private final long                   oracleTimeoutMillis;

    public CanonicalizationService(
            CanonStore             store,
            TransformationPipeline pipeline,
            CanonSelectionPolicy   selectionPolicy,
            Oracle                 oracle,
            @Value("${skyt.oracle.timeout-ms:10000}") long oracleTimeoutMillis
    ) {
        this.store               = store;
        this.pipeline            = pipeline;
        this.selectionPolicy     = selectionPolicy;
        this.oracle              = oracle;
        this.oracleTimeoutMillis = oracleTimeoutMillis;
    }

    // =========================================================================
    // Anchoring
    // =========================================================================

    /** Validates {@code code} against the contract and anchors it if it passes. */
    public CanonRecord anchorCanon(String taskId, String code, Contract contract) throws CanonStoreException {
        OracleResult verdict = oracle.validate(code, contract, oracleTimeoutMillis);
        return store.create(taskId, code, verdict, true,
                contract.getNamingPolicy(), contract.getId(), false);
    }

    /**
     * Anchors the best of several candidates: oracle-passing first, then the
     * highest compliance score.
     */
    public CanonRecord selectAndAnchor(String taskId, List<String> candidates, Contract contract)
            throws CanonStoreException {
        CanonSelectionPolicy.Selection selection = selectionPolicy.select(candidates, contract);
        if (selection == null) {
            throw new CanonCreationRefusedException(taskId, CanonCreationRefusedException.Reason.ORACLE_FAILED,
                    "none of " + candidates.size() + " candidates passed the oracle");
        }
        log.info("[Canonicalization] Task '{}': anchoring candidate {} (compliance {})",
                taskId, selection.getIndex(), selection.getCompliance().getScore());
        return store.create(taskId, selection.getCode(), selection.getOracleResult(), true,
                contract.getNamingPolicy(), contract.getId(), false);
    }

    // =========================================================================
    // Canonicalization
    // =========================================================================

    /**
     * Transforms {@code candidate} toward the task's canon.
     *
     * @throws com.skyt.core.canon.CanonMissingException when no canon is anchored for the task
     */
    public TransformResult canonicalize(String taskId, String candidate, Contract contract, TransformOptions options)
            throws CanonStoreException {
        CanonRecord canon = store.require(taskId);
        TransformResult result = pipeline.transform(candidate, canon, contract, options);
        log.info("[Canonicalization] Task '{}': {}", taskId, result);
        return result;
    }

    public DistanceReport compare(String taskId, String candidate) throws CanonStoreException {
        return store.compare(taskId, candidate);
    }
}
