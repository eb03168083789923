package com.skyt.core.validate;

import com.skyt.core.distance.DistanceCalculator;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.oracle.OracleResult;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertySet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Accept-or-rollback check for a single rewrite.
 *
 * Gates, in the order they run:
 * <ol>
 *   <li>the rewrite parses</li>
 *   <li>it introduces no unbound name</li>
 *   <li>at least one top-level definition remains</li>
 *   <li>its distance to the canon is not larger than before</li>
 *   <li>behavior is preserved: no oracle regression when an oracle and
 *       contract are present, otherwise an equivalent behavior probe</li>
 * </ol>
 * The template tier skips the probe but not the oracle check. The gate never
 * mutates either version; a rejection simply leaves the caller on the
 * previous source.
 */
@Component
public class ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

    private final SourceParser             parser;
    private final PropertyExtractor        extractor;
    private final DistanceCalculator       calculator;
    private final UnboundIdentifierChecker unboundChecker;
    private final BehaviorProbe            probe;

    public ValidationGate(
            SourceParser             parser,
            PropertyExtractor        extractor,
            DistanceCalculator       calculator,
            UnboundIdentifierChecker unboundChecker,
            BehaviorProbe            probe
    ) {
        this.parser         = parser;
        this.extractor      = extractor;
        this.calculator     = calculator;
        this.unboundChecker = unboundChecker;
        this.probe          = probe;
    }

    /**
     * @param before        source the rewrite was generated from
     * @param after         the rewrite
     * @param context       canon, naming policy and optional oracle for this transform
     * @param templateTier  true for the oracle-guided template tier, which is exempt from the probe
     */
    public ValidationResult validate(String before, String after, ValidationContext context, boolean templateTier) {
        ParsedSource parsedAfter = parser.parse(after);
        if (parsedAfter == null) {
            return reject(RejectionReason.UNPARSABLE, "Rewrite does not parse");
        }
        ParsedSource parsedBefore = parser.parse(before);
        if (parsedBefore == null) {
            return reject(RejectionReason.UNPARSABLE, "Source before rewrite does not parse");
        }

        Set<String> introduced = unboundChecker.introducedNames(parsedBefore, parsedAfter);
        if (!introduced.isEmpty()) {
            return reject(RejectionReason.UNBOUND_IDENTIFIER, "Introduces unbound " + introduced);
        }

        if (parsedAfter.topLevelDefinitionCount() < 1) {
            return reject(RejectionReason.NO_DEFINITIONS, "No top-level definition left");
        }

        PropertySet canon = context.getCanonProperties();
        double distanceBefore = calculator.distance(extractor.extract(parsedBefore), canon, context.getNamingPolicy());
        double distanceAfter  = calculator.distance(extractor.extract(parsedAfter), canon, context.getNamingPolicy());
        if (distanceAfter > distanceBefore) {
            return reject(RejectionReason.DISTANCE_REGRESSION,
                    String.format("Distance rose from %.4f to %.4f", distanceBefore, distanceAfter));
        }

        if (context.hasOracle()) {
            OracleResult pre  = context.oracleResultFor(before);
            OracleResult post = context.oracleResultFor(after);
            if (!post.isNoWorseThan(pre)) {
                return reject(RejectionReason.ORACLE_REGRESSION, "Oracle " + pre + " became " + post);
            }
            return ValidationResult.accepted(distanceAfter, "Oracle " + post);
        }

        if (templateTier) {
            return ValidationResult.accepted(distanceAfter, "Template tier, probe not required");
        }

        ProbeVerdict verdict = probe.compare(parsedBefore, parsedAfter);
        return switch (verdict.getKind()) {
            case EQUIVALENT   -> ValidationResult.accepted(distanceAfter, verdict.getDetail());
            case DIFFERENT    -> reject(RejectionReason.BEHAVIOR_CHANGED, verdict.getDetail());
            case INCONCLUSIVE -> reject(RejectionReason.PROBE_INCONCLUSIVE, verdict.getDetail());
        };
    }

    private static ValidationResult reject(RejectionReason reason, String detail) {
        log.debug("[Validation] Rejected: {} ({})", reason, detail);
        return ValidationResult.rejected(reason, detail);
    }
}
