package com.skyt.core.extract;

import com.skyt.config.AnalysisMode;
import com.skyt.config.AnalysisModeResolver;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertySet;
import com.skyt.core.property.RecursionSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * PropertyExtractor: source text → fixed-schema {@link PropertySet}.
 *
 * Pure and deterministic: no I/O, no caching between calls, no clock or
 * randomness. Unparsable source yields {@link PropertySet#nullFilled()}, never
 * a partial set and never an exception.
 *
 * The analysis mode is fixed at construction. ENHANCED adds detail to the
 * complexity and side-effect records; every other property is identical in
 * both modes.
 */
@Component
public class PropertyExtractor {

    private static final Logger log = LoggerFactory.getLogger(PropertyExtractor.class);

    private final SourceParser       parser;
    private final AnalysisMode       mode;
    private final FlowAnalyzer       flow;
    private final DataFlowAnalyzer   data;
    private final ExpressionAnalyzer expressions;
    private final SignatureAnalyzer  signatures;
    private final StructureHasher    hasher;
    private final RecursionAnalyzer  recursion;

    public PropertyExtractor(SourceParser parser, AnalysisModeResolver modeResolver) {
        this.parser      = parser;
        this.mode        = modeResolver.getMode();
        this.flow        = new FlowAnalyzer(mode);
        this.data        = new DataFlowAnalyzer(mode);
        this.expressions = new ExpressionAnalyzer();
        this.signatures  = new SignatureAnalyzer();
        this.hasher      = new StructureHasher();
        this.recursion   = new RecursionAnalyzer();
    }

    public AnalysisMode getMode() {
        return mode;
    }

    public PropertySet extract(String source) {
        ParsedSource parsed = parser.parse(source);
        if (parsed == null) {
            log.debug("[Extractor] Unparsable source ({} chars) → null-filled set",
                    source == null ? 0 : source.length());
            return PropertySet.nullFilled();
        }
        return extract(parsed);
    }

    /** Extracts from an already parsed fragment. The tree is only read. */
    public PropertySet extract(ParsedSource parsed) {
        if (parsed == null) {
            return PropertySet.nullFilled();
        }
        try {
            RecursionSchema schema = recursion.schema(parsed);
            return PropertySet.builder()
                    .put(PropertyKind.CONTROL_FLOW_SIGNATURE, flow.controlFlowSignature(parsed))
                    .put(PropertyKind.DATA_DEPENDENCY_GRAPH,  data.dataDependencies(parsed))
                    .put(PropertyKind.EXECUTION_PATHS,        flow.executionPaths(parsed))
                    .put(PropertyKind.FUNCTION_CONTRACTS,     signatures.functionContracts(parsed))
                    .put(PropertyKind.COMPLEXITY_CLASS,       flow.complexity(parsed, schema))
                    .put(PropertyKind.SIDE_EFFECT_PROFILE,    data.sideEffects(parsed))
                    .put(PropertyKind.TERMINATION_PROPERTIES, flow.termination(parsed))
                    .put(PropertyKind.ALGEBRAIC_STRUCTURE,    expressions.algebraicStructure(parsed))
                    .put(PropertyKind.NUMERICAL_BEHAVIOR,     expressions.numericalBehavior(parsed))
                    .put(PropertyKind.LOGICAL_EQUIVALENCE,    expressions.logicalForm(parsed))
                    .put(PropertyKind.NORMALIZED_STRUCTURE,   hasher.hash(parsed))
                    .put(PropertyKind.OPERATOR_PRECEDENCE,    expressions.operatorPrecedence(parsed))
                    .put(PropertyKind.STATEMENT_ORDERING,     data.statementOrdering(parsed))
                    .put(PropertyKind.RECURSION_SCHEMA,       schema)
                    .put(PropertyKind.STRING_LITERALS,        expressions.stringLiterals(parsed))
                    .build();
        } catch (RuntimeException e) {
            log.warn("[Extractor] Analysis failed, returning null-filled set: {}", e.getMessage());
            return PropertySet.nullFilled();
        }
    }
}
