package com.skyt.core.explain;

import com.skyt.core.property.PropertyKind;

/**
 * Closed taxonomy of explainable differences. Each tag belongs to exactly one
 * property kind and carries the severity its explainer reports.
 */
public enum DifferenceType {

    CONSECUTIVE_STATEMENTS_CONSOLIDATABLE(PropertyKind.STATEMENT_ORDERING,     0.15),
    CHAINED_STATEMENTS_CONSOLIDATABLE(PropertyKind.STATEMENT_ORDERING,         0.25),
    EMPTY_CHECK_FORM(PropertyKind.LOGICAL_EQUIVALENCE,                         0.15),
    BOOLEAN_REDUNDANCY(PropertyKind.LOGICAL_EQUIVALENCE,                       0.10),
    LOOP_VS_STREAM(PropertyKind.NORMALIZED_STRUCTURE,                          0.30),
    STRING_BUILDING_IDIOM(PropertyKind.NORMALIZED_STRUCTURE,                   0.25),
    IF_ELSE_VS_TERNARY(PropertyKind.CONTROL_FLOW_SIGNATURE,                    0.15),
    REGEX_CHARACTER_CLASS_DIFFERENCE(PropertyKind.STRING_LITERALS,             0.30),
    REGEX_PATTERN_VARIATION(PropertyKind.STRING_LITERALS,                      0.10),
    PARAMETER_NAMING_DIFFERENCE(PropertyKind.FUNCTION_CONTRACTS,               0.20),
    LOCAL_NAMING_DIFFERENCE(PropertyKind.DATA_DEPENDENCY_GRAPH,                0.20),
    BASE_CASE_PREDICATE_FORM(PropertyKind.TERMINATION_PROPERTIES,              0.20);

    private final PropertyKind kind;
    private final double       severity;

    DifferenceType(PropertyKind kind, double severity) {
        this.kind     = kind;
        this.severity = severity;
    }

    public PropertyKind getKind()     { return kind; }
    public double       getSeverity() { return severity; }

    /** Lower-case, hyphenated tag used in logs and run summaries. */
    public String tag() {
        return name().toLowerCase().replace('_', '-');
    }
}
