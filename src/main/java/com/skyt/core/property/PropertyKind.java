package com.skyt.core.property;

/**
 * The closed vocabulary of properties extracted from a source fragment.
 *
 * Adding a kind means adding an analyzer for it in the extractor; the set is
 * fixed when the engine is built and every {@link PropertySet} covers all of it.
 */
public enum PropertyKind {

    CONTROL_FLOW_SIGNATURE("control_flow_signature", ValueShape.RECORD),
    DATA_DEPENDENCY_GRAPH("data_dependency_graph", ValueShape.RECORD),
    EXECUTION_PATHS("execution_paths", ValueShape.SEQUENCE),
    FUNCTION_CONTRACTS("function_contracts", ValueShape.RECORD),
    COMPLEXITY_CLASS("complexity_class", ValueShape.RECORD),
    SIDE_EFFECT_PROFILE("side_effect_profile", ValueShape.RECORD),
    TERMINATION_PROPERTIES("termination_properties", ValueShape.RECORD),
    ALGEBRAIC_STRUCTURE("algebraic_structure", ValueShape.SEQUENCE),
    NUMERICAL_BEHAVIOR("numerical_behavior", ValueShape.RECORD),
    LOGICAL_EQUIVALENCE("logical_equivalence", ValueShape.RECORD),
    NORMALIZED_STRUCTURE("normalized_structure", ValueShape.HASH_PAIR),
    OPERATOR_PRECEDENCE("operator_precedence", ValueShape.SEQUENCE),
    STATEMENT_ORDERING("statement_ordering", ValueShape.SEQUENCE),
    RECURSION_SCHEMA("recursion_schema", ValueShape.RECURSION_SCHEMA),
    STRING_LITERALS("string_literals", ValueShape.SEQUENCE);

    private final String     key;
    private final ValueShape shape;

    PropertyKind(String key, ValueShape shape) {
        this.key   = key;
        this.shape = shape;
    }

    /** Stable snake_case key used in persisted canon records. */
    public String     getKey()   { return key; }
    public ValueShape getShape() { return shape; }

    public static PropertyKind fromKey(String key) {
        for (PropertyKind kind : values()) {
            if (kind.key.equals(key)) return kind;
        }
        throw new IllegalArgumentException("Unknown property kind: " + key);
    }
}
