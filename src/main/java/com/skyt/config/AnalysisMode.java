package com.skyt.config;

/**
 * Depth of property extraction.
 *
 * BASELINE: coarse records, enough for idiom-level explanation.
 * ENHANCED: adds cyclomatic complexity, loop nesting and a detailed
 *            side-effect profile. Still deterministic.
 */
public enum AnalysisMode {
    BASELINE,
    ENHANCED
}
