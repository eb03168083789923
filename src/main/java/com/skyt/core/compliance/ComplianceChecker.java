package com.skyt.core.compliance;

import com.skyt.core.oracle.Contract;

/**
 * Judges non-functional constraints of a fragment (names, required methods,
 * recursion, algorithm family). Consumed by canon selection only.
 */
public interface ComplianceChecker {

    ComplianceReport check(String code, Contract contract);
}
