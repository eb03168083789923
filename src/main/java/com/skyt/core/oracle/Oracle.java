package com.skyt.core.oracle;

/**
 * Behavioral-equivalence judge for a fragment under a contract.
 *
 * Implementations own the time box: {@link #validate} must return within
 * {@code timeoutMillis} even when the code under test never terminates. The
 * engine has no timeout logic of its own around this call.
 */
public interface Oracle {

    OracleResult validate(String code, Contract contract, long timeoutMillis);
}
