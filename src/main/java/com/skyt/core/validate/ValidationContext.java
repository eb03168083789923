package com.skyt.core.validate;

import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.oracle.Contract;
import com.skyt.core.oracle.Oracle;
import com.skyt.core.oracle.OracleResult;
import com.skyt.core.property.PropertySet;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything the gate needs that stays fixed for one transform call: the
 * canon's properties, the naming policy, and the optional oracle and
 * contract. Oracle verdicts are cached per source text for the call, so the
 * post-rewrite verdict of one step serves as the pre-rewrite verdict of the
 * next.
 */
public final class ValidationContext {

    private final PropertySet  canonProperties;
    private final NamingPolicy namingPolicy;
    private final Contract     contract;
    private final Oracle       oracle;
    private final long         oracleTimeoutMillis;

    private final Map<String, OracleResult> oracleResults = new HashMap<>();

    public ValidationContext(PropertySet canonProperties, NamingPolicy namingPolicy,
                             Contract contract, Oracle oracle, long oracleTimeoutMillis) {
        this.canonProperties     = canonProperties;
        this.namingPolicy        = namingPolicy != null ? namingPolicy : NamingPolicy.permissive();
        this.contract            = contract;
        this.oracle              = oracle;
        this.oracleTimeoutMillis = oracleTimeoutMillis;
    }

    public PropertySet  getCanonProperties() { return canonProperties; }
    public NamingPolicy getNamingPolicy()    { return namingPolicy; }
    public Contract     getContract()        { return contract; }
    public Oracle       getOracle()          { return oracle; }

    /** True when behavior can be checked against the oracle rather than the probe. */
    public boolean hasOracle() {
        return oracle != null && contract != null;
    }

    /** Oracle verdict for {@code code}, computed once per distinct source text. */
    public OracleResult oracleResultFor(String code) {
        if (!hasOracle()) {
            throw new IllegalStateException("No oracle and contract in this validation context");
        }
        return oracleResults.computeIfAbsent(code, c -> oracle.validate(c, contract, oracleTimeoutMillis));
    }
}
