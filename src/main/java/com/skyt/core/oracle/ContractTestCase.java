package com.skyt.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One input/expectation pair of a contract. Arguments and the expected value
 * stay as JSON until the oracle knows the method's parameter types.
 */
public final class ContractTestCase {

    private final JsonNode args;
    private final JsonNode expected;
    private final String   expectedException;

    public ContractTestCase(JsonNode args, JsonNode expected, String expectedException) {
        this.args              = args != null ? args : JsonNodeFactory.instance.arrayNode();
        this.expected          = expected;
        this.expectedException = expectedException;
    }

    public JsonNode getArgs()              { return args; }
    public JsonNode getExpected()          { return expected; }
    /** Simple or qualified exception class name, or null when a value is expected. */
    public String   getExpectedException() { return expectedException; }
    public boolean  expectsException()     { return expectedException != null && !expectedException.isBlank(); }

    @Override
    public String toString() {
        return "ContractTestCase{args=" + args + ", "
                + (expectsException() ? "throws " + expectedException : "expected=" + expected) + "}";
    }
}
