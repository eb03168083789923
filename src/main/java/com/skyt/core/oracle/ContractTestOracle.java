package com.skyt.core.oracle;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyt.core.exec.CompilationResult;
import com.skyt.core.exec.FragmentExecutor;
import com.skyt.core.exec.InvocationOutcome;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * ContractTestOracle: runs a contract's test cases against a fragment
 * compiled in memory.
 *
 * The whole validation shares one deadline: each case gets whatever time is
 * left, and cases that start after the deadline count as failures. A case
 * that overruns is abandoned, so validate() returns shortly after the
 * deadline even for code that never terminates.
 */
@Component
@Profile("!remote-oracle")
public class ContractTestOracle implements Oracle {

    private static final Logger log = LoggerFactory.getLogger(ContractTestOracle.class);

    private final SourceParser     parser;
    private final FragmentExecutor executor;
    private final ObjectMapper     objectMapper = new ObjectMapper();

    public ContractTestOracle(SourceParser parser, FragmentExecutor executor) {
        this.parser   = parser;
        this.executor = executor;
    }

    @Override
    public OracleResult validate(String code, Contract contract, long timeoutMillis) {
        if (contract == null) {
            return OracleResult.fail(0.0, "No contract supplied");
        }
        if (contract.getTestCases().isEmpty()) {
            return OracleResult.fail(0.0, "Contract " + contract.getId() + " has no test cases");
        }

        ParsedSource parsed = parser.parse(code);
        if (parsed == null) {
            return OracleResult.fail(0.0, "Code does not parse");
        }

        CompilationResult compiled = executor.compile(parsed);
        if (!compiled.isSuccess()) {
            return OracleResult.fail(0.0, "Compilation failed: " + compiled.getDiagnostics());
        }

        Method method = FragmentExecutor.findMethod(compiled.getType(), contract.getFunctionName());
        if (method == null) {
            return OracleResult.fail(0.0, "Function '" + contract.getFunctionName() + "' not found");
        }

        long deadline = System.currentTimeMillis() + timeoutMillis;
        int  passed   = 0;
        int  total    = contract.getTestCases().size();
        StringBuilder failures = new StringBuilder();

        for (int i = 0; i < total; i++) {
            ContractTestCase testCase = contract.getTestCases().get(i);
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                appendFailure(failures, i, "not run, time budget exhausted");
                continue;
            }
            String failure = runCase(method, testCase, remaining);
            if (failure == null) {
                passed++;
            } else {
                appendFailure(failures, i, failure);
            }
        }

        double rate = (double) passed / total;
        log.debug("[ContractOracle] {} → {}/{} cases passed", contract.getId(), passed, total);
        if (passed == total) {
            return OracleResult.pass(passed + "/" + total + " cases passed");
        }
        return OracleResult.fail(rate, passed + "/" + total + " cases passed; " + failures);
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    /** Null when the case passes, else the reason it failed. */
    private String runCase(Method method, ContractTestCase testCase, long timeoutMillis) {
        Object[] args;
        try {
            args = convertArgs(method, testCase.getArgs());
        } catch (IllegalArgumentException e) {
            return "arguments do not fit " + method.getName() + ": " + e.getMessage();
        }

        InvocationOutcome outcome = executor.invoke(method, args, timeoutMillis);

        if (testCase.expectsException()) {
            if (outcome.getKind() != InvocationOutcome.Kind.THREW) {
                return "expected " + testCase.getExpectedException() + " but " + outcome;
            }
            String thrown   = outcome.getExceptionClass();
            String expected = testCase.getExpectedException();
            boolean matches = thrown.equals(expected) || thrown.endsWith("." + expected);
            return matches ? null : "expected " + expected + " but threw " + thrown;
        }

        if (outcome.getKind() != InvocationOutcome.Kind.RETURNED) {
            return outcome.toString();
        }
        if (method.getReturnType() == void.class) {
            return null;
        }
        Object expected;
        try {
            expected = convert(testCase.getExpected(), method.getGenericReturnType());
        } catch (IllegalArgumentException e) {
            return "expected value does not fit return type: " + e.getMessage();
        }
        return Objects.deepEquals(outcome.getValue(), expected)
                ? null
                : "expected " + testCase.getExpected() + " but " + outcome;
    }

    private Object[] convertArgs(Method method, JsonNode argsNode) {
        Type[] types = method.getGenericParameterTypes();
        if (argsNode.size() != types.length) {
            throw new IllegalArgumentException("expected " + types.length + " arguments, got " + argsNode.size());
        }
        Object[] args = new Object[types.length];
        for (int i = 0; i < types.length; i++) {
            args[i] = convert(argsNode.get(i), types[i]);
        }
        return args;
    }

    private Object convert(JsonNode node, Type type) {
        if (node == null || node.isNull()) {
            return null;
        }
        JavaType javaType = objectMapper.getTypeFactory().constructType(type);
        return objectMapper.convertValue(node, javaType);
    }

    private static void appendFailure(StringBuilder failures, int index, String reason) {
        if (failures.length() > 0) failures.append("; ");
        failures.append("case ").append(index).append(": ").append(reason);
    }
}
