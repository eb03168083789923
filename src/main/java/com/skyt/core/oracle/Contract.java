package com.skyt.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyt.core.naming.NamingPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Contract: what a task's function must be called and do.
 *
 * JSON form (unknown fields ignored):
 * <pre>
 * {
 *   "id": "fibonacci",
 *   "function_name": "fib",
 *   "class_name": null,
 *   "required_methods": ["fib"],
 *   "requires_recursion": true,
 *   "algorithm": "binary_search",
 *   "naming_policy": { "fixed": ["fib"], "flexible": [], "strict": false },
 *   "test_cases": [ { "args": [10], "expected": 55 },
 *                   { "args": [-1], "throws": "IllegalArgumentException" } ]
 * }
 * </pre>
 * camelCase keys are accepted as well.
 */
public final class Contract {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String                 id;
    private final String                 functionName;
    private final String                 className;
    private final List<String>           requiredMethods;
    private final Boolean                requiresRecursion;
    private final String                 algorithm;
    private final NamingPolicy           namingPolicy;
    private final List<ContractTestCase> testCases;

    private Contract(Builder b) {
        this.id                = b.id;
        this.functionName      = b.functionName;
        this.className         = b.className;
        this.requiredMethods   = Collections.unmodifiableList(new ArrayList<>(b.requiredMethods));
        this.requiresRecursion = b.requiresRecursion;
        this.algorithm         = b.algorithm;
        this.namingPolicy      = b.namingPolicy != null ? b.namingPolicy : NamingPolicy.permissive();
        this.testCases         = Collections.unmodifiableList(new ArrayList<>(b.testCases));
    }

    public static Builder builder(String id, String functionName) {
        return new Builder(id, functionName);
    }

    // =========================================================================
    // JSON
    // =========================================================================

    public static Contract fromJson(String json) throws ContractFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ContractFormatException("Contract is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ContractFormatException("Contract must be a JSON object");
        }

        String id           = text(root, "id", null);
        String functionName = text(root, "function_name", "functionName");
        if (id == null || functionName == null) {
            throw new ContractFormatException("Contract requires 'id' and 'function_name'");
        }

        Builder builder = builder(id, functionName)
                .className(text(root, "class_name", "className"));

        JsonNode required = field(root, "required_methods", "requiredMethods");
        if (required != null && required.isArray()) {
            for (JsonNode name : required) builder.requiredMethod(name.asText());
        }

        JsonNode recursion = field(root, "requires_recursion", "requiresRecursion");
        if (recursion != null && recursion.isBoolean()) {
            builder.requiresRecursion(recursion.asBoolean());
        }

        builder.algorithm(text(root, "algorithm", null));

        JsonNode policy = field(root, "naming_policy", "namingPolicy");
        if (policy != null && policy.isObject()) {
            builder.namingPolicy(NamingPolicy.of(
                    strings(policy.get("fixed")),
                    strings(policy.get("flexible")),
                    policy.path("strict").asBoolean(false)));
        }

        JsonNode cases = field(root, "test_cases", "testCases");
        if (cases != null && cases.isArray()) {
            for (JsonNode testCase : cases) {
                JsonNode args = testCase.get("args");
                if (args == null || !args.isArray()) {
                    throw new ContractFormatException("Test case requires an 'args' array: " + testCase);
                }
                String thrown = testCase.hasNonNull("throws") ? testCase.get("throws").asText() : null;
                builder.testCase(new ContractTestCase(args, testCase.get("expected"), thrown));
            }
        }
        return builder.build();
    }

    private static JsonNode field(JsonNode root, String snake, String camel) {
        if (root.hasNonNull(snake)) return root.get(snake);
        if (camel != null && root.hasNonNull(camel)) return root.get(camel);
        return null;
    }

    private static String text(JsonNode root, String snake, String camel) {
        JsonNode node = field(root, snake, camel);
        return node == null ? null : node.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode value : array) values.add(value.asText());
        }
        return values;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String                 getId()                { return id; }
    public String                 getFunctionName()      { return functionName; }
    public String                 getClassName()         { return className; }
    public List<String>           getRequiredMethods()   { return requiredMethods; }
    /** True/false when the contract constrains recursion, null when it does not. */
    public Boolean                getRequiresRecursion() { return requiresRecursion; }
    /** Required algorithm family (binary_search, euclidean, stack), or null. */
    public String                 getAlgorithm()         { return algorithm; }
    public NamingPolicy           getNamingPolicy()      { return namingPolicy; }
    public List<ContractTestCase> getTestCases()         { return testCases; }

    @Override
    public String toString() {
        return "Contract{id='" + id + "', function='" + functionName + "', cases=" + testCases.size() + "}";
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final String                 id;
        private final String                 functionName;
        private String                       className;
        private final List<String>           requiredMethods = new ArrayList<>();
        private Boolean                      requiresRecursion;
        private String                       algorithm;
        private NamingPolicy                 namingPolicy;
        private final List<ContractTestCase> testCases = new ArrayList<>();

        private Builder(String id, String functionName) {
            this.id           = id;
            this.functionName = functionName;
        }

        public Builder className(String v)          { this.className = v; return this; }
        public Builder requiredMethod(String v)     { this.requiredMethods.add(v); return this; }
        public Builder requiresRecursion(Boolean v) { this.requiresRecursion = v; return this; }
        public Builder algorithm(String v)          { this.algorithm = v; return this; }
        public Builder namingPolicy(NamingPolicy v) { this.namingPolicy = v; return this; }
        public Builder testCase(ContractTestCase v) { this.testCases.add(v); return this; }

        /** Adds a case from plain Java values, converted through Jackson. */
        public Builder testCase(List<?> args, Object expected) {
            return testCase(new ContractTestCase(MAPPER.valueToTree(args), MAPPER.valueToTree(expected), null));
        }

        public Builder throwingCase(List<?> args, String exceptionClass) {
            return testCase(new ContractTestCase(MAPPER.valueToTree(args), null, exceptionClass));
        }

        public Contract build() {
            return new Contract(this);
        }
    }

    public static class ContractFormatException extends Exception {
        public ContractFormatException(String message)                  { super(message); }
        public ContractFormatException(String message, Throwable cause) { super(message, cause); }
    }
}
