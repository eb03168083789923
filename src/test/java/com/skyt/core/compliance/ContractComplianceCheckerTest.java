package com.skyt.core.compliance;

import com.skyt.core.oracle.Contract;
import com.skyt.core.parse.SourceParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContractComplianceCheckerTest {

    private static final String BINARY_SEARCH =
            "int search(int[] a, int key) {\n"
            + "    int lo = 0, hi = a.length - 1;\n"
            + "    while (lo <= hi) {\n"
            + "        int mid = (lo + hi) / 2;\n"
            + "        if (a[mid] == key) return mid;\n"
            + "        if (a[mid] < key) lo = mid + 1; else hi = mid - 1;\n"
            + "    }\n"
            + "    return -1;\n"
            + "}";

    private static final String LINEAR_SEARCH =
            "int search(int[] a, int key) { for (int i = 0; i < a.length; i++) { if (a[i] == key) return i; } return -1; }";

    private final ContractComplianceChecker checker = new ContractComplianceChecker(new SourceParser());

    @Test
    void testContractWithOnlyFunctionName() {
        ComplianceReport report = checker.check(LINEAR_SEARCH, Contract.builder("s", "search").build());

        assertTrue(report.isFullyCompliant());
        assertEquals(1.0, report.getScore(), 1e-9);
    }

    @Test
    void testMissingFunctionAndMethods() {
        Contract contract = Contract.builder("s", "find")
                .requiredMethod("search")
                .requiredMethod("helper")
                .build();

        ComplianceReport report = checker.check(LINEAR_SEARCH, contract);

        assertFalse(report.isFullyCompliant());
        assertEquals(0.0, report.getScore(), 1e-9);
        assertEquals(2, report.getViolations().size());
        assertTrue(report.getViolations().get(1).contains("helper"));
    }

    @Test
    void testRecursionRequirement() {
        Contract recursive = Contract.builder("f", "fact").requiresRecursion(true).build();
        Contract iterative = Contract.builder("f", "fact").requiresRecursion(false).build();
        String recursion = "int fact(int n) { return n <= 1 ? 1 : n * fact(n - 1); }";
        String loop      = "int fact(int n) { int r = 1; for (int i = 2; i <= n; i++) r *= i; return r; }";

        assertTrue(checker.check(recursion, recursive).isFullyCompliant());
        assertFalse(checker.check(loop, recursive).isFullyCompliant());
        assertTrue(checker.check(loop, iterative).isFullyCompliant());
        assertTrue(checker.check(recursion, iterative).getViolations().get(0).contains("forbidden"));
    }

    @Test
    void testBinarySearchAlgorithmFamily() {
        Contract contract = Contract.builder("s", "search").algorithm("binary-search").build();

        assertTrue(checker.check(BINARY_SEARCH, contract).isFullyCompliant());
        ComplianceReport linear = checker.check(LINEAR_SEARCH, contract);
        assertFalse(linear.isFullyCompliant());
        assertEquals(0.5, linear.getScore(), 1e-9);
    }

    @Test
    void testEuclideanAndStackFamilies() {
        String gcd = "int gcd(int a, int b) { while (b != 0) { int t = a % b; a = b; b = t; } return a; }";
        String balanced = "boolean balanced(String s) { Deque<Character> st = new ArrayDeque<>(); "
                + "for (char c : s.toCharArray()) { if (c == '(') st.push(c); else if (st.isEmpty()) return false; else st.pop(); } "
                + "return st.isEmpty(); }";

        assertTrue(checker.check(gcd, Contract.builder("g", "gcd").algorithm("euclidean").build()).isFullyCompliant());
        assertTrue(checker.check(balanced, Contract.builder("b", "balanced").algorithm("stack").build()).isFullyCompliant());
        assertFalse(checker.check(gcd, Contract.builder("g", "gcd").algorithm("stack").build()).isFullyCompliant());
    }

    @Test
    void testUnknownAlgorithmFamilyPasses() {
        Contract contract = Contract.builder("s", "search").algorithm("quantum").build();

        assertTrue(checker.check(LINEAR_SEARCH, contract).isFullyCompliant());
    }

    @Test
    void testClassNameRequirement() {
        Contract contract = Contract.builder("s", "search").className("Searcher").build();

        assertTrue(checker.check("class Searcher { " + LINEAR_SEARCH + " }", contract).isFullyCompliant());
        assertFalse(checker.check(LINEAR_SEARCH, contract).isFullyCompliant());
    }

    @Test
    void testUnparsableCodeScoresZero() {
        ComplianceReport report = checker.check("int search(", Contract.builder("s", "search").build());

        assertFalse(report.isFullyCompliant());
        assertEquals(0.0, report.getScore(), 1e-9);
    }
}
