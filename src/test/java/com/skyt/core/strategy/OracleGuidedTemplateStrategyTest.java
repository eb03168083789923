package com.skyt.core.strategy;

import org.junit.jupiter.api.Test;

import static com.skyt.core.strategy.StrategyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OracleGuidedTemplateStrategyTest {

    private final OracleGuidedTemplateStrategy template = new OracleGuidedTemplateStrategy(PARSER);

    @Test
    void testCopiesCanonStructureKeepingName() {
        String out = template.generate(
                "int total(int n) { int r = 0; for (int i = 1; i <= n; i++) r += i; return r; }",
                "int sum(int k) { return k * (k + 1) / 2; }");

        assertSameCode("int total(int k) { return k * (k + 1) / 2; }", out);
    }

    @Test
    void testRecursiveCallsRedirected() {
        String out = template.generate(
                "int factorial(int x) { int r = 1; while (x > 1) { r *= x; x--; } return r; }",
                "int fact(int n) { return n <= 1 ? 1 : n * fact(n - 1); }");

        assertSameCode("int factorial(int n) { return n <= 1 ? 1 : n * factorial(n - 1); }", out);
    }

    @Test
    void testAlreadyMatchingYieldsNothing() {
        String code = "int f(int n) { return n * 2; }";

        assertNull(template.generate(code, code));
    }

    @Test
    void testUnparsableSidesYieldNothing() {
        assertNull(template.generate("int f( {", "int f(int n) { return n; }"));
        assertNull(template.generate("int f(int n) { return n; }", "int f( {"));
    }
}
