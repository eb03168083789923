package com.skyt.core.validate;

import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UnboundIdentifierCheckerTest {

    private final SourceParser             parser  = new SourceParser();
    private final UnboundIdentifierChecker checker = new UnboundIdentifierChecker();

    private Set<String> introduced(String before, String after) {
        return checker.introducedNames(parser.parse(before), parser.parse(after));
    }

    @Test
    void testDroppedDeclarationLeavesNameUnbound() {
        Set<String> names = introduced(
                "int f(int n) { int k = n; return k; }",
                "int f(int n) { return k; }");

        assertEquals(Set.of("k"), names);
    }

    @Test
    void testNamesAlreadyFreeBeforeAreTolerated() {
        Set<String> names = introduced(
                "int f(int n) { return n + offset; }",
                "int f(int n) { int t = n + offset; return t; }");

        assertTrue(names.isEmpty());
    }

    @Test
    void testBuiltinTypesAreNotReported() {
        Set<String> names = introduced(
                "int f(int n) { return n; }",
                "int f(int n) { return Math.abs(n); }");

        assertTrue(names.isEmpty());
    }

    @Test
    void testUnqualifiedCallToUndeclaredMethod() {
        Set<String> names = introduced(
                "int f(int n) { return n; }",
                "int f(int n) { return helper(n); }");

        assertEquals(Set.of("helper()"), names);
    }

    @Test
    void testCallToMethodDeclaredInFragmentIsBound() {
        ParsedSource source = parser.parse(
                "int f(int n) { return helper(n); }\nint helper(int n) { return n + 1; }");

        assertFalse(checker.freeNames(source).contains("helper()"));
    }

    @Test
    void testLambdaParametersAreDeclared() {
        Set<String> names = introduced(
                "List<Integer> f(List<Integer> xs) { return xs; }",
                "List<Integer> f(List<Integer> xs) { return xs.stream().map(x -> x + 1).collect(Collectors.toList()); }");

        assertTrue(names.isEmpty());
    }

    @Test
    void testLocalOfSiblingMethodDoesNotBind() {
        Set<String> names = introduced(
                "int f(int n) { return n; }\nint g(int m) { int total = m * 2; return total; }",
                "int f(int n) { return total; }\nint g(int m) { int total = m * 2; return total; }");

        assertEquals(Set.of("total"), names);
    }

    @Test
    void testLoopVariableDoesNotReachPastLoop() {
        Set<String> names = introduced(
                "int f(int[] a) { int s = 0; for (int v : a) { s += v; } return s; }",
                "int f(int[] a) { int s = 0; for (int v : a) { s += v; } return v; }");

        assertEquals(Set.of("v"), names);
    }

    @Test
    void testFieldsAndCatchParametersAreInScope() {
        ParsedSource source = parser.parse(
                "int base = 3;\n"
                        + "int f(String s) { try { return Integer.parseInt(s) + base; } "
                        + "catch (NumberFormatException e) { return e.getMessage().length(); } }");

        Set<String> free = checker.freeNames(source);
        assertFalse(free.contains("base"));
        assertFalse(free.contains("e"));
        assertFalse(free.contains("s"));
    }
}
