package com.skyt.core.parse;

import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentChainTest {

    private final SourceParser parser = new SourceParser();

    private MethodDeclaration method(String source) {
        ParsedSource parsed = parser.parse(source);
        assertNotNull(parsed, "fixture must parse");
        return parsed.primaryMethod();
    }

    @Test
    void testSingleTemporaryFolds() {
        AssignmentChain chain = AssignmentChain.find(method("int f(int n) { int r = n * 2; return r; }"));

        assertNotNull(chain);
        assertEquals("r", chain.getVariable());
        assertEquals(1, chain.length());
        assertEquals("n * 2", chain.fold().toString());
    }

    @Test
    void testReassignmentFoldsWithParentheses() {
        AssignmentChain chain = AssignmentChain.find(
                method("int f(int a, int b) { int r = a + b; r = r * 2; return r; }"));

        assertNotNull(chain);
        assertEquals(2, chain.length());
        assertEquals("(a + b) * 2", chain.fold().toString());
    }

    @Test
    void testCompoundAssignmentsFold() {
        AssignmentChain chain = AssignmentChain.find(
                method("int f(int a, int b) { int r = a; r += b; r *= 2; return r; }"));

        assertNotNull(chain);
        assertEquals("(a + b) * 2", chain.fold().toString());
    }

    @Test
    void testCollapseRewritesTree() {
        ParsedSource parsed = parser.parse("int f(int n) { int r = n + 1; return r; }");
        AssignmentChain chain = AssignmentChain.find(parsed.primaryMethod());

        chain.collapse();

        assertEquals(parser.parse("int f(int n) { return n + 1; }").print(), parsed.print());
    }

    @Test
    void testCollapseDropsBareDeclaration() {
        ParsedSource parsed = parser.parse("int f(int n) { int r; r = n > 0 ? 1 : 2; return r; }");
        AssignmentChain chain = AssignmentChain.find(parsed.primaryMethod());

        assertNotNull(chain);
        chain.collapse();

        assertEquals(parser.parse("int f(int n) { return n > 0 ? 1 : 2; }").print(), parsed.print());
    }

    @Test
    void testCollapseKeepsSiblingDeclarators() {
        ParsedSource parsed = parser.parse("int f(int n) { int r, k = 3; r = n + k; return r; }");
        AssignmentChain chain = AssignmentChain.find(parsed.primaryMethod());

        assertNotNull(chain);
        chain.collapse();

        assertEquals(parser.parse("int f(int n) { int k = 3; return n + k; }").print(), parsed.print());
    }

    @Test
    void testSideEffectsBlockTheChain() {
        assertNull(AssignmentChain.find(
                method("int f(int n) { int r = n; r = r + next(); return r; }")));
    }

    @Test
    void testDirectReturnHasNoChain() {
        assertNull(AssignmentChain.find(method("int f(int n) { return n * 2; }")));
    }

    @Test
    void testWideningTemporaryIsNotFolded() {
        assertNull(AssignmentChain.find(method("long f(int n) { int r = n * 2; return r; }")));
    }
}
