package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.LocalNamingExplainer;
import com.skyt.core.explain.ParameterNamingExplainer;
import com.skyt.core.explain.TransformationHints;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.skyt.core.strategy.StrategyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RenameStrategiesTest {

    private final ParameterRenameStrategy parameters = new ParameterRenameStrategy(PARSER);
    private final LocalRenameStrategy locals = new LocalRenameStrategy(PARSER);

    private TransformationHints renames(String method, Map<String, String> renames) {
        return TransformationHints.builder()
                .put(ParameterNamingExplainer.HINT_METHOD, method)
                .putMap(ParameterNamingExplainer.HINT_RENAMES, renames)
                .build();
    }

    @Test
    void testParameterAndReferencesRenamed() {
        String out = parameters.generate(
                difference(DifferenceType.PARAMETER_NAMING_DIFFERENCE, renames("f", Map.of("items", "arr"))),
                "int f(int[] items) { return items.length; }");

        assertSameCode("int f(int[] arr) { return arr.length; }", out);
    }

    @Test
    void testSimultaneousSwap() {
        String out = parameters.generate(
                difference(DifferenceType.PARAMETER_NAMING_DIFFERENCE, renames("f", Map.of("a", "b", "b", "a"))),
                "int f(int a, int b) { return a - b; }");

        assertSameCode("int f(int b, int a) { return b - a; }", out);
    }

    @Test
    void testShadowingAnonymousClassLeftAlone() {
        String out = parameters.generate(
                difference(DifferenceType.PARAMETER_NAMING_DIFFERENCE, renames("f", Map.of("x", "y"))),
                "int f(int x) { Supplier<Integer> s = new Supplier<Integer>() { "
                        + "public Integer get() { int x = 1; return x; } }; return x + s.get(); }");

        assertSameCode("int f(int y) { Supplier<Integer> s = new Supplier<Integer>() { "
                + "public Integer get() { int x = 1; return x; } }; return y + s.get(); }", out);
    }

    @Test
    void testUnknownParameterIsNoRewrite() {
        assertNull(parameters.generate(
                difference(DifferenceType.PARAMETER_NAMING_DIFFERENCE, renames("f", Map.of("zs", "arr"))),
                "int f(int[] items) { return items.length; }"));
    }

    @Test
    void testLocalRename() {
        TransformationHints hints = TransformationHints.builder()
                .put(LocalNamingExplainer.HINT_METHOD, "f")
                .putMap(LocalNamingExplainer.HINT_RENAMES, Map.of("total", "sum"))
                .build();

        String out = locals.generate(difference(DifferenceType.LOCAL_NAMING_DIFFERENCE, hints),
                "int f(int n) { int total = 0; for (int i = 0; i < n; i++) total += i; return total; }");

        assertSameCode("int f(int n) { int sum = 0; for (int i = 0; i < n; i++) sum += i; return sum; }", out);
    }
}
