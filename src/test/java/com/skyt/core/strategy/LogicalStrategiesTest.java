package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.LogicalEquivalenceExplainer;
import com.skyt.core.explain.TransformationHints;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.skyt.core.strategy.StrategyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LogicalStrategiesTest {

    private final EmptinessCheckStrategy emptiness = new EmptinessCheckStrategy(PARSER);
    private final BooleanSimplificationStrategy booleans = new BooleanSimplificationStrategy(PARSER);

    private TransformationHints toIsEmpty(String... scopes) {
        return TransformationHints.builder()
                .put(LogicalEquivalenceExplainer.HINT_TARGET_FORM, LogicalEquivalenceExplainer.FORM_IS_EMPTY)
                .putList(LogicalEquivalenceExplainer.HINT_SCOPES, List.of(scopes))
                .build();
    }

    @Test
    void testLengthZeroToIsEmpty() {
        String out = emptiness.generate(difference(DifferenceType.EMPTY_CHECK_FORM, toIsEmpty("x")),
                "boolean f(String x) { return x.length() == 0; }");

        assertSameCode("boolean f(String x) { return x.isEmpty(); }", out);
    }

    @Test
    void testNonEmptyInsideConjunction() {
        String out = emptiness.generate(difference(DifferenceType.EMPTY_CHECK_FORM, toIsEmpty("xs")),
                "boolean f(List<Integer> xs, boolean ok) { return xs.size() > 0 && ok; }");

        assertSameCode("boolean f(List<Integer> xs, boolean ok) { return !xs.isEmpty() && ok; }", out);
    }

    @Test
    void testOnlyHintedScopesChange() {
        assertNull(emptiness.generate(difference(DifferenceType.EMPTY_CHECK_FORM, toIsEmpty("other")),
                "boolean f(String x) { return x.length() == 0; }"));
    }

    @Test
    void testIsEmptyToSizeCompare() {
        TransformationHints hints = TransformationHints.builder()
                .put(LogicalEquivalenceExplainer.HINT_TARGET_FORM, LogicalEquivalenceExplainer.FORM_SIZE_COMPARE)
                .put(LogicalEquivalenceExplainer.HINT_SIZE_METHOD, "size")
                .putList(LogicalEquivalenceExplainer.HINT_SCOPES, List.of("xs"))
                .build();

        String out = emptiness.generate(difference(DifferenceType.EMPTY_CHECK_FORM, hints),
                "boolean f(List<Integer> xs) { return !xs.isEmpty(); }");

        assertSameCode("boolean f(List<Integer> xs) { return xs.size() != 0; }", out);
    }

    @Test
    void testBooleanLiteralComparisonsDropped() {
        String out = booleans.generate(difference(DifferenceType.BOOLEAN_REDUNDANCY, TransformationHints.empty()),
                "boolean f(boolean a, boolean b) { return a == true || (a && b) == false; }");

        assertSameCode("boolean f(boolean a, boolean b) { return a || !(a && b); }", out);
    }

    @Test
    void testNothingToSimplify() {
        assertNull(booleans.generate(difference(DifferenceType.BOOLEAN_REDUNDANCY, TransformationHints.empty()),
                "boolean f(boolean a) { return a; }"));
    }
}
