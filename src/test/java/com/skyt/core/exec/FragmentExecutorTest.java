package com.skyt.core.exec;

import com.skyt.core.parse.SourceParser;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.*;

class FragmentExecutorTest {

    private final SourceParser     parser   = new SourceParser();
    private final FragmentExecutor executor = new FragmentExecutor();

    private Method compileMethod(String source, String name) {
        CompilationResult result = executor.compile(parser.parse(source));
        assertTrue(result.isSuccess(), result.getDiagnostics());
        Method method = FragmentExecutor.findMethod(result.getType(), name);
        assertNotNull(method);
        return method;
    }

    @Test
    void testWrappedFragmentCompilesIntoHolderClass() {
        CompilationResult result = executor.compile(parser.parse("int twice(int n) { return n * 2; }"));

        assertTrue(result.isSuccess());
        assertEquals(SourceParser.HOLDER_CLASS, result.getType().getName());
    }

    @Test
    void testFullCompilationUnitCompiles() {
        CompilationResult result = executor.compile(parser.parse(
                "package demo;\npublic class Util { public static int twice(int n) { return n * 2; } }"));

        assertTrue(result.isSuccess());
        assertEquals("demo.Util", result.getType().getName());
    }

    @Test
    void testCompilationErrorsAreReported() {
        CompilationResult result = executor.compile(parser.parse("int f(int n) { return missing; }"));

        assertFalse(result.isSuccess());
        assertNull(result.getType());
        assertTrue(result.getDiagnostics().contains("line"));
    }

    @Test
    void testInvokeReturnsValue() {
        Method method = compileMethod("int twice(int n) { return n * 2; }", "twice");

        InvocationOutcome outcome = executor.invoke(method, new Object[] {21}, 2000);

        assertEquals(InvocationOutcome.Kind.RETURNED, outcome.getKind());
        assertEquals(42, outcome.getValue());
        assertTrue(outcome.isConclusive());
    }

    @Test
    void testInvokeReportsThrownException() {
        Method method = compileMethod("int head(int[] xs) { return xs[0]; }", "head");

        InvocationOutcome outcome = executor.invoke(method, new Object[] {new int[0]}, 2000);

        assertEquals(InvocationOutcome.Kind.THREW, outcome.getKind());
        assertEquals(ArrayIndexOutOfBoundsException.class.getName(), outcome.getExceptionClass());
        assertTrue(outcome.isConclusive());
    }

    @Test
    void testInvokeTimesOut() {
        Method method = compileMethod(
                "int slow(int n) throws InterruptedException { Thread.sleep(10000); return n; }", "slow");

        InvocationOutcome outcome = executor.invoke(method, new Object[] {1}, 150);

        assertEquals(InvocationOutcome.Kind.TIMED_OUT, outcome.getKind());
        assertFalse(outcome.isConclusive());
    }

    @Test
    void testInterruptedTimeoutLeavesNoRunaway() throws InterruptedException {
        Method method = compileMethod(
                "int slow(int n) throws InterruptedException { Thread.sleep(10000); return n; }", "slow");

        executor.invoke(method, new Object[] {1}, 100);

        assertTrue(awaitNoRunaways(executor, 5000));
    }

    @Test
    void testRunawayInvocationsBlockFurtherWork() throws InterruptedException {
        FragmentExecutor bounded = new FragmentExecutor(1);
        CompilationResult spinning = bounded.compile(parser.parse(
                "int spin(int n) { long end = System.currentTimeMillis() + 1500; "
                        + "while (System.currentTimeMillis() < end) { } return n; }"));
        CompilationResult quick = bounded.compile(parser.parse("int twice(int n) { return n * 2; }"));
        Method spin  = FragmentExecutor.findMethod(spinning.getType(), "spin");
        Method twice = FragmentExecutor.findMethod(quick.getType(), "twice");

        assertEquals(InvocationOutcome.Kind.TIMED_OUT, bounded.invoke(spin, new Object[] {1}, 100).getKind());
        assertEquals(1, bounded.liveRunaways());

        InvocationOutcome refused = bounded.invoke(twice, new Object[] {2}, 2000);
        assertEquals(InvocationOutcome.Kind.FAILED, refused.getKind());
        assertTrue(refused.getDetail().contains("still running"));

        assertTrue(awaitNoRunaways(bounded, 10000));
        assertEquals(4, bounded.invoke(twice, new Object[] {2}, 2000).getValue());
    }

    @Test
    void testRunawayBoundMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FragmentExecutor(0));
    }

    @Test
    void testInvokeWithWrongArgumentsFails() {
        Method method = compileMethod("int twice(int n) { return n * 2; }", "twice");

        InvocationOutcome outcome = executor.invoke(method, new Object[] {"text"}, 2000);

        assertEquals(InvocationOutcome.Kind.FAILED, outcome.getKind());
    }

    @Test
    void testSameBehaviorComparesDeeply() {
        InvocationOutcome left  = InvocationOutcome.returned(new int[] {1, 2});
        InvocationOutcome right = InvocationOutcome.returned(new int[] {1, 2});
        InvocationOutcome other = InvocationOutcome.returned(new int[] {2, 1});

        assertTrue(left.sameBehaviorAs(right));
        assertFalse(left.sameBehaviorAs(other));
        assertTrue(InvocationOutcome.threw(new IllegalStateException("a"))
                .sameBehaviorAs(InvocationOutcome.threw(new IllegalStateException("b"))));
        assertFalse(InvocationOutcome.timedOut(10).sameBehaviorAs(InvocationOutcome.timedOut(10)));
    }

    @Test
    void testFindMethodReturnsNullWhenAbsent() {
        CompilationResult result = executor.compile(parser.parse("int twice(int n) { return n * 2; }"));

        assertNull(FragmentExecutor.findMethod(result.getType(), "thrice"));
    }

    private static boolean awaitNoRunaways(FragmentExecutor target, long maxWaitMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + maxWaitMillis;
        while (target.liveRunaways() > 0) {
            if (System.currentTimeMillis() > deadline) return false;
            Thread.sleep(50);
        }
        return true;
    }
}
