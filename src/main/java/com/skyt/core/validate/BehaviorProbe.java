package com.skyt.core.validate;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.exec.CompilationResult;
import com.skyt.core.exec.FragmentExecutor;
import com.skyt.core.exec.InvocationOutcome;
import com.skyt.core.parse.ParsedSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Black-box equivalence check used when no oracle is available.
 *
 * Both versions are compiled in memory and the fragment's first
 * non-private method is invoked on a fixed battery of inputs chosen by
 * parameter type. Every probe must return deep-equal values or throw the
 * same exception class. An input on which both versions time out says
 * nothing either way and is skipped. Anything else that stops a probe from
 * running (no compiler, no invocable method, an unsupported parameter type,
 * a one-sided timeout) makes the verdict inconclusive, as does a battery
 * on which every input was skipped.
 */
@Component
public class BehaviorProbe {

    private static final Logger log = LoggerFactory.getLogger(BehaviorProbe.class);

    private static final int MAX_TUPLES = 7;

    private static final int[]     INTS     = {0, 1, 2, 5, 10, -1, 100};
    private static final String[]  STRINGS  = {"", "a", "abc", "hello world"};
    private static final boolean[] BOOLEANS = {true, false};
    private static final char[]    CHARS    = {'a', 'Z', '0', ' '};
    private static final int[][]   ARRAYS   = {{}, {1}, {3, 1, 2}, {5, 5}};
    private static final String[][] STRING_ARRAYS = {{}, {"a"}, {"abc", "a"}, {"hello world", "", "abc"}};

    private final FragmentExecutor executor;
    private final long             timeoutMillis;

    public BehaviorProbe(
            FragmentExecutor executor,
            @Value("${skyt.probe.timeout-ms:2000}") long timeoutMillis
    ) {
        this.executor      = executor;
        this.timeoutMillis = timeoutMillis;
    }

    public ProbeVerdict compare(ParsedSource before, ParsedSource after) {
        MethodDeclaration entry = entryMethod(after);
        if (entry == null) {
            return ProbeVerdict.inconclusive("No invocable method in rewritten fragment");
        }
        String name = entry.getNameAsString();

        CompilationResult compiledBefore = executor.compile(before);
        CompilationResult compiledAfter  = executor.compile(after);
        if (!compiledBefore.isSuccess()) {
            return ProbeVerdict.inconclusive("Original does not compile: " + compiledBefore.getDiagnostics());
        }
        if (!compiledAfter.isSuccess()) {
            return ProbeVerdict.inconclusive("Rewrite does not compile: " + compiledAfter.getDiagnostics());
        }

        Method methodBefore = FragmentExecutor.findMethod(compiledBefore.getType(), name);
        Method methodAfter  = FragmentExecutor.findMethod(compiledAfter.getType(), name);
        if (methodBefore == null || methodAfter == null) {
            return ProbeVerdict.inconclusive("Method '" + name + "' missing from one version");
        }

        List<Supplier<Object[]>> tuples = tuples(methodAfter);
        if (tuples == null) {
            return ProbeVerdict.inconclusive("Unsupported parameter types for " + name);
        }

        int probes  = 0;
        int skipped = 0;
        for (Supplier<Object[]> tuple : tuples) {
            InvocationOutcome expected = executor.invoke(methodBefore, tuple.get(), timeoutMillis);
            InvocationOutcome actual   = executor.invoke(methodAfter, tuple.get(), timeoutMillis);
            if (expected.getKind() == InvocationOutcome.Kind.TIMED_OUT
                    && actual.getKind() == InvocationOutcome.Kind.TIMED_OUT) {
                log.debug("[Probe] {} timed out on both versions for probe {}, skipping", name, probes + skipped);
                skipped++;
                continue;
            }
            if (!expected.isConclusive() || !actual.isConclusive()) {
                return ProbeVerdict.inconclusive("Probe " + probes + " of " + name + ": "
                        + expected + " / " + actual);
            }
            if (!expected.sameBehaviorAs(actual)) {
                log.debug("[Probe] {} diverged on probe {}: {} vs {}", name, probes, expected, actual);
                return ProbeVerdict.different(probes + 1,
                        "Probe " + probes + " of " + name + ": " + expected + " became " + actual);
            }
            probes++;
        }
        if (probes == 0) {
            return ProbeVerdict.inconclusive("Every probe of " + name + " timed out on both versions");
        }
        return ProbeVerdict.equivalent(probes);
    }

    // =========================================================================
    // Input battery
    // =========================================================================

    static MethodDeclaration entryMethod(ParsedSource source) {
        for (MethodDeclaration method : source.getMethods()) {
            if (method.getBody().isPresent() && !method.hasModifier(Modifier.Keyword.PRIVATE)) {
                return method;
            }
        }
        return null;
    }

    /**
     * Argument tuples for the method. One parameter: every battery value.
     * Several: up to seven diagonal tuples, the i-th tuple taking each
     * parameter's i-th value (cycling). Null when a parameter type has no
     * battery. Each supplier builds fresh arguments so a mutating method
     * cannot leak state between the two versions.
     */
    static List<Supplier<Object[]>> tuples(Method method) {
        Type[] types = method.getGenericParameterTypes();
        List<List<Supplier<Object>>> columns = new ArrayList<>();
        for (Type type : types) {
            List<Supplier<Object>> values = battery(type);
            if (values == null) return null;
            columns.add(values);
        }

        List<Supplier<Object[]>> tuples = new ArrayList<>();
        if (columns.isEmpty()) {
            tuples.add(() -> new Object[0]);
            return tuples;
        }
        int count = columns.size() == 1
                ? columns.get(0).size()
                : Math.min(MAX_TUPLES, columns.stream().mapToInt(List::size).max().orElse(0));
        for (int i = 0; i < count; i++) {
            int row = i;
            tuples.add(() -> {
                Object[] args = new Object[columns.size()];
                for (int c = 0; c < columns.size(); c++) {
                    List<Supplier<Object>> column = columns.get(c);
                    args[c] = column.get(row % column.size()).get();
                }
                return args;
            });
        }
        return tuples;
    }

    private static List<Supplier<Object>> battery(Type type) {
        List<Supplier<Object>> values = new ArrayList<>();
        if (type == int.class || type == Integer.class) {
            for (int v : INTS) values.add(() -> v);
        } else if (type == long.class || type == Long.class) {
            for (int v : INTS) values.add(() -> (long) v);
        } else if (type == double.class || type == Double.class) {
            for (int v : INTS) values.add(() -> (double) v);
        } else if (type == String.class) {
            for (String v : STRINGS) values.add(() -> v);
        } else if (type == boolean.class || type == Boolean.class) {
            for (boolean v : BOOLEANS) values.add(() -> v);
        } else if (type == char.class || type == Character.class) {
            for (char v : CHARS) values.add(() -> v);
        } else if (type == int[].class) {
            for (int[] v : ARRAYS) values.add(() -> v.clone());
        } else if (type == String[].class) {
            for (String[] v : STRING_ARRAYS) values.add(() -> v.clone());
        } else if (listElement(type) == Integer.class) {
            for (int[] v : ARRAYS) values.add(() -> toList(v));
        } else if (listElement(type) == String.class) {
            for (String[] v : STRING_ARRAYS) values.add(() -> new ArrayList<>(Arrays.asList(v)));
        } else {
            return null;
        }
        return values;
    }

    /** Element type of a {@code List} parameter; a raw list probes as integers. Null for anything else. */
    private static Type listElement(Type type) {
        if (type == List.class) return Integer.class;
        if (!(type instanceof ParameterizedType)) return null;
        ParameterizedType parameterized = (ParameterizedType) type;
        if (parameterized.getRawType() != List.class || parameterized.getActualTypeArguments().length != 1) {
            return null;
        }
        return parameterized.getActualTypeArguments()[0];
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>();
        for (int v : values) list.add(v);
        return list;
    }
}
