package com.skyt.core.exec;

import java.util.Arrays;
import java.util.Objects;

/** What happened when a fragment method was invoked once. */
public final class InvocationOutcome {

    public enum Kind {
        /** Method returned normally; value may be null. */
        RETURNED,
        /** Method threw; the exception class is recorded. */
        THREW,
        /** Method did not finish within the time box. */
        TIMED_OUT,
        /** The harness could not invoke the method at all. */
        FAILED
    }

    private final Kind   kind;
    private final Object value;
    private final String exceptionClass;
    private final String detail;

    private InvocationOutcome(Kind kind, Object value, String exceptionClass, String detail) {
        this.kind           = kind;
        this.value          = value;
        this.exceptionClass = exceptionClass;
        this.detail         = detail != null ? detail : "";
    }

    public static InvocationOutcome returned(Object value) {
        return new InvocationOutcome(Kind.RETURNED, value, null, null);
    }

    public static InvocationOutcome threw(Throwable error) {
        return new InvocationOutcome(Kind.THREW, null, error.getClass().getName(), error.getMessage());
    }

    public static InvocationOutcome timedOut(long timeoutMillis) {
        return new InvocationOutcome(Kind.TIMED_OUT, null, null, "Timed out after " + timeoutMillis + " ms");
    }

    public static InvocationOutcome failed(String detail) {
        return new InvocationOutcome(Kind.FAILED, null, null, detail);
    }

    public Kind    getKind()           { return kind; }
    public Object  getValue()          { return value; }
    public String  getExceptionClass() { return exceptionClass; }
    public String  getDetail()         { return detail; }

    /** True when the outcome says something about the method's behavior. */
    public boolean isConclusive() {
        return kind == Kind.RETURNED || kind == Kind.THREW;
    }

    /** Same return value (deep equality) or same exception class. */
    public boolean sameBehaviorAs(InvocationOutcome other) {
        if (other == null || kind != other.kind) return false;
        if (kind == Kind.RETURNED) return Objects.deepEquals(value, other.value);
        if (kind == Kind.THREW)    return Objects.equals(exceptionClass, other.exceptionClass);
        return false;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RETURNED  -> "returned " + render(value);
            case THREW     -> "threw " + exceptionClass;
            case TIMED_OUT, FAILED -> kind + ": " + detail;
        };
    }

    private static String render(Object value) {
        if (value instanceof int[])    return Arrays.toString((int[]) value);
        if (value instanceof long[])   return Arrays.toString((long[]) value);
        if (value instanceof double[]) return Arrays.toString((double[]) value);
        if (value instanceof Object[]) return Arrays.deepToString((Object[]) value);
        return String.valueOf(value);
    }
}
