package com.skyt.core.exec;

/**
 * Outcome of compiling a fragment in memory. On success {@link #getType()}
 * holds the loaded class that owns the fragment's methods.
 */
public final class CompilationResult {

    private final boolean  success;
    private final Class<?> type;
    private final String   diagnostics;

    private CompilationResult(boolean success, Class<?> type, String diagnostics) {
        this.success     = success;
        this.type        = type;
        this.diagnostics = diagnostics != null ? diagnostics : "";
    }

    public static CompilationResult success(Class<?> type) {
        return new CompilationResult(true, type, "");
    }

    public static CompilationResult failure(String diagnostics) {
        return new CompilationResult(false, null, diagnostics);
    }

    /** No system compiler: running on a JRE rather than a JDK. */
    public static CompilationResult unavailable() {
        return new CompilationResult(false, null, "No system Java compiler available");
    }

    public boolean  isSuccess()      { return success; }
    public Class<?> getType()        { return type; }
    public String   getDiagnostics() { return diagnostics; }

    @Override
    public String toString() {
        return success ? "CompilationResult{success, type=" + type.getName() + "}"
                       : "CompilationResult{failure: " + diagnostics + "}";
    }
}
