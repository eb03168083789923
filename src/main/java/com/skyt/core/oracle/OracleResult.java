package com.skyt.core.oracle;

/**
 * Verdict of an {@link Oracle}: whether the code passed, the fraction of
 * checks that passed, and a human-readable detail.
 */
public final class OracleResult {

    private final boolean passed;
    private final double  passRate;
    private final String  detail;

    public OracleResult(boolean passed, double passRate, String detail) {
        this.passed   = passed;
        this.passRate = Math.max(0.0, Math.min(1.0, passRate));
        this.detail   = detail != null ? detail : "";
    }

    public static OracleResult pass(String detail) {
        return new OracleResult(true, 1.0, detail);
    }

    public static OracleResult fail(double passRate, String detail) {
        return new OracleResult(false, passRate, detail);
    }

    public boolean isPassed()   { return passed; }
    public double  getPassRate() { return passRate; }
    public String  getDetail()  { return detail; }

    /** No regression relative to {@code before}: pass rate does not drop, a pass stays a pass. */
    public boolean isNoWorseThan(OracleResult before) {
        if (before == null) return passed;
        if (before.passed && !passed) return false;
        return passRate >= before.passRate;
    }

    @Override
    public String toString() {
        return String.format("OracleResult{passed=%b, passRate=%.2f, detail='%s'}", passed, passRate, detail);
    }
}
