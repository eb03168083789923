package com.skyt.core.validate;

/** Verdict of the validation gate for one rewrite. */
public final class ValidationResult {

    private final boolean         accepted;
    private final RejectionReason reason;
    private final String          detail;
    private final double          distanceAfter;

    private ValidationResult(boolean accepted, RejectionReason reason, String detail, double distanceAfter) {
        this.accepted      = accepted;
        this.reason        = reason;
        this.detail        = detail != null ? detail : "";
        this.distanceAfter = distanceAfter;
    }

    public static ValidationResult accepted(double distanceAfter, String detail) {
        return new ValidationResult(true, null, detail, distanceAfter);
    }

    public static ValidationResult rejected(RejectionReason reason, String detail) {
        return new ValidationResult(false, reason, detail, Double.NaN);
    }

    public boolean         isAccepted()       { return accepted; }
    public RejectionReason getReason()        { return reason; }
    public String          getDetail()        { return detail; }
    /** Distance to the canon after the rewrite; NaN when rejected. */
    public double          getDistanceAfter() { return distanceAfter; }

    @Override
    public String toString() {
        return accepted
                ? "ValidationResult{accepted, distance=" + distanceAfter + "}"
                : "ValidationResult{rejected " + reason + ": " + detail + "}";
    }
}
