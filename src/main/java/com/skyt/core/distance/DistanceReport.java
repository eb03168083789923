package com.skyt.core.distance;

import com.skyt.core.property.PropertyKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Scalar distance plus the per-property breakdown it was averaged from. */
public final class DistanceReport {

    private final double              distance;
    private final List<PropertyDelta> deltas;

    public DistanceReport(double distance, List<PropertyDelta> deltas) {
        this.distance = distance;
        this.deltas   = Collections.unmodifiableList(new ArrayList<>(deltas));
    }

    public double              getDistance() { return distance; }
    public List<PropertyDelta> getDeltas()   { return deltas; }
    public SeverityBand        getBand()     { return SeverityBand.of(distance); }
    public boolean             isIdentical() { return distance == 0.0; }

    public PropertyDelta deltaFor(PropertyKind kind) {
        for (PropertyDelta delta : deltas) {
            if (delta.getKind() == kind) return delta;
        }
        return null;
    }

    /** Properties with nonzero distance, in property order. */
    public List<PropertyDelta> nonZeroDeltas() {
        List<PropertyDelta> result = new ArrayList<>();
        for (PropertyDelta delta : deltas) {
            if (delta.isNonZero()) result.add(delta);
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("DistanceReport{distance=%.4f, differing=%s}", distance, nonZeroDeltas());
    }
}
