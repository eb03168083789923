package com.skyt.core.distance;

import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

/** Distance of one property between a candidate and the canon. */
public final class PropertyDelta {

    private final PropertyKind  kind;
    private final double        distance;
    private final SeverityBand  band;
    private final PropertyValue candidateValue;
    private final PropertyValue canonValue;

    public PropertyDelta(PropertyKind kind, double distance,
                         PropertyValue candidateValue, PropertyValue canonValue) {
        this.kind           = kind;
        this.distance       = distance;
        this.band           = SeverityBand.of(distance);
        this.candidateValue = candidateValue;
        this.canonValue     = canonValue;
    }

    public PropertyKind  getKind()           { return kind; }
    public double        getDistance()       { return distance; }
    public SeverityBand  getBand()           { return band; }
    public PropertyValue getCandidateValue() { return candidateValue; }
    public PropertyValue getCanonValue()     { return canonValue; }
    public boolean       isNonZero()         { return distance > 0.0; }

    @Override
    public String toString() {
        return String.format("%s=%.3f(%s)", kind.getKey(), distance, band);
    }
}
