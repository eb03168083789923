package com.skyt.core.distance;

import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertySet;
import com.skyt.core.property.PropertyValue;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.RecursionSchema;
import com.skyt.core.property.SequenceValue;
import com.skyt.core.property.StructureHashPair;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * DistanceCalculator: two property sets → scalar distance in [0, 1].
 *
 * The scalar is the mean over every {@link PropertyKind}. A kind missing from
 * either side contributes 1.0, so a null-filled set is maximally distant from
 * everything, itself included.
 *
 * Per-shape rules:
 *   RECORD          : mismatched keys / union of keys
 *   SEQUENCE        : 1 − multiset overlap / larger length
 *   HASH_PAIR       : 0 or 1; literal hash under a strict naming policy,
 *                     name-invariant hash otherwise
 *   RECURSION_SCHEMA: 1 if only one side recurses; else the mean of branching
 *                     mismatch, base-case difference and call-count difference
 */
@Component
public class DistanceCalculator {

    public double distance(PropertySet candidate, PropertySet canon, NamingPolicy policy) {
        return report(candidate, canon, policy).getDistance();
    }

    public DistanceReport report(PropertySet candidate, PropertySet canon, NamingPolicy policy) {
        NamingPolicy effective = policy == null ? NamingPolicy.permissive() : policy;
        List<PropertyDelta> deltas = new ArrayList<>();
        double sum = 0.0;
        for (PropertyKind kind : PropertyKind.values()) {
            PropertyValue a = candidate == null ? null : candidate.get(kind);
            PropertyValue b = canon == null ? null : canon.get(kind);
            double d = (a == null || b == null) ? 1.0 : compare(a, b, effective);
            deltas.add(new PropertyDelta(kind, d, a, b));
            sum += d;
        }
        return new DistanceReport(sum / PropertyKind.values().length, deltas);
    }

    /** Distance of two values of the same kind. */
    public double compare(PropertyValue a, PropertyValue b, NamingPolicy policy) {
        if (a.getShape() != b.getShape()) return 1.0;
        return switch (a.getShape()) {
            case RECORD           -> compareRecords((RecordValue) a, (RecordValue) b);
            case SEQUENCE         -> compareSequences((SequenceValue) a, (SequenceValue) b);
            case HASH_PAIR        -> compareHashes((StructureHashPair) a, (StructureHashPair) b, policy);
            case RECURSION_SCHEMA -> compareRecursion((RecursionSchema) a, (RecursionSchema) b);
        };
    }

    // =========================================================================
    // Per-shape rules
    // =========================================================================

    double compareRecords(RecordValue a, RecordValue b) {
        Set<String> keys = new TreeSet<>(a.keys());
        keys.addAll(b.keys());
        if (keys.isEmpty()) return 0.0;
        int mismatched = 0;
        for (String key : keys) {
            if (!Objects.equals(a.get(key), b.get(key))) mismatched++;
        }
        return (double) mismatched / keys.size();
    }

    double compareSequences(SequenceValue a, SequenceValue b) {
        int larger = Math.max(a.size(), b.size());
        if (larger == 0) return 0.0;
        Map<String, Integer> counts = new HashMap<>();
        for (String item : a.getItems()) counts.merge(item, 1, Integer::sum);
        int overlap = 0;
        for (String item : b.getItems()) {
            Integer remaining = counts.get(item);
            if (remaining != null && remaining > 0) {
                overlap++;
                counts.put(item, remaining - 1);
            }
        }
        return 1.0 - (double) overlap / larger;
    }

    double compareHashes(StructureHashPair a, StructureHashPair b, NamingPolicy policy) {
        boolean equal = policy.isNameSensitive()
                ? a.getLiteralHash().equals(b.getLiteralHash())
                : a.getNameInvariantHash().equals(b.getNameInvariantHash());
        return equal ? 0.0 : 1.0;
    }

    double compareRecursion(RecursionSchema a, RecursionSchema b) {
        if (a.isRecursive() != b.isRecursive()) return 1.0;
        if (!a.isRecursive()) return 0.0;
        double branching = a.getBranching() == b.getBranching() ? 0.0 : 1.0;
        double baseCases = normalizedDifference(a.getBaseCaseCount(), b.getBaseCaseCount());
        double calls     = normalizedDifference(a.getRecursiveCallCount(), b.getRecursiveCallCount());
        return (branching + baseCases + calls) / 3.0;
    }

    private static double normalizedDifference(int x, int y) {
        int larger = Math.max(Math.max(x, y), 1);
        return (double) Math.abs(x - y) / larger;
    }
}
