package com.skyt.core.distance;

import com.skyt.config.AnalysisModeResolver;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertySet;
import com.skyt.core.property.RecursionSchema;
import com.skyt.core.property.SequenceValue;
import com.skyt.core.property.StructureHashPair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistanceCalculatorTest {

    private final PropertyExtractor extractor =
            new PropertyExtractor(new SourceParser(), new AnalysisModeResolver("baseline"));
    private final DistanceCalculator calculator = new DistanceCalculator();

    @Test
    void testIdenticalSourcesHaveZeroDistance() {
        PropertySet props = extractor.extract("int f(int n) { return n * 2; }");

        DistanceReport report = calculator.report(props, props, NamingPolicy.permissive());

        assertEquals(0.0, report.getDistance());
        assertTrue(report.isIdentical());
        assertTrue(report.nonZeroDeltas().isEmpty());
        assertEquals(SeverityBand.NONE, report.getBand());
    }

    @Test
    void testNullFilledIsMaximallyDistant() {
        PropertySet props = extractor.extract("int f(int n) { return n * 2; }");

        assertEquals(1.0, calculator.distance(PropertySet.nullFilled(), props, null));
        assertEquals(1.0, calculator.distance(props, PropertySet.nullFilled(), null));
        assertEquals(1.0, calculator.distance(PropertySet.nullFilled(), PropertySet.nullFilled(), null));
    }

    @Test
    void testDistanceIsBoundedAndSymmetric() {
        PropertySet a = extractor.extract("int f(int n) { int r = n * 2; return r; }");
        PropertySet b = extractor.extract("int f(int n) { return n * 2; }");

        double ab = calculator.distance(a, b, null);
        double ba = calculator.distance(b, a, null);

        assertTrue(ab > 0.0 && ab < 1.0);
        assertEquals(ab, ba, 1e-12);
        assertTrue(calculator.report(a, b, null).deltaFor(PropertyKind.STATEMENT_ORDERING).isNonZero());
    }

    @Test
    void testRenameOnlyDifferenceDependsOnPolicy() {
        PropertySet candidate = extractor.extract("int f(int[] items) { return items.length; }");
        PropertySet canon = extractor.extract("int f(int[] arr) { return arr.length; }");

        DistanceReport permissive = calculator.report(candidate, canon, NamingPolicy.permissive());
        DistanceReport strict = calculator.report(candidate, canon, NamingPolicy.strictPolicy());

        assertEquals(0.0, permissive.deltaFor(PropertyKind.NORMALIZED_STRUCTURE).getDistance());
        assertEquals(1.0, strict.deltaFor(PropertyKind.NORMALIZED_STRUCTURE).getDistance());
        assertTrue(strict.getDistance() > permissive.getDistance());
    }

    @Test
    void testCompareHashes() {
        StructureHashPair a = new StructureHashPair("lit-a", "inv");
        StructureHashPair b = new StructureHashPair("lit-b", "inv");

        assertEquals(0.0, calculator.compareHashes(a, b, NamingPolicy.permissive()));
        assertEquals(1.0, calculator.compareHashes(a, b, NamingPolicy.strictPolicy()));
    }

    @Test
    void testCompareSequencesAsMultisets() {
        SequenceValue a = SequenceValue.of(List.of("x", "x", "y"));
        SequenceValue b = SequenceValue.of(List.of("x", "y", "z", "w"));

        assertEquals(0.5, calculator.compareSequences(a, b), 1e-12);
        assertEquals(0.0, calculator.compareSequences(SequenceValue.empty(), SequenceValue.empty()));
    }

    @Test
    void testCompareRecursion() {
        RecursionSchema linear = new RecursionSchema(true, RecursionSchema.Branching.LINEAR, 1, 1, false);
        RecursionSchema binary = new RecursionSchema(true, RecursionSchema.Branching.BINARY, 1, 2, false);

        assertEquals(0.0, calculator.compareRecursion(RecursionSchema.nonRecursive(), RecursionSchema.nonRecursive()));
        assertEquals(1.0, calculator.compareRecursion(linear, RecursionSchema.nonRecursive()));
        assertEquals(0.5, calculator.compareRecursion(linear, binary), 1e-12);
    }

    @Test
    void testSeverityBands() {
        assertEquals(SeverityBand.NONE, SeverityBand.of(0.0));
        assertEquals(SeverityBand.MINOR, SeverityBand.of(0.1));
        assertEquals(SeverityBand.MODERATE, SeverityBand.of(0.5));
        assertEquals(SeverityBand.MAJOR, SeverityBand.of(1.0));
    }
}
