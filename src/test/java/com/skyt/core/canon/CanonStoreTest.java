package com.skyt.core.canon;

import com.skyt.config.AnalysisModeResolver;
import com.skyt.core.distance.DistanceCalculator;
import com.skyt.core.distance.DistanceReport;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.oracle.OracleResult;
import com.skyt.core.parse.SourceParser;
import com.skyt.config.AnalysisMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CanonStoreTest {

    private static final String CANON = "int f(int n) { return n * 2; }";

    @TempDir
    Path tempDir;

    private CanonStore store;

    @BeforeEach
    void setUp() {
        store = newStore("baseline");
    }

    private CanonStore newStore(String mode) {
        PropertyExtractor extractor = new PropertyExtractor(new SourceParser(), new AnalysisModeResolver(mode));
        return new CanonStore(tempDir.toString(), extractor, new DistanceCalculator());
    }

    @Test
    void testCreateAndLoad() throws Exception {
        store.create("double-it", CANON, OracleResult.pass("3/3"), true);

        CanonRecord loaded = store.load("double-it");

        assertNotNull(loaded);
        assertEquals(CANON, loaded.getSource());
        assertTrue(loaded.isOracleValidated());
        assertEquals(AnalysisMode.BASELINE, loaded.getAnalysisMode());
        assertFalse(loaded.getProperties().isNullFilled());
        assertTrue(store.exists("double-it"));
    }

    @Test
    void testPropertiesSurviveRoundTrip() throws Exception {
        CanonRecord created = store.create("double-it", CANON, OracleResult.pass("ok"), true);

        assertEquals(created.getProperties(), store.load("double-it").getProperties());
    }

    @Test
    void testFailedOracleRefusesAndWritesNothing() throws Exception {
        CanonCreationRefusedException refused = assertThrows(CanonCreationRefusedException.class,
                () -> store.create("double-it", CANON, OracleResult.fail(0.5, "1/2 passed"), true));

        assertEquals(CanonCreationRefusedException.Reason.ORACLE_FAILED, refused.getReason());
        assertFalse(store.exists("double-it"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void testMissingOracleResultRefused() {
        CanonCreationRefusedException refused = assertThrows(CanonCreationRefusedException.class,
                () -> store.create("double-it", CANON, null, true));

        assertEquals(CanonCreationRefusedException.Reason.ORACLE_RESULT_MISSING, refused.getReason());
    }

    @Test
    void testUnvalidatedAnchorWithoutRequirePass() throws Exception {
        CanonRecord record = store.create("double-it", CANON, null, false);

        assertFalse(record.isOracleValidated());
    }

    @Test
    void testUnparsableCanonRefused() {
        CanonCreationRefusedException refused = assertThrows(CanonCreationRefusedException.class,
                () -> store.create("broken", "int f( {", OracleResult.pass("ok"), true));

        assertEquals(CanonCreationRefusedException.Reason.UNPARSABLE, refused.getReason());
    }

    @Test
    void testDuplicateRefusedUnlessOverwrite() throws Exception {
        store.create("double-it", CANON, OracleResult.pass("ok"), true);

        CanonCreationRefusedException refused = assertThrows(CanonCreationRefusedException.class,
                () -> store.create("double-it", "int f(int n) { return n + n; }", OracleResult.pass("ok"), true));
        assertEquals(CanonCreationRefusedException.Reason.DUPLICATE, refused.getReason());

        store.create("double-it", "int f(int n) { return n + n; }", OracleResult.pass("ok"), true,
                NamingPolicy.strictPolicy(), "double-contract", true);
        CanonRecord replaced = store.load("double-it");
        assertEquals("int f(int n) { return n + n; }", replaced.getSource());
        assertTrue(replaced.getNamingPolicy().isStrict());
        assertEquals("double-contract", replaced.getContractId());
    }

    @Test
    void testCompareAgainstCanon() throws Exception {
        store.create("double-it", CANON, OracleResult.pass("ok"), true);

        DistanceReport same = store.compare("double-it", CANON);
        DistanceReport other = store.compare("double-it", "int f(int n) { int r = n * 2; return r; }");

        assertEquals(0.0, same.getDistance());
        assertTrue(other.getDistance() > 0.0);
    }

    @Test
    void testCompareWithoutCanonFails() {
        CanonMissingException missing = assertThrows(CanonMissingException.class,
                () -> store.compare("nothing-here", CANON));

        assertEquals("nothing-here", missing.getTaskId());
    }

    @Test
    void testLoadMissingReturnsNull() throws Exception {
        assertNull(store.load("nothing-here"));
    }

    @Test
    void testTraversalRejected() {
        assertThrows(CanonStoreException.class, () -> store.load("../escape"));
        assertThrows(CanonStoreException.class, () -> store.create("a/b", CANON, null, false));
        assertThrows(CanonStoreException.class, () -> store.exists(".."));
    }

    @Test
    void testListAndRemove() throws Exception {
        store.create("beta", CANON, OracleResult.pass("ok"), true);
        store.create("alpha", CANON, OracleResult.pass("ok"), true);

        assertEquals(List.of("alpha", "beta"), store.listTasks());
        assertTrue(store.remove("alpha"));
        assertFalse(store.remove("alpha"));
        assertEquals(List.of("beta"), store.listTasks());
    }

    @Test
    void testSnapshotReExtractedUnderOtherMode() throws Exception {
        CanonRecord record = store.create("double-it", CANON, OracleResult.pass("ok"), true);
        CanonStore enhanced = newStore("enhanced");

        CanonRecord loaded = enhanced.load("double-it");

        assertEquals(AnalysisMode.BASELINE, loaded.getAnalysisMode());
        assertNotEquals(record.getProperties(), enhanced.snapshotFor(loaded));
        assertEquals(record.getProperties(), store.snapshotFor(loaded));
    }
}
