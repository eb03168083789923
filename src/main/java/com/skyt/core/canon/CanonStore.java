package com.skyt.core.canon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyt.config.AnalysisMode;
import com.skyt.core.distance.DistanceCalculator;
import com.skyt.core.distance.DistanceReport;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.oracle.OracleResult;
import com.skyt.core.property.PropertySet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CanonStore: one anchored reference per task, persisted as
 * {@code <store-dir>/<taskId>/canon.json}.
 *
 * A record is written to a temp file beside its final location and moved into
 * place, so readers see either the old record or the new one. Creation holds
 * the store's monitor across the existence check and the write; a second
 * create for the same task is refused unless the caller asks to overwrite.
 */
@Component
public class CanonStore {

    private static final Logger log = LoggerFactory.getLogger(CanonStore.class);

    private static final String  RECORD_FILE = "canon.json";
    private static final Pattern TASK_ID     = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path               storeRoot;
    private final PropertyExtractor  extractor;
    private final DistanceCalculator distanceCalculator;
    private final ObjectMapper       mapper;

    public CanonStore(
            @Value("${skyt.canon.store-dir}") String storeDir,
            PropertyExtractor extractor,
            DistanceCalculator distanceCalculator
    ) {
        this.storeRoot          = Paths.get(storeDir).toAbsolutePath().normalize();
        this.extractor          = extractor;
        this.distanceCalculator = distanceCalculator;
        this.mapper             = new ObjectMapper();
        try {
            Files.createDirectories(storeRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize canon store: " + storeRoot, e);
        }
        log.info("[CanonStore] Store initialized: {}", storeRoot);
    }

    // =========================================================================
    // Anchoring
    // =========================================================================

    public CanonRecord create(String taskId, String code, OracleResult oracleResult, boolean requirePass)
            throws CanonStoreException {
        return create(taskId, code, oracleResult, requirePass, NamingPolicy.permissive(), null, false);
    }

    /**
     * Anchors {@code code} as the canon for {@code taskId}.
     *
     * With {@code requirePass} set, a missing or failing oracle result refuses
     * the anchor before anything touches disk.
     */
    public CanonRecord create(String taskId, String code, OracleResult oracleResult, boolean requirePass,
                              NamingPolicy namingPolicy, String contractId, boolean overwrite)
            throws CanonStoreException {

        Path taskDir = resolveTaskDir(taskId);

        if (requirePass) {
            if (oracleResult == null) {
                throw new CanonCreationRefusedException(taskId,
                        CanonCreationRefusedException.Reason.ORACLE_RESULT_MISSING,
                        "an oracle result is required to anchor a canon");
            }
            if (!oracleResult.isPassed()) {
                log.warn("[CanonStore] Refusing canon for '{}': oracle failed ({})", taskId, oracleResult.getDetail());
                throw new CanonCreationRefusedException(taskId,
                        CanonCreationRefusedException.Reason.ORACLE_FAILED,
                        "oracle did not confirm a behavioral pass: " + oracleResult.getDetail());
            }
        }

        PropertySet properties = extractor.extract(code);
        if (properties.isNullFilled()) {
            throw new CanonCreationRefusedException(taskId,
                    CanonCreationRefusedException.Reason.UNPARSABLE, "canon source does not parse");
        }

        CanonRecord.Provenance provenance = oracleResult == null
                ? new CanonRecord.Provenance(false, 0.0, "not validated")
                : new CanonRecord.Provenance(oracleResult.isPassed(), oracleResult.getPassRate(),
                                             oracleResult.getDetail());

        CanonRecord record = new CanonRecord(taskId, code, properties, provenance,
                namingPolicy, contractId, extractor.getMode(), Instant.now());

        synchronized (this) {
            Path recordFile = taskDir.resolve(RECORD_FILE);
            if (Files.exists(recordFile) && !overwrite) {
                throw new CanonCreationRefusedException(taskId,
                        CanonCreationRefusedException.Reason.DUPLICATE,
                        "a canon already exists; pass overwrite to replace it");
            }
            writeAtomically(taskDir, recordFile, toJson(record));
        }

        log.info("[CanonStore] Anchored canon for '{}' (validated={}, overwrite={})",
                taskId, provenance.isOracleValidated(), overwrite);
        return record;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /** The record for {@code taskId}, or null when none is anchored. */
    public CanonRecord load(String taskId) throws CanonStoreException {
        Path recordFile = resolveTaskDir(taskId).resolve(RECORD_FILE);
        if (!Files.exists(recordFile)) {
            return null;
        }
        try {
            JsonNode root = mapper.readTree(Files.readString(recordFile, StandardCharsets.UTF_8));
            return fromJson(root);
        } catch (IOException | IllegalArgumentException | IllegalStateException | DateTimeException e) {
            throw new CanonStoreException("Corrupt canon record for task '" + taskId + "'", e);
        }
    }

    public CanonRecord require(String taskId) throws CanonStoreException {
        CanonRecord record = load(taskId);
        if (record == null) {
            throw new CanonMissingException(taskId);
        }
        return record;
    }

    public boolean exists(String taskId) throws CanonStoreException {
        return Files.exists(resolveTaskDir(taskId).resolve(RECORD_FILE));
    }

    /**
     * Distance from {@code code} to the task's canon, with the per-property
     * deltas banded by severity.
     */
    public DistanceReport compare(String taskId, String code) throws CanonStoreException {
        CanonRecord record = require(taskId);
        PropertySet canonProperties = snapshotFor(record);
        PropertySet candidate = extractor.extract(code);
        DistanceReport report = distanceCalculator.report(candidate, canonProperties, record.getNamingPolicy());
        log.info("[CanonStore] Compared against '{}': distance={} ({})",
                taskId, String.format("%.3f", report.getDistance()), report.getBand());
        return report;
    }

    /**
     * The record's snapshot, re-extracted from its source when it was taken
     * under a different analysis mode than the one now configured.
     */
    public PropertySet snapshotFor(CanonRecord record) {
        if (record.getAnalysisMode() == extractor.getMode()) {
            return record.getProperties();
        }
        log.info("[CanonStore] Canon '{}' was extracted in {} mode; re-extracting in {}",
                record.getTaskId(), record.getAnalysisMode(), extractor.getMode());
        return extractor.extract(record.getSource());
    }

    public synchronized boolean remove(String taskId) throws CanonStoreException {
        Path taskDir    = resolveTaskDir(taskId);
        Path recordFile = taskDir.resolve(RECORD_FILE);
        try {
            boolean removed = Files.deleteIfExists(recordFile);
            if (Files.isDirectory(taskDir)) {
                try (Stream<Path> rest = Files.list(taskDir)) {
                    if (rest.findAny().isEmpty()) Files.delete(taskDir);
                }
            }
            if (removed) log.info("[CanonStore] Removed canon for '{}'", taskId);
            return removed;
        } catch (IOException e) {
            throw new CanonStoreException("Failed to remove canon for task '" + taskId + "'", e);
        }
    }

    public List<String> listTasks() throws CanonStoreException {
        try (Stream<Path> dirs = Files.list(storeRoot)) {
            return dirs.filter(Files::isDirectory)
                       .filter(d -> Files.exists(d.resolve(RECORD_FILE)))
                       .map(d -> d.getFileName().toString())
                       .sorted()
                       .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CanonStoreException("Failed to list canon store: " + storeRoot, e);
        }
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    private Path resolveTaskDir(String taskId) throws CanonStoreException {
        if (taskId == null || !TASK_ID.matcher(taskId).matches()) {
            throw new CanonStoreException("Invalid task id: '" + taskId + "'");
        }
        Path resolved = storeRoot.resolve(taskId).normalize();
        if (!resolved.startsWith(storeRoot) || resolved.equals(storeRoot)) {
            throw new CanonStoreException("Path traversal attempt detected: " + taskId);
        }
        return resolved;
    }

    private void writeAtomically(Path taskDir, Path recordFile, String content) throws CanonStoreException {
        Path temp = null;
        try {
            Files.createDirectories(taskDir);
            temp = Files.createTempFile(taskDir, RECORD_FILE, ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, recordFile, StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, recordFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new CanonStoreException("Failed to write canon record: " + recordFile, e);
        }
    }

    private String toJson(CanonRecord record) throws CanonStoreException {
        ObjectNode root = mapper.createObjectNode();
        root.put("taskId", record.getTaskId());
        root.put("source", record.getSource());
        root.put("contractId", record.getContractId());
        root.put("analysisMode", record.getAnalysisMode().name());
        root.put("createdAt", record.getCreatedAt() == null ? null : record.getCreatedAt().toString());

        ObjectNode provenance = root.putObject("provenance");
        provenance.put("oracleValidated", record.getProvenance().isOracleValidated());
        provenance.put("passRate", record.getProvenance().getPassRate());
        provenance.put("detail", record.getProvenance().getDetail());

        ObjectNode naming = root.putObject("namingPolicy");
        ArrayNode fixed = naming.putArray("fixed");
        record.getNamingPolicy().getFixedNames().forEach(fixed::add);
        ArrayNode flexible = naming.putArray("flexible");
        record.getNamingPolicy().getFlexibleNames().forEach(flexible::add);
        naming.put("strict", record.getNamingPolicy().isStrict());

        root.set("properties", PropertySetCodec.encode(record.getProperties(), mapper));
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (IOException e) {
            throw new CanonStoreException("Failed to serialize canon record for " + record.getTaskId(), e);
        }
    }

    private CanonRecord fromJson(JsonNode root) {
        JsonNode provenanceNode = root.path("provenance");
        CanonRecord.Provenance provenance = new CanonRecord.Provenance(
                provenanceNode.path("oracleValidated").asBoolean(false),
                provenanceNode.path("passRate").asDouble(0.0),
                textOrNull(provenanceNode, "detail"));

        JsonNode namingNode = root.path("namingPolicy");
        NamingPolicy naming = NamingPolicy.of(
                strings(namingNode.path("fixed")),
                strings(namingNode.path("flexible")),
                namingNode.path("strict").asBoolean(false));

        String createdAt = textOrNull(root, "createdAt");
        String mode      = textOrNull(root, "analysisMode");

        return new CanonRecord(
                root.path("taskId").asText(),
                root.path("source").asText(),
                PropertySetCodec.decode(root.get("properties")),
                provenance,
                naming,
                textOrNull(root, "contractId"),
                mode == null ? AnalysisMode.BASELINE : AnalysisMode.valueOf(mode),
                createdAt == null ? null : Instant.parse(createdAt));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) array.forEach(n -> out.add(n.asText()));
        return out;
    }
}
