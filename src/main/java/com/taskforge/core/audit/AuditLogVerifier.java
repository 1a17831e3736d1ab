package com.taskforge.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies audit logs independently of the process that wrote them.
 * <p>
 * Checks, in order: crypto fields present on every record, strictly increasing
 * sequence per session, and an unbroken hash chain over records sorted by id.
 * The first failing check decides the reason.
 */
@Component
public class AuditLogVerifier {

    private static final Logger log = LoggerFactory.getLogger(AuditLogVerifier.class);

    static final List<String> CHECKS = List.of("crypto-fields", "replay", "hash-chain");
    static final List<String> GATE_CHECKS = List.of("crypto-fields", "replay", "hash-chain", "provenance");

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a JSON array of records or an object with an {@code entries} array.
     */
    public List<AuditRecord> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            throw new AuditLogParseException("Audit log is not valid JSON: " + e.getMessage(), e);
        }
        JsonNode entries = root != null && root.isArray() ? root : root == null ? null : root.get("entries");
        if (entries == null || !entries.isArray()) {
            throw new AuditLogParseException("Audit log must be an array of records or an object with an entries array");
        }
        List<AuditRecord> records = new ArrayList<>();
        for (JsonNode node : entries) {
            records.add(new AuditRecord(
                    text(node, "id"),
                    text(node, "session_id"),
                    node.path("sequence").asLong(0),
                    text(node, "prev_hash"),
                    text(node, "entry_hash"),
                    text(node, "signature"),
                    text(node, "algorithm"),
                    text(node, "signature_schema_version"),
                    node.path("verified").asBoolean(false),
                    text(node, "decision_context_json")));
        }
        return records;
    }

    public VerificationReport verify(List<AuditRecord> records) {
        if (records == null || records.isEmpty()) {
            return VerificationReport.deny("No audit entries found", 0, CHECKS, null);
        }
        String failure = firstFailure(records);
        if (failure != null) {
            log.warn("Audit log rejected: {}", failure);
            return VerificationReport.deny(failure, records.size(), CHECKS, null);
        }
        return VerificationReport.allow(records.size(), CHECKS, null);
    }

    /**
     * Runs {@link #verify(List)} and additionally denies logs containing unsigned or
     * unverified records. Missing decision context is counted but does not deny.
     */
    public VerificationReport gate(List<AuditRecord> records) {
        if (records == null || records.isEmpty()) {
            return VerificationReport.deny("No audit entries found", 0, GATE_CHECKS,
                    new VerificationReport.ProvenanceCounters(0, 0, 0));
        }
        int unsigned = 0;
        int unverified = 0;
        int missingContext = 0;
        for (AuditRecord r : records) {
            if (isBlank(r.signature())) {
                unsigned++;
            }
            if (!r.verified()) {
                unverified++;
            }
            if (isBlank(r.decisionContextJson())) {
                missingContext++;
            }
        }
        var counters = new VerificationReport.ProvenanceCounters(unsigned, unverified, missingContext);
        String failure = firstFailure(records);
        if (failure == null && (unsigned > 0 || unverified > 0)) {
            failure = "Provenance gate: " + unsigned + " unsigned, " + unverified + " unverified record(s)";
        }
        return failure == null
                ? VerificationReport.allow(records.size(), GATE_CHECKS, counters)
                : VerificationReport.deny(failure, records.size(), GATE_CHECKS, counters);
    }

    private static String firstFailure(List<AuditRecord> records) {
        String failure = checkCryptoFields(records);
        if (failure == null) {
            failure = checkSequences(records);
        }
        if (failure == null) {
            failure = checkHashChain(records);
        }
        return failure;
    }

    static String checkCryptoFields(List<AuditRecord> records) {
        for (AuditRecord r : records) {
            if (isBlank(r.signature()) || isBlank(r.algorithm())) {
                return "Missing signature/algorithm at id=" + r.id();
            }
            if (isBlank(r.signatureSchemaVersion())) {
                return "Missing signature_schema_version at id=" + r.id();
            }
        }
        return null;
    }

    static String checkSequences(List<AuditRecord> records) {
        Map<String, Long> lastBySession = new HashMap<>();
        for (AuditRecord r : records) {
            String session = isBlank(r.sessionId()) ? "unknown" : r.sessionId();
            long previous = lastBySession.getOrDefault(session, 0L);
            if (r.sequence() <= previous) {
                return "Replay/non-monotonic sequence in session=" + session + ": "
                        + r.sequence() + " <= " + previous;
            }
            lastBySession.put(session, r.sequence());
        }
        return null;
    }

    static String checkHashChain(List<AuditRecord> records) {
        List<AuditRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingLong(AuditRecord::numericId));
        String previousHash = "";
        for (AuditRecord r : ordered) {
            String declared = r.prevHash() == null ? "" : r.prevHash();
            if (!declared.equals(previousHash)) {
                return "Hash chain break at id=" + r.id();
            }
            previousHash = r.entryHash() == null ? "" : r.entryHash();
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
