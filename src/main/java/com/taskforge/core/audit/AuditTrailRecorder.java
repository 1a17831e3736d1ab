package com.taskforge.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskforge.core.router.CapabilityInvocation;
import com.taskforge.core.router.InvocationHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends one hash-chained {@link AuditRecord} per capability invocation.
 * <p>
 * Records get a global numeric id, a per-session sequence starting at 1 and a
 * SHA-256 {@code entry_hash} over their content and the previous record's hash.
 * Signatures come from the optional {@link AuditSigner}; without one, records are
 * written unsigned and fail verification, which is the expected outcome.
 */
@Component
public class AuditTrailRecorder implements InvocationHook {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailRecorder.class);

    static final int RESULT_PREVIEW_LENGTH = 500;

    private final AuditSigner signer;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private final List<AuditRecord> records = new ArrayList<>();
    private final Map<String, Long> sequences = new HashMap<>();
    private long nextId = 1;
    private String lastHash = "";

    public AuditTrailRecorder(@Autowired(required = false) AuditSigner signer) {
        this.signer = signer;
    }

    @Override
    public void afterInvocation(CapabilityInvocation invocation) throws Exception {
        String preview = preview(invocation.result());
        Signature signature = signer == null ? null
                : signer.sign(invocation.capability(), invocation.args(), preview, invocation.latencyMs());
        String context = decisionContext(invocation);
        AuditRecord record = append(invocation, preview, signature, context);
        log.debug("Audit record {} for {} (session {}, seq {})", record.id(), invocation.capability(),
                record.sessionId(), record.sequence());
    }

    private synchronized AuditRecord append(CapabilityInvocation invocation, String preview,
                                            Signature signature, String context) {
        String id = String.valueOf(nextId++);
        long sequence = sequences.merge(invocation.runId(), 1L, Long::sum);
        String entryHash = sha256(String.join("|", id, invocation.runId(), String.valueOf(sequence), lastHash,
                invocation.capability(), json(invocation.args()), preview, String.valueOf(invocation.latencyMs())));
        AuditRecord record = new AuditRecord(
                id,
                invocation.runId(),
                sequence,
                lastHash,
                entryHash,
                signature == null ? null : signature.value(),
                signature == null ? null : signature.algorithm(),
                signature == null ? null : signature.schemaVersion(),
                signature != null && signature.verified(),
                context);
        records.add(record);
        lastHash = entryHash;
        return record;
    }

    public synchronized List<AuditRecord> export() {
        return List.copyOf(records);
    }

    public synchronized List<AuditRecord> exportSession(String sessionId) {
        return records.stream().filter(r -> sessionId.equals(r.sessionId())).toList();
    }

    public synchronized int size() {
        return records.size();
    }

    private String decisionContext(CapabilityInvocation invocation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("capability", invocation.capability());
        context.put("run_id", invocation.runId());
        context.put("latency_ms", invocation.latencyMs());
        context.put("completed_at", invocation.completedAt().toString());
        return json(context);
    }

    private String preview(Object result) {
        String text = result instanceof String s ? s : json(result);
        return text.length() > RESULT_PREVIEW_LENGTH ? text.substring(0, RESULT_PREVIEW_LENGTH) : text;
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            return String.valueOf(value);
        }
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
