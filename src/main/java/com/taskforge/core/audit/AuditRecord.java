package com.taskforge.core.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One signed, hash-chained audit log entry in the exchange format read by external gate tools.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AuditRecord(
    @JsonProperty("id") String id,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("sequence") long sequence,
    @JsonProperty("prev_hash") String prevHash,
    @JsonProperty("entry_hash") String entryHash,
    @JsonProperty("signature") String signature,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("signature_schema_version") String signatureSchemaVersion,
    @JsonProperty("verified") boolean verified,
    @JsonProperty("decision_context_json") String decisionContextJson
) {

    long numericId() {
        try {
            return id == null ? 0 : Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
