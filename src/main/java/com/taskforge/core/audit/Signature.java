package com.taskforge.core.audit;

/**
 * Signature produced by an {@link AuditSigner}.
 */
public record Signature(String value, String algorithm, String schemaVersion, boolean verified) {}
