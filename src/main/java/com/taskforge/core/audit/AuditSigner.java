package com.taskforge.core.audit;

import java.util.Map;

/**
 * External signing service for capability invocations.
 */
public interface AuditSigner {

    /**
     * @return the signature, or null when the signer declines
     */
    Signature sign(String capability, Map<String, Object> args, String resultPreview, long latencyMs) throws Exception;
}
