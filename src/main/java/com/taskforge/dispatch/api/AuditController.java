package com.taskforge.dispatch.api;

import com.taskforge.core.audit.AuditLogVerifier;
import com.taskforge.core.audit.AuditRecord;
import com.taskforge.core.audit.AuditTrailRecorder;
import com.taskforge.core.audit.VerificationReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Audit trail export and verification.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditLogVerifier verifier;
    private final AuditTrailRecorder recorder;

    public AuditController(AuditLogVerifier verifier, AuditTrailRecorder recorder) {
        this.verifier = verifier;
        this.recorder = recorder;
    }

    /**
     * POST /api/v1/audit/verify: verify a log given as a JSON array or {"entries": [...]}.
     * With {@code gate=true} unsigned and unverified entries are denied too.
     */
    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public VerificationReport verify(@RequestBody String body,
                                     @RequestParam(defaultValue = "false") boolean gate) {
        List<AuditRecord> records = verifier.parse(body);
        return gate ? verifier.gate(records) : verifier.verify(records);
    }

    @GetMapping("/export")
    public List<AuditRecord> export(@RequestParam(required = false) String session) {
        return session == null ? recorder.export() : recorder.exportSession(session);
    }
}
