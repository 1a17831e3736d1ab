package com.taskforge.core.audit;

import java.util.List;

/**
 * Outcome of verifying an audit log.
 *
 * @param ok       true when every check passed
 * @param decision "allow" or "deny"
 * @param reason   failure reason, null on success
 * @param total    number of records examined
 * @param checks   names of the checks that were run
 * @param counters provenance counters, present only for gate runs
 */
public record VerificationReport(
    boolean ok,
    String decision,
    String reason,
    int total,
    List<String> checks,
    ProvenanceCounters counters
) {

    public static final String ALLOW = "allow";
    public static final String DENY = "deny";

    static VerificationReport allow(int total, List<String> checks, ProvenanceCounters counters) {
        return new VerificationReport(true, ALLOW, null, total, checks, counters);
    }

    static VerificationReport deny(String reason, int total, List<String> checks, ProvenanceCounters counters) {
        return new VerificationReport(false, DENY, reason, total, checks, counters);
    }

    /**
     * Counts of records lacking provenance data.
     */
    public record ProvenanceCounters(int unsigned, int unverified, int missingDecisionContext) {}
}
