package com.taskforge.core.capability;

/**
 * An obligatory follow-up call left behind by a capability.
 *
 * @param requiredCapability the only capability allowed to run next
 * @param triggeredBy        the capability that registered the follow-up
 * @param reason             human-readable explanation shown to the model
 */
public record PendingFollowUp(String requiredCapability, String triggeredBy, String reason) {}
