package com.vidnyan.configguard.domain.scan;

/**
 * Deployment gating decision.
 */
public enum GateStatus {
    BLOCKED,            // At least one CRITICAL finding
    REVIEW_REQUIRED,    // HIGH finding, or risk score above the review threshold
    APPROVED
}
