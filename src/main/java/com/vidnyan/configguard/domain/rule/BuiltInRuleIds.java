package com.vidnyan.configguard.domain.rule;

/**
 * Identifiers of the bundled security rules. The production checklist, recommendations
 * and fix catalog key on these.
 */
public final class BuiltInRuleIds {

    public static final String HARDCODED_SECRET = "HARDCODED-SECRET-001";
    public static final String ROOT_USER = "ROOT-USER-001";
    public static final String PRIVILEGE_ESCALATION = "PRIV-ESCALATION-001";
    public static final String LATEST_TAG = "LATEST-TAG-001";
    public static final String RESOURCE_LIMITS = "RESOURCE-LIMITS-001";
    public static final String SECURITY_CONTEXT = "SECURITY-CONTEXT-001";
    public static final String EXPOSED_PORTS = "EXPOSED-PORTS-001";
    public static final String HEALTHCHECK = "HEALTHCHECK-001";
    public static final String WRITABLE_FILESYSTEM = "WRITABLE-FS-001";
    public static final String FULL_BASE_IMAGE = "FULL-BASE-IMAGE-001";

    private BuiltInRuleIds() {
    }
}
