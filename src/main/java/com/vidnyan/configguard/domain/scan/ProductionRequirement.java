package com.vidnyan.configguard.domain.scan;

import com.vidnyan.configguard.domain.rule.BuiltInRuleIds;
import com.vidnyan.configguard.domain.rule.Finding;

import java.util.List;

/**
 * Fixed production-readiness checklist. A requirement is unmet when any finding
 * references its rule.
 */
public enum ProductionRequirement {
    NON_ROOT_USER("Non-root user", BuiltInRuleIds.ROOT_USER),
    PINNED_IMAGE_TAGS("Specific image tags", BuiltInRuleIds.LATEST_TAG),
    RESOURCE_LIMITS("Resource limits", BuiltInRuleIds.RESOURCE_LIMITS),
    SECURITY_CONTEXT("Security context", BuiltInRuleIds.SECURITY_CONTEXT),
    NO_HARDCODED_SECRETS("No hardcoded secrets", BuiltInRuleIds.HARDCODED_SECRET);

    private final String displayName;
    private final String ruleId;

    ProductionRequirement(String displayName, String ruleId) {
        this.displayName = displayName;
        this.ruleId = ruleId;
    }

    public String displayName() {
        return displayName;
    }

    public String ruleId() {
        return ruleId;
    }

    public boolean isUnmetBy(List<Finding> findings) {
        return findings.stream().anyMatch(f -> ruleId.equals(f.ruleId()));
    }
}
