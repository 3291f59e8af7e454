package com.vidnyan.configguard.adapter.out.advice;

import com.vidnyan.configguard.application.port.out.FixAdvisor;
import com.vidnyan.configguard.domain.rule.BuiltInRuleIds;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Static remediation catalog for the bundled rules.
 * Can be replaced with a richer source (docs site, LLM) behind the same port.
 */
@Component
public class CatalogFixAdvisor implements FixAdvisor {

    static final String GENERIC_FIX = "Review and apply the recommended fix for this issue.";

    private static final Map<String, String> FIXES = Map.of(
            BuiltInRuleIds.HARDCODED_SECRET,
            "Pass secrets at runtime via environment variables or a secrets manager: ENV API_KEY=${API_KEY}",
            BuiltInRuleIds.ROOT_USER,
            "Add: RUN useradd -m appuser && USER appuser",
            BuiltInRuleIds.PRIVILEGE_ESCALATION,
            "Set: allowPrivilegeEscalation: false",
            BuiltInRuleIds.LATEST_TAG,
            "Use a specific version: FROM python:3.11-slim",
            BuiltInRuleIds.RESOURCE_LIMITS,
            "Add CPU and memory limits in the resources section",
            BuiltInRuleIds.SECURITY_CONTEXT,
            "Add: runAsNonRoot: true in securityContext",
            BuiltInRuleIds.EXPOSED_PORTS,
            "Remove EXPOSE for database/SSH ports",
            BuiltInRuleIds.HEALTHCHECK,
            "Add: HEALTHCHECK CMD curl -f http://localhost:8080/health || exit 1 (or a livenessProbe)",
            BuiltInRuleIds.WRITABLE_FILESYSTEM,
            "Set: readOnlyRootFilesystem: true when possible",
            BuiltInRuleIds.FULL_BASE_IMAGE,
            "Use a slim variant: python:3.11-slim or node:18-alpine"
    );

    @Override
    public String fixFor(String ruleId) {
        if (ruleId == null) {
            return GENERIC_FIX;
        }
        return FIXES.getOrDefault(ruleId, GENERIC_FIX);
    }
}
