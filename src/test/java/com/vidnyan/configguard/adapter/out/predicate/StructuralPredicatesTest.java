package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralPredicatesTest {

    private static final String HARDENED_MANIFEST = """
            apiVersion: apps/v1
            kind: Deployment
            spec:
              template:
                spec:
                  securityContext:
                    runAsNonRoot: true
                  containers:
                    - name: app
                      image: registry.example.com/app:1.4.2
                      securityContext:
                        allowPrivilegeEscalation: false
                        readOnlyRootFilesystem: true
                      resources:
                        limits:
                          cpu: 500m
                          memory: 256Mi
                      livenessProbe:
                        httpGet:
                          path: /health
                          port: 8080
            """;

    @Test
    void hardenedManifest_ShouldSatisfyEveryPredicate() {
        assertFalse(new MissingHealthcheckPredicate().evaluate(HARDENED_MANIFEST).violated());
        assertFalse(new MissingResourceLimitsPredicate().evaluate(HARDENED_MANIFEST).violated());
        assertFalse(new PrivilegeEscalationPredicate().evaluate(HARDENED_MANIFEST).violated());
        assertFalse(new MissingSecurityContextPredicate().evaluate(HARDENED_MANIFEST).violated());
    }

    @Test
    void dockerfileHealthcheck_ShouldBeRecognisedUnlessDisabled() {
        MissingHealthcheckPredicate predicate = new MissingHealthcheckPredicate();

        assertFalse(predicate.evaluate("FROM alpine\nHEALTHCHECK CMD curl -f http://localhost/ || exit 1\n")
                .violated());
        assertTrue(predicate.evaluate("FROM alpine\nHEALTHCHECK NONE\n").violated());
        assertTrue(predicate.evaluate("FROM alpine\n# HEALTHCHECK CMD true\n").violated());
    }

    @Test
    void manifestWithoutLimits_ShouldViolate() {
        String manifest = """
                containers:
                  - name: app
                    resources:
                      requests:
                        cpu: 100m
                """;

        assertTrue(new MissingResourceLimitsPredicate().evaluate(manifest).violated());
    }

    @Test
    void privilegeEscalation_ShouldReportDeclaringLine() {
        String manifest = """
                containers:
                  - name: app
                    securityContext:
                      allowPrivilegeEscalation: true
                """;

        PredicateResult result = new PrivilegeEscalationPredicate().evaluate(manifest);

        assertTrue(result.violated());
        assertEquals(4, result.line());
        assertEquals("allowPrivilegeEscalation: true", result.snippet());
    }

    @Test
    void privilegeEscalationAbsent_ShouldBeSatisfied() {
        assertFalse(new PrivilegeEscalationPredicate().evaluate("kind: Pod\n").violated());
    }

    @Test
    void securityContextWithoutRunAsNonRoot_ShouldViolate() {
        String manifest = """
                securityContext:
                  runAsNonRoot: false
                """;

        assertTrue(new MissingSecurityContextPredicate().evaluate(manifest).violated());
    }

    @Test
    void flowStyleManifest_ShouldBeRecognised() {
        String manifest = """
                apiVersion: v1
                kind: Pod
                spec:
                  containers:
                    - name: app
                      image: registry.example.com/app:1.4.2
                      resources: {limits: {cpu: 500m, memory: 256Mi}}
                      securityContext: {allowPrivilegeEscalation: true, runAsNonRoot: true}
                      livenessProbe: {httpGet: {path: /health, port: 8080}}
                """;

        PredicateResult escalation = new PrivilegeEscalationPredicate().evaluate(manifest);

        assertTrue(escalation.violated());
        assertEquals(8, escalation.line());
        assertFalse(new MissingResourceLimitsPredicate().evaluate(manifest).violated());
        assertFalse(new MissingSecurityContextPredicate().evaluate(manifest).violated());
        assertFalse(new MissingHealthcheckPredicate().evaluate(manifest).violated());
    }

    @Test
    void jsonManifest_ShouldBeRecognised() {
        String manifest = """
                {
                  "kind": "Pod",
                  "spec": {
                    "containers": [{
                      "name": "app",
                      "resources": {"limits": {"cpu": "500m"}},
                      "securityContext": {"runAsNonRoot": true, "allowPrivilegeEscalation": true}
                    }]
                  }
                }
                """;

        PredicateResult escalation = new PrivilegeEscalationPredicate().evaluate(manifest);

        assertTrue(escalation.violated());
        assertEquals(7, escalation.line());
        assertFalse(new MissingResourceLimitsPredicate().evaluate(manifest).violated());
        assertFalse(new MissingSecurityContextPredicate().evaluate(manifest).violated());
    }

    @Test
    void flowStyleEscalationDisabled_ShouldBeSatisfied() {
        assertFalse(new PrivilegeEscalationPredicate()
                .evaluate("securityContext: {allowPrivilegeEscalation: false}\n").violated());
    }

    @Test
    void commentedFlowDeclaration_ShouldBeIgnored() {
        assertTrue(new MissingResourceLimitsPredicate()
                .evaluate("# resources: {limits: {cpu: 1}}\nkind: Pod\n").violated());
    }
}
