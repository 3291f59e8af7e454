package com.vidnyan.configguard.adapter.out.evaluator;

import com.vidnyan.configguard.TestFixtures;
import com.vidnyan.configguard.adapter.out.predicate.MissingHealthcheckPredicate;
import com.vidnyan.configguard.adapter.out.predicate.PrivilegeEscalationPredicate;
import com.vidnyan.configguard.domain.artifact.ArtifactKinds;
import com.vidnyan.configguard.domain.rule.EvaluationContext;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LogicRuleEvaluatorTest {

    private final LogicRuleEvaluator evaluator = new LogicRuleEvaluator(TestFixtures.predicateRegistry());

    private static RuleDefinition rule(String predicate, String kind) {
        return RuleDefinition.builder()
                .id("LOGIC-001")
                .severity(RuleDefinition.Severity.MEDIUM)
                .checkKind(RuleDefinition.CheckKind.LOGIC)
                .description("structural check")
                .predicate(predicate)
                .appliesTo(kind)
                .build();
    }

    @Test
    void wholeArtifactViolation_ShouldHaveNoLine() {
        Optional<Finding> finding = evaluator.evaluate(EvaluationContext.of(
                rule(MissingHealthcheckPredicate.NAME, ArtifactKinds.DOCKERFILE),
                ArtifactKinds.DOCKERFILE, "FROM alpine:3.19\n"));

        assertTrue(finding.isPresent());
        assertEquals("structural check", finding.get().message());
        assertNull(finding.get().line());
        assertNull(finding.get().matched());
    }

    @Test
    void localizedViolation_ShouldCarryLineAndSnippet() {
        Optional<Finding> finding = evaluator.evaluate(EvaluationContext.of(
                rule(PrivilegeEscalationPredicate.NAME, ArtifactKinds.KUBERNETES),
                ArtifactKinds.KUBERNETES, "kind: Pod\nallowPrivilegeEscalation: true\n"));

        assertEquals(2, finding.orElseThrow().line());
        assertEquals("allowPrivilegeEscalation: true", finding.get().matched());
    }

    @Test
    void satisfiedPredicate_ShouldProduceNothing() {
        assertTrue(evaluator.evaluate(EvaluationContext.of(
                rule(MissingHealthcheckPredicate.NAME, ArtifactKinds.DOCKERFILE),
                ArtifactKinds.DOCKERFILE, "FROM alpine\nHEALTHCHECK CMD true\n")).isEmpty());
    }
}
