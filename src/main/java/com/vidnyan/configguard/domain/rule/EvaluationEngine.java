package com.vidnyan.configguard.domain.rule;

import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every rule against every applicable, present artifact.
 * <p>
 * Findings come out in rule order, then in the order each rule lists its artifact kinds.
 * Stateless after construction, so one engine serves concurrent scans.
 */
@Slf4j
public class EvaluationEngine {

    private final List<RuleEvaluator> evaluators;

    public EvaluationEngine(List<RuleEvaluator> evaluators) {
        this.evaluators = List.copyOf(evaluators);
        Set<RuleDefinition.CheckKind> missing = EnumSet.allOf(RuleDefinition.CheckKind.class);
        this.evaluators.forEach(e -> missing.remove(e.checkKind()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No evaluator registered for check kinds " + missing);
        }
    }

    public List<Finding> evaluate(RuleSet ruleSet, ArtifactSet artifacts) {
        return evaluate(ruleSet.rules(), artifacts);
    }

    public List<Finding> evaluate(List<RuleDefinition> rules, ArtifactSet artifacts) {
        List<Finding> findings = new ArrayList<>();

        for (RuleDefinition rule : rules) {
            RuleEvaluator evaluator = findEvaluator(rule);
            for (String kind : rule.appliesTo()) {
                Optional<String> text = artifacts.get(kind);
                if (text.isEmpty()) {
                    continue;
                }
                Optional<Finding> finding = evaluator.evaluate(EvaluationContext.of(rule, kind, text.get()));
                if (finding.isPresent()) {
                    log.debug("  {} triggered in {} (line {})", rule.id(), kind, finding.get().line());
                    findings.add(finding.get());
                }
            }
        }

        log.debug("Evaluated {} rules against {} artifacts: {} findings",
                rules.size(), artifacts.size(), findings.size());
        return findings;
    }

    private RuleEvaluator findEvaluator(RuleDefinition rule) {
        return evaluators.stream()
                .filter(e -> e.supports(rule))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No evaluator for rule " + rule.id()));
    }
}
