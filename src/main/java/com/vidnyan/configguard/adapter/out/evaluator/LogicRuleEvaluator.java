package com.vidnyan.configguard.adapter.out.evaluator;

import com.vidnyan.configguard.domain.rule.ArtifactPredicate;
import com.vidnyan.configguard.domain.rule.EvaluationContext;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.PredicateRegistry;
import com.vidnyan.configguard.domain.rule.PredicateResult;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import com.vidnyan.configguard.domain.rule.RuleEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Evaluates a named structural predicate against the artifact as a whole.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogicRuleEvaluator implements RuleEvaluator {

    private final PredicateRegistry predicateRegistry;

    @Override
    public RuleDefinition.CheckKind checkKind() {
        return RuleDefinition.CheckKind.LOGIC;
    }

    @Override
    public Optional<Finding> evaluate(EvaluationContext context) {
        RuleDefinition rule = context.rule();
        ArtifactPredicate predicate = predicateRegistry.require(rule.predicate());

        PredicateResult result = predicate.evaluate(context.artifactText());
        if (!result.violated()) {
            return Optional.empty();
        }

        log.debug("{} predicate {} violated in {}", rule.id(), predicate.name(), context.artifactKind());
        return Optional.of(context.findingBuilder()
                .line(result.line())
                .matched(result.snippet())
                .build());
    }
}
