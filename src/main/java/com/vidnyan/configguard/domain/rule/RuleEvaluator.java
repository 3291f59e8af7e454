package com.vidnyan.configguard.domain.rule;

import java.util.Optional;

/**
 * Interface for rule evaluators.
 * Each evaluator handles one check kind.
 */
public interface RuleEvaluator {

    /**
     * Check kind this evaluator handles.
     */
    RuleDefinition.CheckKind checkKind();

    /**
     * Check if this evaluator can handle the given rule.
     */
    default boolean supports(RuleDefinition rule) {
        return rule.checkKind() == checkKind();
    }

    /**
     * Evaluate the rule against one artifact. At most one finding per rule per artifact.
     */
    Optional<Finding> evaluate(EvaluationContext context);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
