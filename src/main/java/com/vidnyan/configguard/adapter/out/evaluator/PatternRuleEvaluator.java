package com.vidnyan.configguard.adapter.out.evaluator;

import com.vidnyan.configguard.domain.rule.EvaluationContext;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import com.vidnyan.configguard.domain.rule.RuleEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line-by-line textual search.
 * Reports only the first matching line; alternative expressions are tried in declared order.
 */
@Slf4j
@Component
public class PatternRuleEvaluator implements RuleEvaluator {

    @Override
    public RuleDefinition.CheckKind checkKind() {
        return RuleDefinition.CheckKind.PATTERN;
    }

    @Override
    public Optional<Finding> evaluate(EvaluationContext context) {
        RuleDefinition rule = context.rule();
        List<Pattern> patterns = rule.patterns();
        String[] lines = context.artifactText().split("\\R", -1);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            for (Pattern pattern : patterns) {
                if (pattern.matcher(line).find()) {
                    log.debug("{} matched '{}' at {}:{}", rule.id(), pattern.pattern(),
                            context.artifactKind(), i + 1);
                    return Optional.of(context.findingBuilder()
                            .line(i + 1)
                            .matched(line.trim())
                            .build());
                }
            }
        }
        return Optional.empty();
    }
}
