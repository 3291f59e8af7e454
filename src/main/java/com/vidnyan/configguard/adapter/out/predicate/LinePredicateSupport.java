package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.ArtifactPredicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for predicates that look for declarations anywhere in an artifact.
 * Blank and full-line comment lines never count as declarations.
 */
abstract class LinePredicateSupport implements ArtifactPredicate {

    record NumberedLine(int number, String text) {

        String snippet() {
            return text.trim();
        }
    }

    protected List<NumberedLine> declarationLines(String artifactText) {
        String[] lines = artifactText.split("\\R", -1);
        List<NumberedLine> result = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            result.add(new NumberedLine(i + 1, lines[i]));
        }
        return result;
    }

    protected Optional<NumberedLine> firstDeclaration(String artifactText, Pattern pattern) {
        return declarationLines(artifactText).stream()
                .filter(line -> pattern.matcher(line.text()).find())
                .findFirst();
    }

    protected boolean declares(String artifactText, Pattern pattern) {
        return firstDeclaration(artifactText, pattern).isPresent();
    }

    protected static Optional<String> group(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    protected static Pattern declaration(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Mapping key followed by a value expression, in block style ({@code key: v}), flow style
     * ({@code {a: 1, key: v}}) or JSON ({@code "key": v}).
     */
    protected static Pattern mappingKey(String keys, String valueRegex) {
        return declaration("(?:^|[\\s{,\"'])(?:" + keys + ")[\"']?\\s*:" + valueRegex);
    }
}
