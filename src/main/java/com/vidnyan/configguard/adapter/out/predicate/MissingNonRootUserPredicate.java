package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Triggers when no non-root execution user is declared, or when root is declared explicitly.
 * <p>
 * Recognised declarations: Dockerfile {@code USER name}, compose {@code user: name},
 * manifest {@code runAsUser: N} and {@code runAsNonRoot: true}.
 * Root is {@code root} or {@code 0}, optionally followed by {@code :group}.
 */
@Component
public class MissingNonRootUserPredicate extends LinePredicateSupport {

    public static final String NAME = "missing_nonroot_user";

    private static final Pattern DOCKERFILE_USER = declaration("^\\s*USER\\s+([^\\s#:][^\\s#]*)");
    private static final Pattern COMPOSE_USER = mappingKey("user", "\\s*[\"']?([^\\s\"'#,}]+)");
    private static final Pattern RUN_AS_USER = mappingKey("runAsUser", "\\s*[\"']?(\\d+)");
    private static final Pattern RUN_AS_NON_ROOT = mappingKey("runAsNonRoot", "\\s*[\"']?true\\b");

    private static final List<Pattern> USER_DECLARATIONS = List.of(DOCKERFILE_USER, COMPOSE_USER, RUN_AS_USER);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PredicateResult evaluate(String artifactText) {
        boolean nonRootDeclared = false;

        for (NumberedLine line : declarationLines(artifactText)) {
            Optional<String> user = declaredUser(line.text());
            if (user.isPresent() && isRoot(user.get())) {
                return PredicateResult.violatedAt(line.number(), line.snippet());
            }
            if (user.isPresent() || RUN_AS_NON_ROOT.matcher(line.text()).find()) {
                nonRootDeclared = true;
            }
        }

        return nonRootDeclared ? PredicateResult.satisfied() : PredicateResult.violation();
    }

    private Optional<String> declaredUser(String line) {
        for (Pattern pattern : USER_DECLARATIONS) {
            Optional<String> user = group(pattern, line);
            if (user.isPresent()) {
                return user;
            }
        }
        return Optional.empty();
    }

    static boolean isRoot(String user) {
        String name = user.toLowerCase(Locale.ROOT);
        int colon = name.indexOf(':');
        if (colon >= 0) {
            name = name.substring(0, colon);
        }
        return name.equals("root") || name.equals("0");
    }
}
