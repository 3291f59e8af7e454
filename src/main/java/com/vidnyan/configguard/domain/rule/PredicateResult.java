package com.vidnyan.configguard.domain.rule;

/**
 * Outcome of a LOGIC predicate. Line and snippet are set only when the trigger is line-localizable.
 */
public record PredicateResult(
    boolean violated,
    Integer line,
    String snippet
) {

    private static final PredicateResult SATISFIED = new PredicateResult(false, null, null);
    private static final PredicateResult VIOLATED = new PredicateResult(true, null, null);

    public static PredicateResult satisfied() {
        return SATISFIED;
    }

    public static PredicateResult violation() {
        return VIOLATED;
    }

    public static PredicateResult violatedAt(int line, String snippet) {
        return new PredicateResult(true, line, snippet);
    }
}
