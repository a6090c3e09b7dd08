package io.sqlbench.eval.runtime.predicate;

import java.util.Locale;

/**
 * Every keyword of the {@code keywords} option occurs in the candidate statements, ignoring case.
 */
public class KeywordUsagePredicate implements VerificationPredicate {

    public static final String KEYWORDS = "keywords";

    @Override
    public boolean test(PredicateContext context) {
        var keywords = PredicateContext.statements(context.spec().option(KEYWORDS));
        if (keywords.isEmpty()) {
            throw new PredicateFailure("keyword_usage requires a non-empty keywords option");
        }
        var text = String.join("\n", context.candidateSql()).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (!text.contains(keyword.toLowerCase(Locale.ROOT))) {
                throw new PredicateFailure("Keyword not used: " + keyword);
            }
        }
        return true;
    }

    @Override
    public boolean requiresConnection() {
        return false;
    }
}
