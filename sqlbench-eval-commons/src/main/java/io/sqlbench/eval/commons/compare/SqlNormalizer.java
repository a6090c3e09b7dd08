package io.sqlbench.eval.commons.compare;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Text rewrites applied to SQL before result comparison so that formatting-only differences do not
 * change the outcome.
 */
public final class SqlNormalizer {

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\r\\n]*");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");
    private static final Pattern DISTINCT = Pattern.compile("\\bDISTINCT\\b(?!\\s+ON\\b)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUND_CALL = Pattern.compile("\\bROUND\\s*\\(", Pattern.CASE_INSENSITIVE);

    private SqlNormalizer() {
    }

    public static String normalize(String sql) {
        if (sql == null) {
            return null;
        }
        var result = removeComments(sql);
        result = removeDistinct(result);
        result = removeRound(result);
        return collapse(result);
    }

    public static List<String> normalize(List<String> statements) {
        return statements.stream().map(SqlNormalizer::normalize).toList();
    }

    public static String removeComments(String sql) {
        var result = BLOCK_COMMENT.matcher(sql).replaceAll("");
        result = LINE_COMMENT.matcher(result).replaceAll("");
        return collapse(result);
    }

    /**
     * Drop {@code DISTINCT} keywords. {@code DISTINCT ON (...)} changes which rows are returned and is kept.
     */
    public static String removeDistinct(String sql) {
        return DISTINCT.matcher(sql).replaceAll("");
    }

    /**
     * Replace every {@code ROUND(x, ...)} with {@code x}, innermost calls included. A call without a
     * closing parenthesis is left untouched.
     */
    public static String removeRound(String sql) {
        var result = sql;
        int from = 0;
        while (true) {
            var matcher = ROUND_CALL.matcher(result);
            if (!matcher.find(from)) {
                return result;
            }
            int open = matcher.end() - 1;
            int close = matchingParenthesis(result, open);
            if (close < 0) {
                // skip the malformed call and keep looking after it
                from = matcher.end();
                continue;
            }
            var firstArgument = firstArgument(result.substring(open + 1, close)).strip();
            result = result.substring(0, matcher.start()) + firstArgument + result.substring(close + 1);
            from = matcher.start();
        }
    }

    private static int matchingParenthesis(String text, int open) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String firstArgument(String arguments) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && c == ',' && depth == 0) {
                return arguments.substring(0, i);
            }
        }
        return arguments;
    }

    private static String collapse(String sql) {
        var result = sql;
        String previous;
        do {
            previous = result;
            result = BLANK_LINES.matcher(result).replaceAll("\n");
        } while (!result.equals(previous));
        return result.strip();
    }
}
