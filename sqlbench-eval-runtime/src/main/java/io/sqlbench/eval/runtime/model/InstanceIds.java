package io.sqlbench.eval.runtime.model;

import java.util.Comparator;

/**
 * Orders instance ids numerically when both are integers, lexically otherwise. Numeric ids sort first.
 */
public final class InstanceIds {

    public static final Comparator<String> ORDER = InstanceIds::compare;

    private InstanceIds() {
    }

    public static int compare(String a, String b) {
        var left = asLong(a);
        var right = asLong(b);
        if (left != null && right != null) {
            return Long.compare(left, right);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static Long asLong(String id) {
        try {
            return Long.parseLong(id.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
