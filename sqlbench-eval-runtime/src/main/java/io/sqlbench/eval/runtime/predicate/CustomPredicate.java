package io.sqlbench.eval.runtime.predicate;

/**
 * Delegates to the {@link VerificationPredicate} implementation named by the {@code class} option.
 * Classes that do not implement it are rejected before they are initialized.
 */
public class CustomPredicate implements VerificationPredicate {

    public static final String CLASS_KEY = "class";

    private final VerificationPredicate delegate;

    public CustomPredicate(String className) throws ReflectiveOperationException {
        if (className == null) {
            throw new IllegalArgumentException("custom predicate requires the class option");
        }
        var type = Class.forName(className, false, CustomPredicate.class.getClassLoader());
        if (!VerificationPredicate.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(className + " is not a " + VerificationPredicate.class.getSimpleName());
        }
        this.delegate = type.asSubclass(VerificationPredicate.class).getConstructor().newInstance();
    }

    @Override
    public boolean test(PredicateContext context) throws Exception {
        return delegate.test(context);
    }

    @Override
    public boolean requiresConnection() {
        return delegate.requiresConnection();
    }
}
