package io.macroxform.core.engine;

/**
 * Bounds the number of macro expansion steps spent on one top-level form. Turns
 * runaway or self-recursive macros into an
 * {@link io.macroxform.core.error.ExpansionDepthExceededException}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxSteps maximum number of {@code expandOnce} applications per
 *                 top-level form (default: 1000)
 */
public record ExpansionBudget(int maxSteps) {

    /** Default budget: 1000 steps. */
    public static final ExpansionBudget DEFAULT = new ExpansionBudget(1000);

    public ExpansionBudget {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
    }
}
