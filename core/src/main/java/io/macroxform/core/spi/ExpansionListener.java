package io.macroxform.core.spi;

import io.macroxform.core.form.SourceLocation;

/**
 * Observability hooks for the macro engine.
 *
 * <p>
 * All methods receive immutable event records. Implementations MUST be
 * thread-safe and non-blocking. Exceptions thrown by listeners are caught by
 * the engine and logged; they do NOT affect expansion.
 */
public interface ExpansionListener {

    /**
     * Called after a macro is registered.
     *
     * @param event contains name, source, replaced
     */
    void onMacroDefined(MacroDefinedEvent event);

    /**
     * Called after a top-level form expanded successfully.
     *
     * @param event contains the form text, steps taken, durationNanos
     */
    void onFormExpanded(FormExpandedEvent event);

    /**
     * Called when a top-level expansion fails.
     *
     * @param event contains the form text, location, errorType, errorDetail
     */
    void onExpansionFailed(ExpansionFailedEvent event);

    // --- Event records ---

    /** Event emitted when a macro is defined or redefined. */
    record MacroDefinedEvent(String name, String source, boolean replaced) {}

    /** Event emitted when a top-level form has been expanded. */
    record FormExpandedEvent(String form, int steps, long durationNanos) {}

    /** Event emitted when a top-level expansion fails. */
    record ExpansionFailedEvent(String form, SourceLocation location, String errorType, String errorDetail) {}
}
